package org.declhoist.host;

/**
 * Read of, or assignment to, a name that no enclosing scope binds.
 */
public class UnboundVariableException extends EvaluationException {
    private final String name;

    public UnboundVariableException(String name) {
        super("Unbound variable: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    private static final long serialVersionUID = 1L;
}
