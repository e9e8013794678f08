package org.declhoist.host;

import org.declhoist.impl.SymbolForm;

/**
 * An exit that no enclosing labeled scope answers to.
 */
public class UnknownLabelException extends EvaluationException {
    private final SymbolForm label;

    public UnknownLabelException(SymbolForm label) {
        super("No enclosing scope named " + label.getName());
        this.label = label;
    }

    public SymbolForm getLabel() {
        return label;
    }

    private static final long serialVersionUID = 1L;
}
