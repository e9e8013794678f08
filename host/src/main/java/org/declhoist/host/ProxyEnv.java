package org.declhoist.host;

/**
 * {@link Env} that delegates to another {@link Env}.
 *
 * Useful base class for {@link Env} impls.
 */
public class ProxyEnv implements Env {
    protected final Env parent;

    public ProxyEnv(Env parent) {
        this.parent = parent;
    }

    public void declareVariable(String name) {
        parent.declareVariable(name);
    }

    public Object getLocalVariable(String name) throws UnboundVariableException {
        return parent.getLocalVariable(name);
    }

    public void setLocalVariable(String name, Object value) throws UnboundVariableException {
        parent.setLocalVariable(name, value);
    }

    public Invoker getInvoker() {
        return parent.getInvoker();
    }

    private static final long serialVersionUID = 1L;
}
