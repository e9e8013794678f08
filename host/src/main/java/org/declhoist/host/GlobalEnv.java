package org.declhoist.host;

import com.google.common.base.Preconditions;
import java.util.HashMap;
import java.util.Map;
import org.declhoist.Undefined;

/**
 * Bottom of every {@link Env} chain: the bindings the host supplies, typically its functions.
 *
 * Names declared directly here become new globals; assigning to an unknown name fails.
 */
public class GlobalEnv implements Env {
    private final Map<String, Object> globals;
    private final Invoker invoker;

    public GlobalEnv(Map<String, ?> globals, Invoker invoker) {
        this.globals = new HashMap<>(globals);
        this.invoker = Preconditions.checkNotNull(invoker, "invoker");
    }

    public void declareVariable(String name) {
        globals.put(name, Undefined.INSTANCE);
    }

    public Object getLocalVariable(String name) throws UnboundVariableException {
        if (!globals.containsKey(name)) throw new UnboundVariableException(name);
        return globals.get(name);
    }

    public void setLocalVariable(String name, Object value) throws UnboundVariableException {
        if (!globals.containsKey(name)) throw new UnboundVariableException(name);
        globals.put(name, value);
    }

    public Invoker getInvoker() {
        return invoker;
    }

    private static final long serialVersionUID = 1L;
}
