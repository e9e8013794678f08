package org.declhoist.host;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Serializable;

/**
 * Represents an environment in which a form is evaluated.
 *
 * Forms are instructions and {@link Env} is data.
 *
 * <p>
 * Environments form a chain: each {@link BlockScopeEnv} sits on top of the one that was current
 * when its block started, down to a {@link GlobalEnv} holding the host bindings.
 */
public interface Env extends Serializable {
    /**
     * Defines a local variable in the current environment, holding {@link org.declhoist.Undefined}.
     *
     * @param name
     *      Name of the local variable.
     */
    void declareVariable(@NonNull String name);

    /**
     * Obtains the current value of the nearest binding of {@code name}.
     */
    Object getLocalVariable(@NonNull String name) throws UnboundVariableException;

    /**
     * Sets the nearest binding of {@code name} to a new value.
     */
    void setLocalVariable(@NonNull String name, Object value) throws UnboundVariableException;

    /**
     * {@link Invoker} is typically scoped at the whole execution.
     *
     * @return never null
     */
    Invoker getInvoker();
}
