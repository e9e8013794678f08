package org.declhoist.host;

import java.io.Serializable;

/**
 * Abstracts away interactions with host objects, for example to provide an opportunity to intercept calls.
 *
 * <p>
 * During evaluation, {@link Invoker} is available from {@link Env#getInvoker()}.
 *
 * @see Envs#empty(Invoker)
 */
public interface Invoker extends Serializable {
    /**
     * Default instance to be used.
     */
    Invoker INSTANCE = new DefaultInvoker();

    /**
     * Calls {@code function} with the given arguments. Whatever {@code function} throws is
     * propagated unchanged.
     */
    Object call(Object function, Object[] args) throws Throwable;

    /**
     * Decides which branch of {@code (if ...)} runs.
     */
    boolean isTrue(Object value);
}
