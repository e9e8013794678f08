package org.declhoist.host;

import java.util.Collections;
import java.util.Map;

/**
 * Utility factory methods for {@link Env}.
 */
public class Envs {
    /**
     * The most plain vanilla environment suitable for outer-most use.
     */
    public static Env empty() {
        return empty(Invoker.INSTANCE);
    }

    /**
     * Works like {@link #empty()} except it allows a custom {@link Invoker}.
     */
    public static Env empty(Invoker inv) {
        return new GlobalEnv(Collections.emptyMap(), inv);
    }

    /**
     * Outer-most environment that starts out with the given bindings.
     */
    public static Env of(Map<String, ?> globals) {
        return of(globals, Invoker.INSTANCE);
    }

    public static Env of(Map<String, ?> globals, Invoker inv) {
        return new GlobalEnv(globals, inv);
    }
}
