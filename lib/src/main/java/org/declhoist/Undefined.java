package org.declhoist;

import java.io.Serializable;

/**
 * Value held by a hoisted variable between the start of its block and its declaration site.
 *
 * @see org.declhoist.impl.BlockScopedForm
 */
public final class Undefined implements Serializable {
    public static final Undefined INSTANCE = new Undefined();

    private Undefined() {}

    public Object readResolve() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "#<undefined>";
    }

    private static final long serialVersionUID = 1L;
}
