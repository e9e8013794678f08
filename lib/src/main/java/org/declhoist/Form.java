package org.declhoist;

import java.io.Serializable;

/**
 * Node of an expression tree handed to, and produced by, {@link HoistTransformer}.
 *
 * <p>
 * Forms are immutable. Input trees are made of symbols, constants and compound forms;
 * the transformation adds assignments, block scopes and labeled scopes.
 * Use {@link FormBuilder} to put trees together.
 *
 * @see FormPrinter
 */
public interface Form extends Serializable {
    /**
     * Dispatches to the {@code visitXyz} method of the given visitor that matches this node.
     */
    <T> T accept(FormVisitor<T> v);
}
