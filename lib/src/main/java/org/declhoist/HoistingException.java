package org.declhoist;

/**
 * Signals that a block cannot be transformed.
 *
 * <p>
 * Transformation is all or nothing: when this is thrown, no partially transformed tree exists.
 *
 * @see MalformedDeclarationException
 * @see DuplicateDeclarationException
 * @see MalformedScopeException
 */
public abstract class HoistingException extends Exception {
    protected HoistingException(String message) {
        super(message);
    }

    private static final long serialVersionUID = 1L;
}
