package org.declhoist;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.declhoist.impl.SymbolForm;

/**
 * The same name is declared twice in one block.
 *
 * Always reported against the second declaration; the first one was already accepted.
 */
public class DuplicateDeclarationException extends HoistingException {
    private final SymbolForm name;
    private final int position;
    private final int firstPosition;

    public DuplicateDeclarationException(@NonNull SymbolForm name, int position, int firstPosition) {
        super("Duplicate declaration of " + name.getName() + " at position " + position
                + "; already declared at position " + firstPosition);
        this.name = name;
        this.position = position;
        this.firstPosition = firstPosition;
    }

    @NonNull
    public SymbolForm getName() {
        return name;
    }

    /**
     * Zero-based index of the rejected declaration.
     */
    public int getPosition() {
        return position;
    }

    /**
     * Zero-based index of the declaration that introduced the name.
     */
    public int getFirstPosition() {
        return firstPosition;
    }

    private static final long serialVersionUID = 1L;
}
