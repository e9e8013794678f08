package org.declhoist;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.declhoist.impl.CompoundForm;

/**
 * A form headed by the declaration marker that isn't {@code (marker name init)}
 * with a symbol for {@code name}.
 */
public class MalformedDeclarationException extends HoistingException {
    private final CompoundForm form;
    private final int position;

    public MalformedDeclarationException(@NonNull CompoundForm form, int position, String reason) {
        super("Malformed declaration " + FormPrinter.print(form) + " at position " + position + ": " + reason);
        this.form = form;
        this.position = position;
    }

    /**
     * The offending declaration, as it appeared in the input.
     */
    @NonNull
    public CompoundForm getForm() {
        return form;
    }

    /**
     * Zero-based index of the declaration in the block.
     */
    public int getPosition() {
        return position;
    }

    private static final long serialVersionUID = 1L;
}
