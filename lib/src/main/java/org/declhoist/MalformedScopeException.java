package org.declhoist;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.declhoist.impl.CompoundForm;

/**
 * A block macro call that {@link HoistTransformer#expand(CompoundForm)} cannot take apart,
 * such as a named block without a symbol for its label.
 */
public class MalformedScopeException extends HoistingException {
    private final CompoundForm form;

    public MalformedScopeException(@NonNull CompoundForm form, String reason) {
        super("Malformed block " + FormPrinter.print(form) + ": " + reason);
        this.form = form;
    }

    @NonNull
    public CompoundForm getForm() {
        return form;
    }

    private static final long serialVersionUID = 1L;
}
