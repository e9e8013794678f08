package org.declhoist.host;

import org.declhoist.FormPrinter;
import org.declhoist.impl.CompoundForm;

/**
 * A special form such as {@code (exit ...)} or {@code (if ...)} with the wrong shape.
 */
public class MalformedFormException extends EvaluationException {
    private final CompoundForm form;

    public MalformedFormException(CompoundForm form, String reason) {
        super("Malformed form " + FormPrinter.print(form) + ": " + reason);
        this.form = form;
    }

    public CompoundForm getForm() {
        return form;
    }

    private static final long serialVersionUID = 1L;
}
