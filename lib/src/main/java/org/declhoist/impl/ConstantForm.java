package org.declhoist.impl;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import java.util.Objects;
import org.declhoist.Form;
import org.declhoist.FormPrinter;
import org.declhoist.FormVisitor;

/**
 * Literal value.
 */
public final class ConstantForm implements Form {
    public static final ConstantForm NULL = new ConstantForm(null);

    @CheckForNull
    private final Object value;

    public ConstantForm(@CheckForNull Object value) {
        this.value = value;
    }

    @CheckForNull
    public Object getValue() {
        return value;
    }

    public <T> T accept(FormVisitor<T> v) {
        return v.visitConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConstantForm && Objects.equals(((ConstantForm) o).value, value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return FormPrinter.print(this);
    }

    private static final long serialVersionUID = 1L;
}
