package org.declhoist.impl;

import com.google.common.base.Preconditions;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.declhoist.Form;
import org.declhoist.FormPrinter;
import org.declhoist.FormVisitor;

/**
 * Scope that code nested anywhere in {@link #getBody()} can leave early by exiting with
 * {@link #getLabel()} and a value, which then becomes the value of this scope.
 *
 * <p>
 * This node only carries the label. Carrying out the exit is up to whoever evaluates the tree.
 *
 * @see org.declhoist.NamedScopeWrapper
 */
public final class LabeledScopeForm implements Form {
    private final SymbolForm label;
    private final Form body;

    public LabeledScopeForm(@NonNull SymbolForm label, @NonNull Form body) {
        this.label = Preconditions.checkNotNull(label, "label");
        this.body = Preconditions.checkNotNull(body, "body");
    }

    @NonNull
    public SymbolForm getLabel() {
        return label;
    }

    @NonNull
    public Form getBody() {
        return body;
    }

    public <T> T accept(FormVisitor<T> v) {
        return v.visitLabeledScope(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof LabeledScopeForm)) return false;
        LabeledScopeForm that = (LabeledScopeForm) o;
        return label.equals(that.label) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, body);
    }

    @Override
    public String toString() {
        return FormPrinter.print(this);
    }

    private static final long serialVersionUID = 1L;
}
