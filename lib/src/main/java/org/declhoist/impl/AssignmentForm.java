package org.declhoist.impl;

import com.google.common.base.Preconditions;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.declhoist.Form;
import org.declhoist.FormPrinter;
import org.declhoist.FormVisitor;

/**
 * {@code name = init}, left where the declaration of {@code name} used to be.
 *
 * @see org.declhoist.Hoister
 */
public final class AssignmentForm implements Form {
    private final SymbolForm name;
    private final Form init;

    public AssignmentForm(@NonNull SymbolForm name, @NonNull Form init) {
        this.name = Preconditions.checkNotNull(name, "name");
        this.init = Preconditions.checkNotNull(init, "init");
    }

    @NonNull
    public SymbolForm getName() {
        return name;
    }

    @NonNull
    public Form getInit() {
        return init;
    }

    public <T> T accept(FormVisitor<T> v) {
        return v.visitAssignment(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AssignmentForm)) return false;
        AssignmentForm that = (AssignmentForm) o;
        return name.equals(that.name) && init.equals(that.init);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, init);
    }

    @Override
    public String toString() {
        return FormPrinter.print(this);
    }

    private static final long serialVersionUID = 1L;
}
