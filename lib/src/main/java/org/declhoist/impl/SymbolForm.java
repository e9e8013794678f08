package org.declhoist.impl;

import com.google.common.base.Preconditions;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.declhoist.Form;
import org.declhoist.FormPrinter;
import org.declhoist.FormVisitor;

/**
 * Identifier: a variable name, a function name, a declaration marker or a scope label.
 *
 * Two symbols are equal when their names are.
 */
public final class SymbolForm implements Form {
    private final String name;

    public SymbolForm(@NonNull String name) {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkArgument(!name.isEmpty(), "symbol name cannot be empty");
        this.name = name;
    }

    @NonNull
    public String getName() {
        return name;
    }

    public <T> T accept(FormVisitor<T> v) {
        return v.visitSymbol(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SymbolForm && ((SymbolForm) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return FormPrinter.print(this);
    }

    private static final long serialVersionUID = 1L;
}
