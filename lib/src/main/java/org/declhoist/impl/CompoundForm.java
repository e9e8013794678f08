package org.declhoist.impl;

import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.declhoist.Form;
import org.declhoist.FormPrinter;
import org.declhoist.FormVisitor;

/**
 * {@code (head arg1 arg2 ...)}
 *
 * <p>
 * A function call, a declaration, a host special form such as {@code (exit L v)}, or a nested
 * block that the transformation treats as opaque. What it means is up to whoever consumes it.
 */
public final class CompoundForm implements Form {
    private final ImmutableList<Form> elements;

    public CompoundForm(@NonNull List<? extends Form> elements) {
        this.elements = ImmutableList.copyOf(elements);
    }

    public CompoundForm(Form... elements) {
        this.elements = ImmutableList.copyOf(elements);
    }

    @NonNull
    public ImmutableList<Form> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public Form get(int i) {
        return elements.get(i);
    }

    /**
     * First element, or null for {@code ()}.
     */
    @CheckForNull
    public Form head() {
        return elements.isEmpty() ? null : elements.get(0);
    }

    /**
     * Everything after the head.
     */
    @NonNull
    public ImmutableList<Form> tail() {
        return elements.isEmpty() ? elements : elements.subList(1, elements.size());
    }

    /**
     * True if the first element is the given symbol.
     */
    public boolean isHeadedBy(SymbolForm symbol) {
        return symbol.equals(head());
    }

    public <T> T accept(FormVisitor<T> v) {
        return v.visitCompound(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CompoundForm && ((CompoundForm) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return FormPrinter.print(this);
    }

    private static final long serialVersionUID = 1L;
}
