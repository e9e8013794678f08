package org.declhoist.impl;

import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Objects;
import org.declhoist.Form;
import org.declhoist.FormPrinter;
import org.declhoist.FormVisitor;
import org.declhoist.Undefined;

/**
 * Creates a new lexical scope, binds every one of {@link #getNames()} to {@link Undefined},
 * then evaluates {@link #getBody()} in order inside that scope.
 *
 * @see org.declhoist.BlockAssembler
 */
public final class BlockScopedForm implements Form {
    private final ImmutableList<SymbolForm> names;
    private final ImmutableList<Form> body;

    public BlockScopedForm(@NonNull List<SymbolForm> names, @NonNull List<? extends Form> body) {
        this.names = ImmutableList.copyOf(names);
        this.body = ImmutableList.copyOf(body);
    }

    /**
     * Bound names, in the order they are bound.
     */
    @NonNull
    public ImmutableList<SymbolForm> getNames() {
        return names;
    }

    @NonNull
    public ImmutableList<Form> getBody() {
        return body;
    }

    public <T> T accept(FormVisitor<T> v) {
        return v.visitBlockScoped(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BlockScopedForm)) return false;
        BlockScopedForm that = (BlockScopedForm) o;
        return names.equals(that.names) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, body);
    }

    @Override
    public String toString() {
        return FormPrinter.print(this);
    }

    private static final long serialVersionUID = 1L;
}
