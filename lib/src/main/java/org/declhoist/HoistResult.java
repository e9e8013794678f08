package org.declhoist;

import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import org.declhoist.impl.SymbolForm;

/**
 * What {@link Hoister} produces from one block.
 *
 * @see BlockAssembler
 * @see NamedScopeWrapper
 */
public final class HoistResult implements Serializable {
    private final ImmutableList<SymbolForm> names;
    private final ImmutableList<Form> body;

    public HoistResult(@NonNull List<SymbolForm> names, @NonNull List<? extends Form> body) {
        this.names = ImmutableList.copyOf(names);
        this.body = ImmutableList.copyOf(body);
    }

    /**
     * Declared names, unique, in the order their declarations appear.
     */
    @NonNull
    public ImmutableList<SymbolForm> getNames() {
        return names;
    }

    /**
     * The block with every declaration replaced in place by an assignment.
     * Same length as the input.
     */
    @NonNull
    public ImmutableList<Form> getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof HoistResult)) return false;
        HoistResult that = (HoistResult) o;
        return names.equals(that.names) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, body);
    }

    @Override
    public String toString() {
        return "names=" + FormPrinter.print(names) + " body=" + FormPrinter.print(body);
    }

    private static final long serialVersionUID = 1L;
}
