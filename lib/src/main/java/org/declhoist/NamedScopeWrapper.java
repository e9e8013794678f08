package org.declhoist;

import com.google.common.base.Preconditions;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.declhoist.impl.LabeledScopeForm;
import org.declhoist.impl.SymbolForm;

/**
 * Wraps an assembled block into a scope that can be exited early by its label.
 *
 * <pre>
 * (block L (let (...) body...))
 * </pre>
 *
 * Nothing else changes: the exits inside the body are left for the evaluator to honour.
 */
public final class NamedScopeWrapper {
    private final BlockAssembler assembler;

    public NamedScopeWrapper(@NonNull BlockAssembler assembler) {
        this.assembler = Preconditions.checkNotNull(assembler, "assembler");
    }

    @NonNull
    public LabeledScopeForm wrapNamed(@NonNull SymbolForm label, @NonNull HoistResult result) {
        return new LabeledScopeForm(label, assembler.assemble(result));
    }
}
