package org.declhoist;

import org.declhoist.impl.AssignmentForm;
import org.declhoist.impl.BlockScopedForm;
import org.declhoist.impl.CompoundForm;
import org.declhoist.impl.ConstantForm;
import org.declhoist.impl.LabeledScopeForm;
import org.declhoist.impl.SymbolForm;

/**
 * Double-dispatch over the concrete {@link Form} types.
 */
public interface FormVisitor<T> {
    T visitSymbol(SymbolForm symbol);

    T visitConstant(ConstantForm constant);

    T visitCompound(CompoundForm compound);

    T visitAssignment(AssignmentForm assignment);

    T visitBlockScoped(BlockScopedForm block);

    T visitLabeledScope(LabeledScopeForm scope);
}
