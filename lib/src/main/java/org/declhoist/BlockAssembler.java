package org.declhoist;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.declhoist.impl.BlockScopedForm;

/**
 * Turns a {@link HoistResult} into "declare these names, undefined, then run this body".
 */
public final class BlockAssembler {
    @NonNull
    public BlockScopedForm assemble(@NonNull HoistResult result) {
        return new BlockScopedForm(result.getNames(), result.getBody());
    }
}
