package org.declhoist;

import com.google.common.base.Preconditions;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.declhoist.impl.CompoundForm;
import org.declhoist.impl.SymbolForm;

/**
 * Tells declarations apart from ordinary forms.
 *
 * <p>
 * Only the head is looked at. {@code (var)} and {@code (var x 1 2)} are still declarations,
 * so that {@link Hoister} rejects them instead of letting them through as ordinary code.
 */
public final class FormClassifier {
    private final SymbolForm marker;

    public FormClassifier(@NonNull SymbolForm marker) {
        this.marker = Preconditions.checkNotNull(marker, "marker");
    }

    @NonNull
    public FormKind classify(@NonNull Form f) {
        return isDeclarationCandidate(f) ? FormKind.DECLARATION : FormKind.ORDINARY;
    }

    public boolean isDeclarationCandidate(@NonNull Form f) {
        return f instanceof CompoundForm && ((CompoundForm) f).isHeadedBy(marker);
    }

    @NonNull
    public SymbolForm getMarker() {
        return marker;
    }
}
