package org.declhoist;

import com.google.common.base.Preconditions;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.declhoist.impl.BlockScopedForm;
import org.declhoist.impl.CompoundForm;
import org.declhoist.impl.LabeledScopeForm;
import org.declhoist.impl.SymbolForm;

/**
 * Rewrites a block with declarations scattered through it into a block that binds all of them upfront.
 *
 * <pre>
 * (with-vars (doThis) (var a b) (doThat b) (var c a) (doOther c))
 * </pre>
 *
 * becomes
 *
 * <pre>
 * (let ((a #&lt;undefined&gt;) (c #&lt;undefined&gt;))
 *   (doThis) (set! a b) (doThat b) (set! c a) (doOther c))
 * </pre>
 *
 * and the named variant {@code (with-vars/named L ...)} additionally wraps that in {@code (block L ...)}.
 *
 * <p>
 * Hosts either call {@link #transform(List)} / {@link #transformNamed(SymbolForm, List)} on a body they
 * already took apart, or hand macro calls to {@link #expand(CompoundForm)}.
 *
 * <p>
 * Thread-safe; a single instance can serve any number of concurrent transformations.
 */
public class HoistTransformer {
    private final SymbolForm blockMacro;
    private final SymbolForm namedBlockMacro;
    private final Hoister hoister;
    private final BlockAssembler assembler;
    private final NamedScopeWrapper wrapper;

    public HoistTransformer() {
        this(new HoistConfiguration());
    }

    public HoistTransformer(@NonNull HoistConfiguration config) {
        Preconditions.checkNotNull(config, "config");
        this.blockMacro = config.getBlockMacro();
        this.namedBlockMacro = config.getNamedBlockMacro();
        this.hoister = new Hoister(new FormClassifier(config.getDeclarationMarker()));
        this.assembler = new BlockAssembler();
        this.wrapper = new NamedScopeWrapper(assembler);
    }

    /**
     * Runs only the hoisting pass, for hosts that want to assemble the result themselves.
     */
    @NonNull
    public HoistResult hoist(@NonNull List<? extends Form> body) throws HoistingException {
        return hoister.hoist(body);
    }

    @NonNull
    public BlockScopedForm transform(@NonNull List<? extends Form> body) throws HoistingException {
        return assembler.assemble(hoister.hoist(body));
    }

    @NonNull
    public LabeledScopeForm transformNamed(@NonNull SymbolForm label, @NonNull List<? extends Form> body)
            throws HoistingException {
        Preconditions.checkNotNull(label, "label");
        return wrapper.wrapNamed(label, hoister.hoist(body));
    }

    /**
     * True if the given form is a call to either block macro and {@link #expand(CompoundForm)} applies.
     */
    public boolean isExpandable(@NonNull Form f) {
        if (!(f instanceof CompoundForm)) return false;
        CompoundForm c = (CompoundForm) f;
        return c.isHeadedBy(blockMacro) || c.isHeadedBy(namedBlockMacro);
    }

    /**
     * Expands {@code (with-vars body...)} or {@code (with-vars/named label body...)}.
     *
     * <p>
     * Positions reported by {@link MalformedDeclarationException} and {@link DuplicateDeclarationException}
     * count from the first body form, not from the macro head.
     *
     * @throws IllegalArgumentException
     *      if the form is not a block macro call. See {@link #isExpandable(Form)}.
     * @throws MalformedScopeException
     *      if a named block doesn't start with a symbol label.
     */
    @NonNull
    public Form expand(@NonNull CompoundForm call) throws HoistingException {
        Form result;
        if (call.isHeadedBy(blockMacro)) {
            result = transform(call.tail());
        } else if (call.isHeadedBy(namedBlockMacro)) {
            if (call.size() < 2) throw new MalformedScopeException(call, "missing label");
            Form label = call.get(1);
            if (!(label instanceof SymbolForm))
                throw new MalformedScopeException(call, "label must be a symbol but was " + FormPrinter.print(label));
            List<Form> body = call.getElements().subList(2, call.size());
            result = transformNamed((SymbolForm) label, body);
        } else {
            throw new IllegalArgumentException("Not a block macro call: " + FormPrinter.print(call));
        }

        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.log(Level.FINER, "expanded {0} to {1}", new Object[] {call, result});
        }
        return result;
    }

    private static final Logger LOGGER = Logger.getLogger(HoistTransformer.class.getName());
}
