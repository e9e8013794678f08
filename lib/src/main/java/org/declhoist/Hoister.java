package org.declhoist;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.declhoist.impl.AssignmentForm;
import org.declhoist.impl.CompoundForm;
import org.declhoist.impl.SymbolForm;

/**
 * Pulls the declared names out of a block.
 *
 * <p>
 * One pass over the block, left to right. Ordinary forms are copied as they are. A declaration
 * {@code (var x init)} contributes {@code x} to the hoisted names and is replaced, at the same
 * position, by {@code (set! x init)}:
 *
 * <pre>
 * (doThis) (var a b) (doThat b) (var c a) (doOther c)
 *
 * names: a c
 * body:  (doThis) (set! a b) (doThat b) (set! c a) (doOther c)
 * </pre>
 *
 * <p>
 * Nested blocks are ordinary forms and are not looked into.
 * Instances hold no state between calls and can be shared.
 */
public final class Hoister {
    private final FormClassifier classifier;

    public Hoister(@NonNull FormClassifier classifier) {
        this.classifier = Preconditions.checkNotNull(classifier, "classifier");
    }

    /**
     * @throws MalformedDeclarationException
     *      if a declaration doesn't have exactly a symbol and an initializer after the marker.
     * @throws DuplicateDeclarationException
     *      if a name is declared a second time.
     */
    @NonNull
    public HoistResult hoist(@NonNull List<? extends Form> program) throws HoistingException {
        Preconditions.checkNotNull(program, "program");

        ImmutableList.Builder<SymbolForm> names = ImmutableList.builder();
        ImmutableList.Builder<Form> body = ImmutableList.builderWithExpectedSize(program.size());
        // name -> position of its declaration
        Map<SymbolForm, Integer> declared = Maps.newHashMap();

        int pos = 0;
        for (Form f : program) {
            Preconditions.checkNotNull(f, "null form at position %s", pos);
            if (classifier.isDeclarationCandidate(f)) {
                CompoundForm decl = (CompoundForm) f;
                SymbolForm name = nameOf(decl, pos);

                Integer first = declared.putIfAbsent(name, pos);
                if (first != null) throw new DuplicateDeclarationException(name, pos, first);

                names.add(name);
                body.add(new AssignmentForm(name, decl.get(2)));
            } else {
                body.add(f);
            }
            pos++;
        }

        HoistResult r = new HoistResult(names.build(), body.build());
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.log(Level.FINEST, "hoisted {0} out of {1} forms", new Object[] {
                FormPrinter.print(r.getNames()), pos
            });
        }
        return r;
    }

    private SymbolForm nameOf(CompoundForm decl, int pos) throws MalformedDeclarationException {
        int payload = decl.size() - 1;
        if (payload != 2) {
            throw new MalformedDeclarationException(
                    decl, pos, "expected a name and an initializer but found " + payload + " component(s)");
        }
        Form name = decl.get(1);
        if (!(name instanceof SymbolForm)) {
            throw new MalformedDeclarationException(
                    decl, pos, "name must be a symbol but was " + FormPrinter.print(name));
        }
        return (SymbolForm) name;
    }

    private static final Logger LOGGER = Logger.getLogger(Hoister.class.getName());
}
