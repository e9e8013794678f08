package org.declhoist;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.declhoist.impl.AssignmentForm;
import org.declhoist.impl.BlockScopedForm;
import org.declhoist.impl.CompoundForm;
import org.declhoist.impl.ConstantForm;
import org.declhoist.impl.LabeledScopeForm;
import org.declhoist.impl.SymbolForm;

/**
 * Builder pattern for constructing {@link Form}s into a tree.
 *
 * For example, to build {@code (with-vars (var x 1) (print x))}, you'd call
 * {@code block(declare("x", constant(1)), call("print", symbol("x")))}.
 *
 * <p>
 * Head symbols come from the {@link HoistConfiguration} given to the constructor, so that trees built
 * here are recognized by a {@link HoistTransformer} created from the same configuration.
 */
public class FormBuilder {
    private final HoistConfiguration config;

    public FormBuilder() {
        this(new HoistConfiguration());
    }

    public FormBuilder(HoistConfiguration config) {
        this.config = config;
    }

    public SymbolForm symbol(String name) {
        return new SymbolForm(name);
    }

    public Form null_() {
        return ConstantForm.NULL;
    }

    public Form constant(Object o) {
        return o == null ? ConstantForm.NULL : new ConstantForm(o);
    }

    public Form zero() {
        return constant(0);
    }

    public Form one() {
        return constant(1);
    }

    public Form two() {
        return constant(2);
    }

    public Form true_() {
        return constant(true);
    }

    public Form false_() {
        return constant(false);
    }

    /**
     * {@code (e1 e2 ...)}
     */
    public CompoundForm list(Form... elements) {
        return new CompoundForm(elements);
    }

    /**
     * {@code (function arg1 arg2 ...)}
     */
    public CompoundForm call(String function, Form... args) {
        return new CompoundForm(prepend(symbol(function), args));
    }

    /**
     * {@code (var name init)}
     */
    public CompoundForm declare(String name, Form init) {
        return list(config.getDeclarationMarker(), symbol(name), init);
    }

    /**
     * {@code (with-vars body...)}
     */
    public CompoundForm block(Form... body) {
        return new CompoundForm(prepend(config.getBlockMacro(), body));
    }

    /**
     * {@code (with-vars/named label body...)}
     */
    public CompoundForm namedBlock(String label, Form... body) {
        List<Form> all = new ArrayList<>(body.length + 2);
        all.add(config.getNamedBlockMacro());
        all.add(symbol(label));
        all.addAll(List.of(body));
        return new CompoundForm(all);
    }

    /**
     * {@code (set! name init)}, as produced by the transformation.
     */
    public AssignmentForm assign(String name, Form init) {
        return new AssignmentForm(symbol(name), init);
    }

    /**
     * {@code (let ((n1 #<undefined>) ...) body...)}, as produced by the transformation.
     */
    public BlockScopedForm blockScoped(List<String> names, Form... body) {
        ImmutableList.Builder<SymbolForm> symbols = ImmutableList.builder();
        for (String n : names) symbols.add(symbol(n));
        return new BlockScopedForm(symbols.build(), List.of(body));
    }

    /**
     * {@code (block label body)}, as produced by the transformation.
     */
    public LabeledScopeForm labeled(String label, Form body) {
        return new LabeledScopeForm(symbol(label), body);
    }

    private static List<Form> prepend(Form head, Form[] rest) {
        List<Form> all = new ArrayList<>(rest.length + 1);
        all.add(head);
        all.addAll(List.of(rest));
        return all;
    }
}
