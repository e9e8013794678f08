package org.declhoist.host;

import com.google.common.base.Preconditions;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.declhoist.Form;
import org.declhoist.FormPrinter;
import org.declhoist.FormVisitor;
import org.declhoist.HoistTransformer;
import org.declhoist.HoistingException;
import org.declhoist.impl.AssignmentForm;
import org.declhoist.impl.BlockScopedForm;
import org.declhoist.impl.CompoundForm;
import org.declhoist.impl.ConstantForm;
import org.declhoist.impl.LabeledScopeForm;
import org.declhoist.impl.SymbolForm;

/**
 * Evaluates {@link Form} trees, including the ones {@link HoistTransformer} produces.
 *
 * <p>
 * Besides the transformed forms, the interpreter understands:
 * <dl>
 * <dt>{@code (exit label [value])}
 * <dd>leaves the nearest enclosing {@link LabeledScopeForm} with that label, which then evaluates
 *     to {@code value} ({@code null} if omitted).
 * <dt>{@code (if condition then [else])}
 * <dd>the usual conditional; see {@link Invoker#isTrue(Object)}.
 * <dt>{@code (with-vars ...)} and {@code (with-vars/named label ...)}
 * <dd>expanded with {@link HoistTransformer#expand(CompoundForm)}, then evaluated.
 * </dl>
 * Every other compound form is a call: the head and then the arguments are evaluated left to right,
 * and the head value is called through {@link Env#getInvoker()}.
 *
 * <p>
 * Nothing is thrown out of {@link #eval(Form, Env)}. Exits and failures come back as {@link Outcome}s,
 * and the first one that isn't normal stops the evaluation of everything around it.
 */
public class Interpreter {
    private final SymbolForm exitOperator;
    private final SymbolForm ifOperator;
    private final HoistTransformer transformer;

    public Interpreter() {
        this(new InterpreterConfiguration());
    }

    public Interpreter(@NonNull InterpreterConfiguration config) {
        Preconditions.checkNotNull(config, "config");
        this.exitOperator = config.getExitOperator();
        this.ifOperator = config.getIfOperator();
        this.transformer = new HoistTransformer(config.getHoistConfiguration());
    }

    /**
     * Evaluates a top-level form in an empty environment.
     */
    @NonNull
    public Outcome run(@NonNull Form f) {
        return run(f, Envs.empty());
    }

    /**
     * Evaluates a top-level form. An exit that no labeled scope caught becomes an abnormal
     * {@link UnknownLabelException} outcome.
     */
    @NonNull
    public Outcome run(@NonNull Form f, @NonNull Env e) {
        Outcome o = eval(f, e);
        if (o.isExit()) return Outcome.abnormal(new UnknownLabelException(o.getLabel()));
        return o;
    }

    @NonNull
    public Outcome eval(@NonNull Form f, @NonNull Env e) {
        return f.accept(new Evaluation(e));
    }

    /**
     * Evaluates the given forms in order and returns the outcome of the last one.
     */
    private Outcome evalSequence(List<Form> forms, Env e) {
        Outcome last = Outcome.normal(null);
        for (Form f : forms) {
            last = eval(f, e);
            if (!last.isNormal()) return last;
        }
        return last;
    }

    private final class Evaluation implements FormVisitor<Outcome> {
        private final Env e;

        Evaluation(Env e) {
            this.e = e;
        }

        public Outcome visitSymbol(SymbolForm symbol) {
            try {
                return Outcome.normal(e.getLocalVariable(symbol.getName()));
            } catch (UnboundVariableException x) {
                return Outcome.abnormal(x);
            }
        }

        public Outcome visitConstant(ConstantForm constant) {
            return Outcome.normal(constant.getValue());
        }

        public Outcome visitAssignment(AssignmentForm assignment) {
            Outcome init = eval(assignment.getInit(), e);
            if (!init.isNormal()) return init;
            try {
                e.setLocalVariable(assignment.getName().getName(), init.getValue());
            } catch (UnboundVariableException x) {
                return Outcome.abnormal(x);
            }
            return init;
        }

        public Outcome visitBlockScoped(BlockScopedForm block) {
            Env scope = new BlockScopeEnv(e, block.getNames().size());
            for (SymbolForm name : block.getNames()) {
                scope.declareVariable(name.getName());
            }
            return evalSequence(block.getBody(), scope);
        }

        public Outcome visitLabeledScope(LabeledScopeForm scope) {
            Outcome o = eval(scope.getBody(), e);
            if (o.isExit() && scope.getLabel().equals(o.getLabel())) {
                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.log(Level.FINEST, "exited {0} with {1}", new Object[] {scope.getLabel(), o.getValue()});
                }
                return Outcome.normal(o.getValue());
            }
            return o;
        }

        public Outcome visitCompound(CompoundForm compound) {
            if (compound.size() == 0) {
                return Outcome.abnormal(new MalformedFormException(compound, "nothing to evaluate"));
            }
            if (compound.isHeadedBy(exitOperator)) return exit(compound);
            if (compound.isHeadedBy(ifOperator)) return if_(compound);
            if (transformer.isExpandable(compound)) {
                Form expansion;
                try {
                    expansion = transformer.expand(compound);
                } catch (HoistingException x) {
                    return Outcome.abnormal(x);
                }
                return eval(expansion, e);
            }
            return call(compound);
        }

        /**
         * {@code (exit label [value])}
         */
        private Outcome exit(CompoundForm compound) {
            if (compound.size() < 2 || compound.size() > 3) {
                return Outcome.abnormal(new MalformedFormException(compound, "expected a label and an optional value"));
            }
            Form label = compound.get(1);
            if (!(label instanceof SymbolForm)) {
                return Outcome.abnormal(new MalformedFormException(compound, "label must be a symbol"));
            }
            Object value = null;
            if (compound.size() == 3) {
                Outcome v = eval(compound.get(2), e);
                if (!v.isNormal()) return v;
                value = v.getValue();
            }
            return Outcome.exit((SymbolForm) label, value);
        }

        /**
         * {@code (if condition then [else])}
         */
        private Outcome if_(CompoundForm compound) {
            if (compound.size() < 3 || compound.size() > 4) {
                return Outcome.abnormal(
                        new MalformedFormException(compound, "expected a condition, a then branch and an optional else branch"));
            }
            Outcome c = eval(compound.get(1), e);
            if (!c.isNormal()) return c;
            if (e.getInvoker().isTrue(c.getValue())) return eval(compound.get(2), e);
            if (compound.size() == 4) return eval(compound.get(3), e);
            return Outcome.normal(null);
        }

        private Outcome call(CompoundForm compound) {
            Outcome fn = eval(compound.get(0), e);
            if (!fn.isNormal()) return fn;

            List<Form> argForms = compound.tail();
            Object[] args = new Object[argForms.size()];
            for (int i = 0; i < args.length; i++) {
                Outcome a = eval(argForms.get(i), e);
                if (!a.isNormal()) return a;
                args[i] = a.getValue();
            }

            try {
                return Outcome.normal(e.getInvoker().call(fn.getValue(), args));
            } catch (Throwable t) {
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.log(Level.FINER, "call " + FormPrinter.print(compound) + " failed", t);
                }
                return Outcome.abnormal(t);
            }
        }
    }

    private static final Logger LOGGER = Logger.getLogger(Interpreter.class.getName());
}
