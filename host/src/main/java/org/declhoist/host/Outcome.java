package org.declhoist.host;

import com.google.common.base.Preconditions;
import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Serializable;
import java.lang.reflect.InvocationTargetException;
import org.declhoist.impl.SymbolForm;

/**
 * Result of the evaluation.
 *
 * <p>
 * Either a value in case of a normal completion, a request to leave the scope named {@link #getLabel()}
 * carrying a value, or a throwable object in case of abnormal completion.
 * Exits and abnormal outcomes travel outward through every enclosing evaluation until something
 * handles them: the matching labeled scope for an exit, the caller of {@link Interpreter} otherwise.
 *
 * @see Interpreter
 */
public final class Outcome implements Serializable {
    @CheckForNull
    private final Object value;

    @CheckForNull
    private final SymbolForm label;

    @CheckForNull
    private final Throwable abnormal;

    private Outcome(Object value, SymbolForm label, Throwable abnormal) {
        assert label == null || abnormal == null;
        this.value = value;
        this.label = label;
        this.abnormal = abnormal;
    }

    public static Outcome normal(@CheckForNull Object value) {
        return new Outcome(value, null, null);
    }

    public static Outcome exit(@NonNull SymbolForm label, @CheckForNull Object value) {
        return new Outcome(value, Preconditions.checkNotNull(label, "label"), null);
    }

    public static Outcome abnormal(@NonNull Throwable t) {
        return new Outcome(null, null, Preconditions.checkNotNull(t, "abnormal"));
    }

    public boolean isNormal() {
        return label == null && abnormal == null;
    }

    public boolean isExit() {
        return label != null;
    }

    public boolean isAbnormal() {
        return abnormal != null;
    }

    /**
     * Value of a normal completion, or the value an exit carries.
     */
    @CheckForNull
    public Object getValue() {
        return value;
    }

    /**
     * Label of the scope an exit is leaving. Null unless {@link #isExit()}.
     */
    @CheckForNull
    public SymbolForm getLabel() {
        return label;
    }

    @CheckForNull
    public Throwable getAbnormal() {
        return abnormal;
    }

    /**
     * Returns the value of a normal completion, or throws the abnormal one.
     *
     * @throws InvocationTargetException
     *      wrapping the throwable of an abnormal outcome, or an {@link UnknownLabelException}
     *      for an exit nobody caught.
     */
    public Object replay() throws InvocationTargetException {
        if (abnormal != null) throw new InvocationTargetException(abnormal);
        if (label != null) throw new InvocationTargetException(new UnknownLabelException(label));
        return value;
    }

    @Override
    public String toString() {
        if (abnormal != null) return "Outcome[abnormal=" + abnormal + "]";
        if (label != null) return "Outcome[exit " + label.getName() + "=" + value + "]";
        return "Outcome[normal=" + value + "]";
    }

    private static final long serialVersionUID = 1L;
}
