package org.declhoist;

import java.util.List;
import org.declhoist.impl.AssignmentForm;
import org.declhoist.impl.BlockScopedForm;
import org.declhoist.impl.CompoundForm;
import org.declhoist.impl.ConstantForm;
import org.declhoist.impl.LabeledScopeForm;
import org.declhoist.impl.SymbolForm;

/**
 * Renders a {@link Form} tree as an s-expression.
 *
 * <pre>
 * (let ((a #&lt;undefined&gt;) (c #&lt;undefined&gt;))
 *   (doThis) (set! a b) (doThat b) (set! c a) (doOther c))
 * </pre>
 *
 * (printed on a single line). The output is meant for people: error messages, logs,
 * {@link Object#toString()}. It is not read back.
 */
public final class FormPrinter implements FormVisitor<Void> {
    private final StringBuilder buf;

    private FormPrinter(StringBuilder buf) {
        this.buf = buf;
    }

    public static String print(Form f) {
        StringBuilder buf = new StringBuilder();
        f.accept(new FormPrinter(buf));
        return buf.toString();
    }

    public static String print(List<? extends Form> forms) {
        StringBuilder buf = new StringBuilder();
        FormPrinter p = new FormPrinter(buf);
        p.printAll(forms);
        return buf.toString();
    }

    public Void visitSymbol(SymbolForm symbol) {
        buf.append(symbol.getName());
        return null;
    }

    public Void visitConstant(ConstantForm constant) {
        Object v = constant.getValue();
        if (v == null) {
            buf.append("nil");
        } else if (v instanceof CharSequence) {
            quote(v.toString());
        } else {
            buf.append(v);
        }
        return null;
    }

    public Void visitCompound(CompoundForm compound) {
        buf.append('(');
        printAll(compound.getElements());
        buf.append(')');
        return null;
    }

    public Void visitAssignment(AssignmentForm assignment) {
        buf.append("(set! ");
        assignment.getName().accept(this);
        buf.append(' ');
        assignment.getInit().accept(this);
        buf.append(')');
        return null;
    }

    public Void visitBlockScoped(BlockScopedForm block) {
        buf.append("(let (");
        boolean first = true;
        for (SymbolForm name : block.getNames()) {
            if (!first) buf.append(' ');
            first = false;
            buf.append('(').append(name.getName()).append(' ').append(Undefined.INSTANCE).append(')');
        }
        buf.append(')');
        for (Form f : block.getBody()) {
            buf.append(' ');
            f.accept(this);
        }
        buf.append(')');
        return null;
    }

    public Void visitLabeledScope(LabeledScopeForm scope) {
        buf.append("(block ");
        scope.getLabel().accept(this);
        buf.append(' ');
        scope.getBody().accept(this);
        buf.append(')');
        return null;
    }

    private void printAll(List<? extends Form> forms) {
        boolean first = true;
        for (Form f : forms) {
            if (!first) buf.append(' ');
            first = false;
            f.accept(this);
        }
    }

    private void quote(String s) {
        buf.append('"');
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '"':
                case '\\':
                    buf.append('\\').append(ch);
                    break;
                case '\n':
                    buf.append("\\n");
                    break;
                case '\t':
                    buf.append("\\t");
                    break;
                default:
                    buf.append(ch);
            }
        }
        buf.append('"');
    }
}
