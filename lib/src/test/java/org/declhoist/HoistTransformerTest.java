package org.declhoist;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.declhoist.impl.BlockScopedForm;
import org.declhoist.impl.LabeledScopeForm;
import org.declhoist.impl.SymbolForm;
import org.junit.Test;

public class HoistTransformerTest {
    FormBuilder b = new FormBuilder();
    HoistTransformer t = new HoistTransformer();

    List<Form> program = List.of(
            b.call("doThis"),
            b.declare("a", b.symbol("b")),
            b.call("doThat", b.symbol("b")),
            b.declare("c", b.symbol("a")),
            b.call("doOther", b.symbol("c")));

    BlockScopedForm expected = b.blockScoped(
            List.of("a", "c"),
            b.call("doThis"),
            b.assign("a", b.symbol("b")),
            b.call("doThat", b.symbol("b")),
            b.assign("c", b.symbol("a")),
            b.call("doOther", b.symbol("c")));

    @Test
    public void assemble() throws Exception {
        BlockScopedForm f = new BlockAssembler().assemble(t.hoist(program));
        assertThat(f, equalTo(expected));
        assertThat(f.getNames(), contains(b.symbol("a"), b.symbol("c")));
        assertThat(t.transform(program), equalTo(expected));
    }

    @Test
    public void assembleEmpty() throws Exception {
        BlockScopedForm f = t.transform(List.of());
        assertThat(f, equalTo(b.blockScoped(List.of())));
        assertThat(FormPrinter.print(f), is("(let ())"));
    }

    @Test
    public void namedScopeOnlyAddsTheLabel() throws Exception {
        HoistResult r = t.hoist(program);
        LabeledScopeForm f = new NamedScopeWrapper(new BlockAssembler()).wrapNamed(b.symbol("L"), r);

        assertThat(f.getLabel(), equalTo(b.symbol("L")));
        assertThat(f.getBody(), equalTo(new BlockAssembler().assemble(r)));
        assertThat(t.transformNamed(b.symbol("L"), program), equalTo(b.labeled("L", expected)));
    }

    /**
     * Exits are left alone, wherever they are.
     */
    @Test
    public void exitsArePreserved() throws Exception {
        Form exit = b.call("exit", b.symbol("L"), b.one());
        Form nested = b.call("doThat", b.call("if", b.symbol("x"), exit));
        LabeledScopeForm f = t.transformNamed(b.symbol("L"), List.of(b.declare("x", b.true_()), nested, exit));

        BlockScopedForm body = (BlockScopedForm) f.getBody();
        assertThat(body.getBody(), contains(b.assign("x", b.true_()), nested, exit));
    }

    @Test
    public void expandBlock() throws Exception {
        Form call = b.block(program.toArray(new Form[0]));
        assertThat(t.isExpandable(call), is(true));
        assertThat(t.expand(b.block(program.toArray(new Form[0]))), equalTo(expected));
    }

    @Test
    public void expandNamedBlock() throws Exception {
        Form f = t.expand(b.namedBlock("done", program.toArray(new Form[0])));
        assertThat(f, equalTo(b.labeled("done", expected)));
    }

    @Test
    public void expandNamedBlockWithoutBody() throws Exception {
        assertThat(t.expand(b.namedBlock("done")), equalTo(b.labeled("done", b.blockScoped(List.of()))));
    }

    @Test
    public void namedBlockNeedsASymbolLabel() {
        MalformedScopeException x = assertThrows(MalformedScopeException.class,
                () -> t.expand(b.list(b.symbol("with-vars/named"))));
        assertThat(x.getMessage(), containsString("missing label"));

        x = assertThrows(MalformedScopeException.class,
                () -> t.expand(b.list(b.symbol("with-vars/named"), b.constant("L"), b.call("doThis"))));
        assertThat(x.getMessage(), containsString("label must be a symbol"));
    }

    /**
     * Positions count from the first body form.
     */
    @Test
    public void errorsInsideMacroCall() {
        DuplicateDeclarationException x = assertThrows(DuplicateDeclarationException.class,
                () -> t.expand(b.namedBlock("L", b.declare("a", b.one()), b.declare("a", b.two()))));
        assertThat(x.getPosition(), is(1));
        assertThat(x.getFirstPosition(), is(0));

        assertThrows(MalformedDeclarationException.class,
                () -> t.expand(b.block(b.call("var"))));
    }

    @Test
    public void notExpandable() {
        assertThat(t.isExpandable(b.call("doThis")), is(false));
        assertThat(t.isExpandable(b.symbol("with-vars")), is(false));
        assertThat(t.isExpandable(b.list()), is(false));
        assertThrows(IllegalArgumentException.class, () -> t.expand(b.call("doThis")));
    }

    @Test
    public void configuration() throws Exception {
        HoistConfiguration config = new HoistConfiguration()
                .withDeclarationMarker("define")
                .withBlockMacro("body")
                .withNamedBlockMacro("named-body");
        FormBuilder cb = new FormBuilder(config);
        HoistTransformer ct = new HoistTransformer(config);

        Form f = ct.expand(cb.block(cb.declare("x", cb.one()), b.declare("y", cb.two())));
        assertThat(f, instanceOf(BlockScopedForm.class));
        // (var y 2) is an ordinary form under this configuration
        assertThat(((BlockScopedForm) f).getNames(), contains(new SymbolForm("x")));
        assertThat(ct.isExpandable(b.block()), is(false));
        assertThat(ct.expand(cb.namedBlock("L")), instanceOf(LabeledScopeForm.class));
    }
}
