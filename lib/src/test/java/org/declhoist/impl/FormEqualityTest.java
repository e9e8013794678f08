package org.declhoist.impl;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.declhoist.Form;
import org.declhoist.FormBuilder;
import org.junit.Test;

/**
 * Forms compare structurally, which is what lets transformed trees be compared in tests and by hosts.
 */
public class FormEqualityTest {
    FormBuilder b = new FormBuilder();

    @Test
    public void structural() {
        assertThat(b.call("f", b.symbol("x"), b.one()), equalTo(b.call("f", b.symbol("x"), b.one())));
        assertThat(b.call("f", b.symbol("x")).hashCode(), is(b.call("f", b.symbol("x")).hashCode()));
        assertThat(b.assign("a", b.one()), equalTo(b.assign("a", b.one())));
        assertThat(b.labeled("L", b.one()), equalTo(b.labeled("L", b.one())));
        assertThat(b.blockScoped(List.of("a"), b.one()), equalTo(b.blockScoped(List.of("a"), b.one())));
    }

    @Test
    public void differences() {
        assertThat(b.symbol("x"), not(equalTo((Form) b.constant("x"))));
        assertThat(b.call("f", b.one()), not(equalTo(b.call("f", b.two()))));
        assertThat(b.assign("a", b.one()), not(equalTo(b.assign("b", b.one()))));
        assertThat(b.labeled("L", b.one()), not(equalTo(b.labeled("M", b.one()))));
        assertThat(b.blockScoped(List.of("a"), b.one()), not(equalTo(b.blockScoped(List.of("b"), b.one()))));
        assertThat(b.null_(), not(equalTo(b.constant(0))));
    }

    @Test
    public void compoundCopiesItsElements() {
        List<Form> elements = new ArrayList<>(List.of(b.symbol("f")));
        CompoundForm c = new CompoundForm(elements);
        elements.add(b.one());
        assertThat(c.size(), is(1));
        assertThat(c.tail().isEmpty(), is(true));
        assertThat(new CompoundForm().head(), nullValue());
    }

    @Test
    public void emptySymbolIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SymbolForm(""));
    }
}
