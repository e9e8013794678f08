package org.declhoist.host;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

import java.lang.reflect.InvocationTargetException;
import org.declhoist.impl.SymbolForm;
import org.junit.Test;

public class OutcomeTest {
    @Test
    public void normal() throws Exception {
        Outcome o = Outcome.normal("v");
        assertThat(o.isNormal(), is(true));
        assertThat(o.isExit(), is(false));
        assertThat(o.replay(), equalTo((Object) "v"));
        assertThat(Outcome.normal(null).isNormal(), is(true));
    }

    @Test
    public void exit() {
        Outcome o = Outcome.exit(new SymbolForm("L"), 3);
        assertThat(o.isNormal(), is(false));
        assertThat(o.isExit(), is(true));
        assertThat(o.getLabel(), equalTo(new SymbolForm("L")));
        assertThat(o.getValue(), equalTo((Object) 3));
        assertThat(o.toString(), is("Outcome[exit L=3]"));
    }

    @Test
    public void abnormal() {
        IllegalStateException boom = new IllegalStateException("boom");
        Outcome o = Outcome.abnormal(boom);
        assertThat(o.isAbnormal(), is(true));
        InvocationTargetException x = assertThrows(InvocationTargetException.class, o::replay);
        assertThat(x.getCause(), sameInstance((Throwable) boom));
        assertThat(Outcome.exit(new SymbolForm("L"), null).isAbnormal(), is(false));
        assertThrows(InvocationTargetException.class, Outcome.exit(new SymbolForm("L"), null)::replay);
    }
}
