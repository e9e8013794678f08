package org.declhoist;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import org.declhoist.impl.SymbolForm;
import org.junit.Test;

public class FormClassifierTest {
    FormBuilder b = new FormBuilder();
    FormClassifier classifier = new FormClassifier(new SymbolForm("var"));

    @Test
    public void declarationIsRecognizedByItsHead() {
        assertThat(classifier.classify(b.declare("x", b.constant(1))), is(FormKind.DECLARATION));
    }

    /**
     * Shape is checked later, by the hoister.
     */
    @Test
    public void badlyShapedDeclarationIsStillADeclaration() {
        assertThat(classifier.classify(b.list(b.symbol("var"))), is(FormKind.DECLARATION));
        assertThat(classifier.classify(b.call("var", b.symbol("x"), b.one(), b.two())), is(FormKind.DECLARATION));
        assertThat(classifier.classify(b.call("var", b.constant(3), b.one())), is(FormKind.DECLARATION));
    }

    @Test
    public void everythingElseIsOrdinary() {
        assertThat(classifier.classify(b.symbol("var")), is(FormKind.ORDINARY));
        assertThat(classifier.classify(b.constant("var")), is(FormKind.ORDINARY));
        assertThat(classifier.classify(b.list()), is(FormKind.ORDINARY));
        assertThat(classifier.classify(b.call("doThis")), is(FormKind.ORDINARY));
        // marker somewhere other than the head
        assertThat(classifier.classify(b.call("print", b.symbol("var"))), is(FormKind.ORDINARY));
        // declaration nested in a call is not looked into
        assertThat(classifier.classify(b.call("print", b.declare("x", b.one()))), is(FormKind.ORDINARY));
        // a constant that happens to be the marker's name
        assertThat(classifier.classify(b.list(b.constant("var"), b.symbol("x"), b.one())), is(FormKind.ORDINARY));
    }

    @Test
    public void customMarker() {
        FormClassifier let = new FormClassifier(new SymbolForm("let"));
        assertThat(let.isDeclarationCandidate(b.call("let", b.symbol("x"), b.one())), is(true));
        assertThat(let.isDeclarationCandidate(b.declare("x", b.one())), is(false));
    }
}
