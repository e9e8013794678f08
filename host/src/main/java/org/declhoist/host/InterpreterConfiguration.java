package org.declhoist.host;

import org.declhoist.HoistConfiguration;
import org.declhoist.impl.SymbolForm;

/**
 * Switches that affect the behaviour of {@link Interpreter}.
 *
 * @see Interpreter#Interpreter(InterpreterConfiguration)
 */
public class InterpreterConfiguration {
    private SymbolForm exitOperator = new SymbolForm("exit");
    private SymbolForm ifOperator = new SymbolForm("if");
    private HoistConfiguration hoistConfiguration = new HoistConfiguration();

    public SymbolForm getExitOperator() {
        return exitOperator;
    }

    public SymbolForm getIfOperator() {
        return ifOperator;
    }

    public HoistConfiguration getHoistConfiguration() {
        return hoistConfiguration;
    }

    /**
     * Head symbol of {@code (exit label value)}, which leaves the enclosing scope named {@code label}.
     */
    public InterpreterConfiguration withExitOperator(String name) {
        this.exitOperator = new SymbolForm(name);
        return this;
    }

    /**
     * Head symbol of {@code (if condition then else)}.
     */
    public InterpreterConfiguration withIfOperator(String name) {
        this.ifOperator = new SymbolForm(name);
        return this;
    }

    /**
     * Configuration for expanding the block macros encountered during evaluation.
     */
    public InterpreterConfiguration withHoistConfiguration(HoistConfiguration hoistConfiguration) {
        this.hoistConfiguration = hoistConfiguration;
        return this;
    }
}
