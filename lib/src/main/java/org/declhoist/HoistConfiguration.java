package org.declhoist;

import org.declhoist.impl.SymbolForm;

/**
 * Switches that affect the behaviour of {@link HoistTransformer}.
 *
 * <p>
 * {@link HoistTransformer} reads the configuration once, when it is created.
 * Changing a configuration afterwards does not affect transformers that already exist.
 *
 * @see HoistTransformer#HoistTransformer(HoistConfiguration)
 */
public class HoistConfiguration {
    public static final String DEFAULT_DECLARATION_MARKER = "var";
    public static final String DEFAULT_BLOCK_MACRO = "with-vars";
    public static final String DEFAULT_NAMED_BLOCK_MACRO = "with-vars/named";

    private SymbolForm declarationMarker = new SymbolForm(DEFAULT_DECLARATION_MARKER);
    private SymbolForm blockMacro = new SymbolForm(DEFAULT_BLOCK_MACRO);
    private SymbolForm namedBlockMacro = new SymbolForm(DEFAULT_NAMED_BLOCK_MACRO);

    public SymbolForm getDeclarationMarker() {
        return declarationMarker;
    }

    public SymbolForm getBlockMacro() {
        return blockMacro;
    }

    public SymbolForm getNamedBlockMacro() {
        return namedBlockMacro;
    }

    /**
     * Head symbol that turns a compound form into a declaration, {@code var} in {@code (var x 1)}.
     */
    public HoistConfiguration withDeclarationMarker(String marker) {
        this.declarationMarker = new SymbolForm(marker);
        return this;
    }

    /**
     * Head symbol of {@code (with-vars body...)}, the call that {@link HoistTransformer#expand(org.declhoist.impl.CompoundForm)}
     * turns into a block scope.
     */
    public HoistConfiguration withBlockMacro(String name) {
        this.blockMacro = new SymbolForm(name);
        return this;
    }

    /**
     * Head symbol of {@code (with-vars/named label body...)}, which also introduces a labeled scope.
     */
    public HoistConfiguration withNamedBlockMacro(String name) {
        this.namedBlockMacro = new SymbolForm(name);
        return this;
    }
}
