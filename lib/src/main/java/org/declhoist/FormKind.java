package org.declhoist;

/**
 * What {@link FormClassifier} makes of one element of a program.
 */
public enum FormKind {
    /**
     * Compound form headed by the declaration marker. Not necessarily well-formed.
     */
    DECLARATION,
    ORDINARY
}
