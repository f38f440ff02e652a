package com.example.pdfoutline.model;

/**
 * Writing system family that selects the structural pattern table.
 * Declaration order is the tie-break order after LATIN.
 */
public enum ScriptProfile {
    LATIN,
    DEVANAGARI,
    CJK,
    HANGUL,
    ARABIC
}
