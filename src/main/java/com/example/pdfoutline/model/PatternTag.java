package com.example.pdfoutline.model;

public enum PatternTag {
    /** "1", "1.2", "2.3.1" style prefixes, in any supported digit set. */
    NUMBERED_LIST,
    ROMAN_NUMERAL,
    /** "A." or Hangul "가." style item markers. */
    LETTERED_ITEM,
    CHAPTER_KEYWORD,
    SECTION_KEYWORD,
    /** Stand-alone names such as "Introduction" or "References". */
    KNOWN_SECTION
}
