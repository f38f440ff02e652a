package com.example.pdfoutline.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static text helpers shared by the pipeline stages.
 */
public final class HeadingTextUtils {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u3000\\u2000-\\u200B]+");
    private static final Pattern BIDI_MARKS = Pattern.compile("[\\u200E\\u200F\\u061C\\u202A-\\u202E\\u2066-\\u2069]");
    // Sentence end: terminator followed by space or end of text. "1.2" and "e.g" do not count.
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?。！？।؟](?=\\s|$)");
    // "1.", "2.3." and "IV." open a heading, they do not end a sentence
    private static final Pattern NUMBERING_PREFIX = Pattern.compile("^(?:\\d+(?:\\.\\d+)*|[IVXLCDM]+)\\.\\s*");

    private HeadingTextUtils() {
    }

    /** Trims and collapses every whitespace run (ideographic and no-break spaces included) into one space. */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String stripBidiMarks(String text) {
        return BIDI_MARKS.matcher(text).replaceAll("");
    }

    public static boolean hasLetter(String text) {
        return text.codePoints().anyMatch(Character::isLetter);
    }

    public static int codePointLength(String text) {
        return text.codePointCount(0, text.length());
    }

    public static int wordCount(String text) {
        String normalized = normalize(text);
        return normalized.isEmpty() ? 0 : normalized.split(" ").length;
    }

    public static int sentenceCount(String text) {
        String body = NUMBERING_PREFIX.matcher(normalize(text)).replaceFirst("");
        Matcher m = SENTENCE_END.matcher(body);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    /** Han ideographs and kana, the characters a one-glyph CJK heading may consist of. */
    public static boolean isCjkCharacter(int codePoint) {
        return (codePoint >= 0x4E00 && codePoint <= 0x9FFF)
                || (codePoint >= 0x3400 && codePoint <= 0x4DBF)
                || (codePoint >= 0x3040 && codePoint <= 0x30FF);
    }

    /** "abc" against "abcdef": true when the shorter text is a strict prefix or suffix of the longer one. */
    public static boolean isStrictFragmentOf(String fragment, String whole) {
        return fragment.length() < whole.length() && (whole.startsWith(fragment) || whole.endsWith(fragment));
    }
}
