package com.example.pdfoutline.config;

import com.example.pdfoutline.model.PatternTag;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One structural marker: a prefix regex, the tag it yields and how to read nesting depth.
 * When {@code depthFromNumbering} is set, group 1 holds the number ("1.2.3") and the depth
 * is its segment count; otherwise {@code fixedDepth} applies.
 */
public final class PatternRule {
    private static final Pattern NUMBER_SEPARATOR = Pattern.compile("[.．٫]");

    private final Pattern pattern;
    private final PatternTag tag;
    private final int fixedDepth;
    private final boolean depthFromNumbering;

    private PatternRule(Pattern pattern, PatternTag tag, int fixedDepth, boolean depthFromNumbering) {
        this.pattern = pattern;
        this.tag = tag;
        this.fixedDepth = fixedDepth;
        this.depthFromNumbering = depthFromNumbering;
    }

    public static PatternRule numbered(String regex) {
        return new PatternRule(Pattern.compile(regex), PatternTag.NUMBERED_LIST, 0, true);
    }

    public static PatternRule fixed(String regex, PatternTag tag, int depth) {
        return new PatternRule(Pattern.compile(regex), tag, depth, false);
    }

    public static PatternRule fixedIgnoreCase(String regex, PatternTag tag, int depth) {
        return new PatternRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), tag, depth, false);
    }

    public Pattern getPattern() {
        return pattern;
    }

    public PatternTag getTag() {
        return tag;
    }

    /** Depth for a successful match of this rule, 0 if unknown. */
    public int depthOf(Matcher matcher) {
        if (!depthFromNumbering) {
            return fixedDepth;
        }
        String number = matcher.group(1);
        if (number == null || number.isEmpty()) {
            return 0;
        }
        return NUMBER_SEPARATOR.split(number).length;
    }

    @Override
    public String toString() {
        return tag + ":" + pattern.pattern();
    }
}
