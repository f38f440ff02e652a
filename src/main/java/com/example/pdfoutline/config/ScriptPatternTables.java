package com.example.pdfoutline.config;

import com.example.pdfoutline.model.PatternTag;
import com.example.pdfoutline.model.ScriptProfile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structural heading markers per script profile.
 * Rules are tried in order and the first hit wins; every table ends with the shared
 * Arabic-digit numbering rule because "1.2 ..." headings show up in every script.
 */
public final class ScriptPatternTables {

    // "1 Intro", "1. Intro", "2.3.1 Scope", "4) Results". Three digits at most so years do not count.
    static final String ASCII_NUMBERING = "^(\\d{1,3}(?:\\.\\d{1,3})*)[.)]?[\\s\\u3000]+\\S";

    private static final String CJK_NUMERAL = "[0-9０-９一二三四五六七八九十百千零〇两]+";
    private static final String HANGUL_NUMERAL = "(?:[0-9]+|[일이삼사오육칠팔구십백]+)";
    private static final String ARABIC_ORDINAL = "(?:[٠-٩۰-۹0-9]+|الأول|الأولى|الثاني|الثانية|الثالث|الثالثة|الرابع|الرابعة"
            + "|الخامس|الخامسة|السادس|السادسة|السابع|السابعة|الثامن|الثامنة|التاسع|التاسعة|العاشر|العاشرة)";

    private final List<PatternRule> latin;
    private final List<PatternRule> devanagari;
    private final List<PatternRule> cjk;
    private final List<PatternRule> hangul;
    private final List<PatternRule> arabic;

    private ScriptPatternTables(List<PatternRule> latin, List<PatternRule> devanagari, List<PatternRule> cjk,
                                List<PatternRule> hangul, List<PatternRule> arabic) {
        this.latin = latin;
        this.devanagari = devanagari;
        this.cjk = cjk;
        this.hangul = hangul;
        this.arabic = arabic;
    }

    public static ScriptPatternTables standard() {
        return new ScriptPatternTables(
                withSharedNumbering(latinRules()),
                withSharedNumbering(devanagariRules()),
                withSharedNumbering(cjkRules()),
                withSharedNumbering(hangulRules()),
                withSharedNumbering(arabicRules()));
    }

    /** The rule list for exactly one profile. */
    public List<PatternRule> forProfile(ScriptProfile profile) {
        switch (profile) {
            case DEVANAGARI:
                return devanagari;
            case CJK:
                return cjk;
            case HANGUL:
                return hangul;
            case ARABIC:
                return arabic;
            case LATIN:
            default:
                return latin;
        }
    }

    private static List<PatternRule> withSharedNumbering(List<PatternRule> rules) {
        List<PatternRule> all = new ArrayList<>(rules);
        all.add(PatternRule.numbered(ASCII_NUMBERING));
        return Collections.unmodifiableList(all);
    }

    private static List<PatternRule> latinRules() {
        List<PatternRule> rules = new ArrayList<>();
        // Single-letter numerals other than I, V, X read as lettered items instead
        rules.add(PatternRule.fixed("^(?:[IVX]|[IVXLCDM]{2,7})\\.\\s*\\S", PatternTag.ROMAN_NUMERAL, 1));
        rules.add(PatternRule.fixed("^[A-Z][.)]\\s+\\S", PatternTag.LETTERED_ITEM, 2));
        rules.add(PatternRule.fixedIgnoreCase("^(?:chapter|part|appendix|annex)\\s+(?:\\d+|[IVXLCDM]+|[A-Z])\\b",
                PatternTag.CHAPTER_KEYWORD, 1));
        rules.add(PatternRule.fixedIgnoreCase("^(?:appendix|annex)\\s*:?$", PatternTag.CHAPTER_KEYWORD, 1));
        rules.add(PatternRule.fixedIgnoreCase("^section\\s+\\d+(?:\\.\\d+)*\\b", PatternTag.SECTION_KEYWORD, 2));
        rules.add(PatternRule.fixedIgnoreCase("^(?:abstract|introduction|summary|executive summary|background|overview"
                        + "|conclusions?|references|bibliography|acknowledge?ments|(?:table of )?contents"
                        + "|revision history|glossary|index|preface|foreword)\\s*:?$",
                PatternTag.KNOWN_SECTION, 0));
        return rules;
    }

    private static List<PatternRule> devanagariRules() {
        List<PatternRule> rules = new ArrayList<>();
        rules.add(PatternRule.numbered("^([०-९]{1,3}(?:\\.[०-९]{1,3})*)[.)।]?\\s+\\S"));
        rules.add(PatternRule.fixed("^(?:अध्याय|भाग)\\s*[-–:]?\\s*[०-९0-9]+", PatternTag.CHAPTER_KEYWORD, 1));
        rules.add(PatternRule.fixed("^(?:खंड|खण्ड|अनुभाग)\\s*[-–:]?\\s*[०-९0-9]+", PatternTag.SECTION_KEYWORD, 2));
        rules.add(PatternRule.fixed("^परिशिष्ट(?:\\s|$)", PatternTag.CHAPTER_KEYWORD, 1));
        rules.add(PatternRule.fixed("^(?:प्रस्तावना|भूमिका|परिचय|निष्कर्ष|सारांश|संदर्भ|विषय सूची)\\s*[:।]?$",
                PatternTag.KNOWN_SECTION, 0));
        return rules;
    }

    private static List<PatternRule> cjkRules() {
        List<PatternRule> rules = new ArrayList<>();
        rules.add(PatternRule.fixed("^第\\s*" + CJK_NUMERAL + "\\s*[章部編编卷篇]", PatternTag.CHAPTER_KEYWORD, 1));
        rules.add(PatternRule.fixed("^第\\s*" + CJK_NUMERAL + "\\s*[節节]", PatternTag.SECTION_KEYWORD, 2));
        rules.add(PatternRule.fixed("^第\\s*" + CJK_NUMERAL + "\\s*[款条條項项]", PatternTag.SECTION_KEYWORD, 3));
        rules.add(PatternRule.fixed("^[一二三四五六七八九十百]+[、．.]\\s*\\S", PatternTag.NUMBERED_LIST, 1));
        rules.add(PatternRule.fixed("^[（(][一二三四五六七八九十百]+[)）]\\s*\\S", PatternTag.NUMBERED_LIST, 2));
        // Full-width digits and "1．概要" style numbering without a space
        rules.add(PatternRule.numbered("^([０-９]{1,3}(?:[.．][０-９]{1,3})*)[.．、]?[\\s\\u3000]*[^\\s\\u3000０-９.．]"));
        rules.add(PatternRule.numbered("^(\\d{1,3}(?:[.．]\\d{1,3})*)[．、][\\s\\u3000]*[^\\s\\u30000-9]"));
        rules.add(PatternRule.fixed("^(?:目次|目录|目錄|序章|序言|前言|概要|はじめに|おわりに|参考文献|參考文獻"
                + "|附录|附錄|付録|结论|結論|结语|摘要)$", PatternTag.KNOWN_SECTION, 0));
        return rules;
    }

    private static List<PatternRule> hangulRules() {
        List<PatternRule> rules = new ArrayList<>();
        rules.add(PatternRule.fixed("^제\\s*" + HANGUL_NUMERAL + "\\s*[장편부]", PatternTag.CHAPTER_KEYWORD, 1));
        rules.add(PatternRule.fixed("^제\\s*" + HANGUL_NUMERAL + "\\s*절", PatternTag.SECTION_KEYWORD, 2));
        rules.add(PatternRule.fixed("^제\\s*" + HANGUL_NUMERAL + "\\s*[조항]", PatternTag.SECTION_KEYWORD, 3));
        rules.add(PatternRule.fixed("^[가나다라마바사아자차카타파하][.)]\\s*\\S", PatternTag.LETTERED_ITEM, 2));
        rules.add(PatternRule.fixed("^부록(?:\\s|[0-9A-Z]|$)", PatternTag.CHAPTER_KEYWORD, 1));
        rules.add(PatternRule.fixed("^(?:서론|서문|머리말|결론|맺음말|요약|목차|참고\\s*문헌)\\s*:?$",
                PatternTag.KNOWN_SECTION, 0));
        return rules;
    }

    private static List<PatternRule> arabicRules() {
        List<PatternRule> rules = new ArrayList<>();
        rules.add(PatternRule.numbered("^([٠-٩۰-۹]{1,3}(?:[.٫][٠-٩۰-۹]{1,3})*)[.)\\-–]?\\s+\\S"));
        rules.add(PatternRule.fixed("^(?:الفصل|الباب|الجزء)\\s+" + ARABIC_ORDINAL, PatternTag.CHAPTER_KEYWORD, 1));
        rules.add(PatternRule.fixed("^(?:القسم|المبحث|المطلب)\\s+" + ARABIC_ORDINAL, PatternTag.SECTION_KEYWORD, 2));
        rules.add(PatternRule.fixed("^(?:الملحق|ملحق)(?:\\s|$)", PatternTag.CHAPTER_KEYWORD, 1));
        rules.add(PatternRule.fixed("^(?:مقدمة|المقدمة|خاتمة|الخاتمة|ملخص|الملخص|المراجع|الفهرس)\\s*:?$",
                PatternTag.KNOWN_SECTION, 0));
        return rules;
    }
}
