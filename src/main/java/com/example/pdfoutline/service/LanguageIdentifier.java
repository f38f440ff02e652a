package com.example.pdfoutline.service;

import com.example.pdfoutline.model.ScriptProfile;
import com.example.pdfoutline.model.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the script profile of a document from the Unicode ranges of its characters.
 */
@Service
public class LanguageIdentifier {

    private static final Logger logger = LoggerFactory.getLogger(LanguageIdentifier.class);

    /**
     * Tallies every non-whitespace character of every span and returns the profile with the
     * largest share. Ties go to LATIN, then to declaration order. An empty document is LATIN.
     */
    public ScriptProfile identify(List<TextSpan> spans) {
        Map<ScriptProfile, Long> counts = new EnumMap<>(ScriptProfile.class);
        for (ScriptProfile profile : ScriptProfile.values()) {
            counts.put(profile, 0L);
        }

        long total = 0;
        for (TextSpan span : spans) {
            String text = span.getText();
            if (text == null) continue;
            int i = 0;
            while (i < text.length()) {
                int cp = text.codePointAt(i);
                i += Character.charCount(cp);
                if (Character.isWhitespace(cp) || Character.isSpaceChar(cp)) continue;
                counts.merge(classify(cp), 1L, Long::sum);
                total++;
            }
        }

        if (total == 0) {
            return ScriptProfile.LATIN;
        }

        ScriptProfile best = ScriptProfile.LATIN;
        long bestCount = counts.get(ScriptProfile.LATIN);
        for (ScriptProfile profile : ScriptProfile.values()) {
            if (counts.get(profile) > bestCount) {
                best = profile;
                bestCount = counts.get(profile);
            }
        }
        logger.debug("Script tally {} over {} chars -> {}", counts, total, best);
        return best;
    }

    static ScriptProfile classify(int cp) {
        if (cp >= 0x0900 && cp <= 0x097F) {
            return ScriptProfile.DEVANAGARI;
        }
        if ((cp >= 0x3040 && cp <= 0x309F)       // Hiragana
                || (cp >= 0x30A0 && cp <= 0x30FF) // Katakana
                || (cp >= 0x3400 && cp <= 0x4DBF) // CJK Extension A
                || (cp >= 0x4E00 && cp <= 0x9FFF)) {
            return ScriptProfile.CJK;
        }
        if ((cp >= 0xAC00 && cp <= 0xD7A3)
                || (cp >= 0x1100 && cp <= 0x11FF)  // conjoining jamo
                || (cp >= 0x3130 && cp <= 0x318F)) { // compatibility jamo
            return ScriptProfile.HANGUL;
        }
        if ((cp >= 0x0600 && cp <= 0x06FF)
                || (cp >= 0x0750 && cp <= 0x077F)
                || (cp >= 0xFB50 && cp <= 0xFDFF)
                || (cp >= 0xFE70 && cp <= 0xFEFF)) {
            return ScriptProfile.ARABIC;
        }
        return ScriptProfile.LATIN;
    }
}
