package com.example.pdfoutline.service;

import com.example.pdfoutline.config.OutlineSettings;
import com.example.pdfoutline.config.PatternRule;
import com.example.pdfoutline.config.ScriptPatternTables;
import com.example.pdfoutline.model.PatternMatch;
import com.example.pdfoutline.model.PatternTag;
import com.example.pdfoutline.model.ScriptProfile;
import com.example.pdfoutline.util.HeadingTextUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Detects structural heading markers (numbering, chapter keywords, well-known section names)
 * using the pattern table of the document's script profile.
 */
@Service
public class PatternMatcher {

    private final ScriptPatternTables tables;
    private final OutlineSettings settings;

    public PatternMatcher(ScriptPatternTables tables, OutlineSettings settings) {
        this.tables = tables;
        this.settings = settings;
    }

    public Optional<PatternMatch> match(String text, ScriptProfile profile) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = HeadingTextUtils.normalize(HeadingTextUtils.stripBidiMarks(text));
        if (normalized.isEmpty()) {
            return Optional.empty();
        }

        List<PatternRule> rules = tables.forProfile(profile);
        Optional<PatternMatch> hit = firstHit(rules, normalized);
        if (hit.isEmpty() && profile == ScriptProfile.ARABIC) {
            // Visual-order extraction hands RTL text over reversed
            hit = firstHit(rules, new StringBuilder(normalized).reverse().toString().trim());
        }
        return hit;
    }

    private Optional<PatternMatch> firstHit(List<PatternRule> rules, String text) {
        for (PatternRule rule : rules) {
            Matcher m = rule.getPattern().matcher(text);
            if (m.find()) {
                return Optional.of(new PatternMatch(rule.getTag(), rule.depthOf(m), boostFor(rule.getTag())));
            }
        }
        return Optional.empty();
    }

    private double boostFor(PatternTag tag) {
        return tag == PatternTag.KNOWN_SECTION ? settings.getKeywordBoost() : settings.getPatternBoost();
    }
}
