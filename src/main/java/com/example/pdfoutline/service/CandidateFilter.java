package com.example.pdfoutline.service;

import com.example.pdfoutline.config.OutlineSettings;
import com.example.pdfoutline.model.LeveledSpan;
import com.example.pdfoutline.model.ScriptProfile;
import com.example.pdfoutline.util.HeadingTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Removes heading candidates that cannot be headings whatever their styling: repeats, dates,
 * bare numbers, single characters and pieces of a neighbouring heading.
 */
@Service
public class CandidateFilter {

    private static final Logger logger = LoggerFactory.getLogger(CandidateFilter.class);

    private static final String MONTHS = "(?:jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?"
            + "|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?";

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("^\\d{1,2}[-/. ]\\d{1,2}[-/. ]\\d{2,4}$"),
            Pattern.compile("^\\d{4}[-/.]\\d{1,2}[-/.]\\d{1,2}$"),
            Pattern.compile("^\\d{1,2}(?:st|nd|rd|th)? " + MONTHS + ",? \\d{4}$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^" + MONTHS + " \\d{1,2}(?:st|nd|rd|th)?,? \\d{4}$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^" + MONTHS + ",? \\d{4}$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\d{1,2}:\\d{2}(?::\\d{2})?\\s*(?:[ap]\\.?m\\.?)?$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\d{2,4}\\s*年(?:\\s*\\d{1,2}\\s*月(?:\\s*\\d{1,2}\\s*日)?)?$"),
            Pattern.compile("^\\d{1,2}\\s*月\\s*\\d{1,2}\\s*日$"),
            Pattern.compile("^\\d{2,4}\\s*년(?:\\s*\\d{1,2}\\s*월(?:\\s*\\d{1,2}\\s*일)?)?$"));

    private final OutlineSettings settings;

    public CandidateFilter(OutlineSettings settings) {
        this.settings = settings;
    }

    /**
     * Applies the rules in order; the fragment rule sees the list that survived the earlier ones.
     *
     * @param candidates leveled spans in document order
     * @param title      the extracted title, only consulted when title duplicates are dropped
     */
    public List<LeveledSpan> filter(List<LeveledSpan> candidates, ScriptProfile profile, String title) {
        List<LeveledSpan> kept = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        int datesOrNumbers = 0;
        int tooShort = 0;

        for (LeveledSpan candidate : candidates) {
            String text = HeadingTextUtils.normalize(candidate.getText());
            if (!seen.add(candidate.getPage() + "\u0000" + text)) {
                duplicates++;
                continue;
            }
            if (isDateOrNumber(text)) {
                datesOrNumbers++;
                continue;
            }
            if (isTooShort(text, profile)) {
                tooShort++;
                continue;
            }
            kept.add(candidate);
        }

        List<LeveledSpan> result = dropFragments(kept);
        int fragments = kept.size() - result.size();

        if (settings.isDropTitleDuplicates() && title != null && !title.isEmpty()) {
            String normalizedTitle = HeadingTextUtils.normalize(title);
            result.removeIf(s -> HeadingTextUtils.normalize(s.getText()).equals(normalizedTitle));
        }

        logger.debug("Filter: {} in, {} out (duplicates {}, dates/numbers {}, too short {}, fragments {})",
                candidates.size(), result.size(), duplicates, datesOrNumbers, tooShort, fragments);
        return result;
    }

    boolean isDateOrNumber(String text) {
        if (!HeadingTextUtils.hasLetter(text)) {
            return true;
        }
        for (Pattern p : DATE_PATTERNS) {
            if (p.matcher(text).matches()) {
                return true;
            }
        }
        return false;
    }

    boolean isTooShort(String text, ScriptProfile profile) {
        int length = HeadingTextUtils.codePointLength(text);
        if (length >= settings.getMinHeadingLength()) {
            return false;
        }
        // "序" or "章" alone is a legitimate CJK heading
        return !(profile == ScriptProfile.CJK && length == 1 && HeadingTextUtils.isCjkCharacter(text.codePointAt(0)));
    }

    /**
     * A span whose text is a strict prefix or suffix of its previous or next neighbour on the same
     * page is a split-off piece of that heading; the shorter text goes.
     */
    private List<LeveledSpan> dropFragments(List<LeveledSpan> spans) {
        boolean[] drop = new boolean[spans.size()];
        for (int i = 0; i + 1 < spans.size(); i++) {
            LeveledSpan a = spans.get(i);
            LeveledSpan b = spans.get(i + 1);
            if (a.getPage() != b.getPage()) continue;
            String ta = HeadingTextUtils.normalize(a.getText());
            String tb = HeadingTextUtils.normalize(b.getText());
            if (HeadingTextUtils.isStrictFragmentOf(ta, tb)) {
                drop[i] = true;
            } else if (HeadingTextUtils.isStrictFragmentOf(tb, ta)) {
                drop[i + 1] = true;
            }
        }
        List<LeveledSpan> result = new ArrayList<>();
        for (int i = 0; i < spans.size(); i++) {
            if (!drop[i]) {
                result.add(spans.get(i));
            }
        }
        return result;
    }
}
