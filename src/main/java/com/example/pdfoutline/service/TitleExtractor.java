package com.example.pdfoutline.service;

import com.example.pdfoutline.config.OutlineSettings;
import com.example.pdfoutline.model.SpanDocument;
import com.example.pdfoutline.model.TextSpan;
import com.example.pdfoutline.util.HeadingTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Determines the document title: embedded metadata when it is meaningful, otherwise the
 * largest text on the first page.
 */
@Service
public class TitleExtractor {

    private static final Logger logger = LoggerFactory.getLogger(TitleExtractor.class);

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "^(?:untitled(?: document)?|document|title|no title|none|unknown"
                    + "|.*\\.(?:pdf|docx?|pptx?|xlsx?|txt|rtf)"
                    + "|microsoft (?:word|powerpoint)\\b.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    // A title line further below its predecessor than this (in multiples of font size) ends the run
    private static final double MAX_LINE_GAP_RATIO = 1.5;

    private final OutlineSettings settings;

    public TitleExtractor(OutlineSettings settings) {
        this.settings = settings;
    }

    public String extract(SpanDocument document) {
        String metadataTitle = HeadingTextUtils.normalize(document.getMetadataTitle());
        if (!metadataTitle.isEmpty() && !isPlaceholder(metadataTitle)) {
            logger.debug("Using metadata title \"{}\"", metadataTitle);
            return metadataTitle;
        }

        String fromLayout = fromFirstPage(document);
        logger.debug("Metadata title \"{}\" unusable, first-page title \"{}\"", metadataTitle, fromLayout);
        return fromLayout;
    }

    boolean isPlaceholder(String title) {
        return PLACEHOLDER.matcher(title.trim()).matches();
    }

    private String fromFirstPage(SpanDocument document) {
        List<TextSpan> firstPage = document.getSpans().stream()
                .filter(s -> s.getPage() == 1)
                .collect(Collectors.toList());
        double pageExtent = pageExtent(document, firstPage);

        List<TextSpan> eligible = new ArrayList<>();
        for (TextSpan span : firstPage) {
            if (isEligible(span, pageExtent)) {
                eligible.add(span);
            }
        }
        if (eligible.isEmpty()) {
            return "";
        }

        double maxSize = eligible.stream().mapToDouble(TextSpan::getFontSize).max().orElse(0);
        double tolerance = settings.getSizeTolerance();

        List<TextSpan> run = new ArrayList<>();
        for (TextSpan span : eligible) {
            boolean titleSized = span.getFontSize() >= maxSize - tolerance;
            if (run.isEmpty()) {
                if (titleSized) {
                    run.add(span);
                }
                continue;
            }
            if (!titleSized || !isCloseBelow(run, span)) {
                break;
            }
            run.add(span);
        }
        return joinInReadingOrder(run);
    }

    /** Reported page height, or the lowest span edge on page one when the collector gave none. */
    private static double pageExtent(SpanDocument document, List<TextSpan> firstPage) {
        Float pageHeight = document.getPageHeight();
        if (pageHeight != null && pageHeight > 0) {
            return pageHeight;
        }
        return firstPage.stream().mapToDouble(s -> s.getBbox().getY1()).max().orElse(0);
    }

    /** Spans with no letters and spans inside the header/footer bands never make a title. */
    private boolean isEligible(TextSpan span, double pageExtent) {
        if (!HeadingTextUtils.hasLetter(HeadingTextUtils.normalize(span.getText()))) {
            return false;
        }
        if (pageExtent <= 0) {
            return true;
        }
        double band = pageExtent * settings.getMarginBandRatio();
        return span.getBbox().getY1() > band && span.getBbox().getY0() < pageExtent - band;
    }

    private boolean isCloseBelow(List<TextSpan> run, TextSpan next) {
        float bottom = (float) run.stream().mapToDouble(s -> s.getBbox().getY1()).max().orElse(0);
        double gap = next.getBbox().getY0() - bottom;
        return gap <= MAX_LINE_GAP_RATIO * next.getFontSize();
    }

    /** Same-line spans are joined left to right, lines top to bottom, all with single spaces. */
    private String joinInReadingOrder(List<TextSpan> run) {
        List<TextSpan> byTop = new ArrayList<>(run);
        byTop.sort(Comparator.comparingDouble(s -> s.getBbox().centerY()));

        List<List<TextSpan>> lines = new ArrayList<>();
        for (TextSpan span : byTop) {
            List<TextSpan> last = lines.isEmpty() ? null : lines.get(lines.size() - 1);
            if (last != null && sameLine(last.get(0), span)) {
                last.add(span);
            } else {
                List<TextSpan> line = new ArrayList<>();
                line.add(span);
                lines.add(line);
            }
        }

        return lines.stream()
                .flatMap(line -> line.stream().sorted(Comparator.comparingDouble(s -> s.getBbox().getX0())))
                .map(s -> HeadingTextUtils.normalize(s.getText()))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.joining(" "));
    }

    private static boolean sameLine(TextSpan a, TextSpan b) {
        double height = Math.min(heightOf(a), heightOf(b));
        return Math.abs(a.getBbox().centerY() - b.getBbox().centerY()) <= 0.5 * height;
    }

    private static double heightOf(TextSpan span) {
        return span.getBbox().height() > 0 ? span.getBbox().height() : span.getFontSize();
    }
}
