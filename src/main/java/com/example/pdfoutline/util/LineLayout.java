package com.example.pdfoutline.util;

import com.example.pdfoutline.model.BoundingBox;
import com.example.pdfoutline.model.TextSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups spans into visual lines per page and measures the vertical whitespace between lines.
 * Indexes are positions in the span list the layout was built from.
 */
public final class LineLayout {

    private final Map<Integer, Line> lineBySpan = new HashMap<>();
    private final double medianGap;

    private LineLayout(List<TextSpan> spans) {
        Map<Integer, List<Integer>> byPage = new TreeMap<>();
        for (int i = 0; i < spans.size(); i++) {
            byPage.computeIfAbsent(spans.get(i).getPage(), k -> new ArrayList<>()).add(i);
        }

        List<Double> gaps = new ArrayList<>();
        for (List<Integer> pageSpans : byPage.values()) {
            List<Line> pageLines = buildPageLines(spans, pageSpans);
            for (int i = 0; i < pageLines.size(); i++) {
                Line line = pageLines.get(i);
                if (i > 0) {
                    double gap = Math.max(0, line.top - pageLines.get(i - 1).bottom);
                    line.gapAbove = gap;
                    pageLines.get(i - 1).gapBelow = gap;
                    gaps.add(gap);
                }
                for (Integer idx : line.members) {
                    lineBySpan.put(idx, line);
                }
            }
        }
        this.medianGap = median(gaps);
    }

    public static LineLayout of(List<TextSpan> spans) {
        return new LineLayout(spans);
    }

    private static List<Line> buildPageLines(List<TextSpan> spans, List<Integer> pageSpans) {
        List<Integer> ordered = new ArrayList<>(pageSpans);
        ordered.sort(Comparator.comparingDouble((Integer i) -> spans.get(i).getBbox().centerY())
                .thenComparingDouble(i -> spans.get(i).getBbox().getX0())
                .thenComparingInt(i -> i));

        List<Line> result = new ArrayList<>();
        Line current = null;
        for (Integer idx : ordered) {
            TextSpan span = spans.get(idx);
            if (current != null && current.accepts(span)) {
                current.add(idx, span);
            } else {
                current = new Line(span.getPage());
                current.add(idx, span);
                result.add(current);
            }
        }
        result.sort(Comparator.comparingDouble((Line l) -> l.top));
        return result;
    }

    private static double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 0 ? (sorted.get(mid - 1) + sorted.get(mid)) / 2.0 : sorted.get(mid);
    }

    /** Median vertical gap between consecutive lines of the same page, 0 when there is none. */
    public double getMedianGap() {
        return medianGap;
    }

    public boolean isAloneOnLine(int spanIndex) {
        return lineBySpan.get(spanIndex).members.size() == 1;
    }

    /** Whitespace above the span's line; unbounded for the first line of a page. */
    public double gapAbove(int spanIndex) {
        return lineBySpan.get(spanIndex).gapAbove;
    }

    /** Whitespace below the span's line; unbounded for the last line of a page. */
    public double gapBelow(int spanIndex) {
        return lineBySpan.get(spanIndex).gapBelow;
    }

    private static final class Line {
        private final int page;
        private final List<Integer> members = new ArrayList<>();
        private double top = Double.MAX_VALUE;
        private double bottom = -Double.MAX_VALUE;
        private double centerSum;
        private double minHeight = Double.MAX_VALUE;
        private double gapAbove = Double.POSITIVE_INFINITY;
        private double gapBelow = Double.POSITIVE_INFINITY;

        Line(int page) {
            this.page = page;
        }

        boolean accepts(TextSpan span) {
            if (span.getPage() != page) {
                return false;
            }
            BoundingBox box = span.getBbox();
            double height = box.height() > 0 ? box.height() : span.getFontSize();
            double tolerance = 0.5 * Math.min(height, minHeight);
            return Math.abs(box.centerY() - centerSum / members.size()) <= tolerance;
        }

        void add(int index, TextSpan span) {
            BoundingBox box = span.getBbox();
            members.add(index);
            top = Math.min(top, box.getY0());
            bottom = Math.max(bottom, box.getY1());
            centerSum += box.centerY();
            double height = box.height() > 0 ? box.height() : span.getFontSize();
            minHeight = Math.min(minHeight, height);
        }
    }
}
