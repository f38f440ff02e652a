package com.example.pdfoutline.util;

import com.example.pdfoutline.model.BoundingBox;
import com.example.pdfoutline.model.TextSpan;
import com.itextpdf.io.font.FontProgram;
import com.itextpdf.kernel.geom.LineSegment;
import com.itextpdf.kernel.geom.Vector;
import com.itextpdf.kernel.pdf.canvas.parser.EventType;
import com.itextpdf.kernel.pdf.canvas.parser.data.IEventData;
import com.itextpdf.kernel.pdf.canvas.parser.data.TextRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.listener.IEventListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collects styled text spans from one page: text with effective font size, bold/italic flags and
 * a top-left-origin bounding box. Consecutive text chunks are merged while they stay on the same
 * baseline with the same style.
 */
public class StyledTextExtractor implements IEventListener {

    private static final float BASELINE_TOLERANCE = 2.0f;
    private static final float SIZE_TOLERANCE = 0.5f;
    private static final float WORD_GAP_RATIO = 0.15f;
    private static final float RUN_BREAK_GAP_RATIO = 3.0f;

    private final int pageNumber;
    private final float pageTop;
    private final List<TextSpan> spans = new ArrayList<>();

    private final StringBuilder runText = new StringBuilder();
    private float runBaseline;
    private float runSize;
    private boolean runBold;
    private boolean runItalic;
    private float runX0;
    private float runX1;
    private float runTop;
    private float runBottom;

    public StyledTextExtractor(int pageNumber, float pageTop) {
        this.pageNumber = pageNumber;
        this.pageTop = pageTop;
    }

    @Override
    public void eventOccurred(IEventData data, EventType type) {
        if (type != EventType.RENDER_TEXT) return;
        TextRenderInfo info = (TextRenderInfo) data;
        String text = info.getText();
        if (text == null || text.isEmpty()) return;

        float size = effectiveFontSize(info);
        if (size <= 0) return;

        String fontName = "";
        int weight = 0;
        if (info.getFont() != null && info.getFont().getFontProgram() != null) {
            FontProgram program = info.getFont().getFontProgram();
            String name = program.getFontNames().getFontName();
            fontName = name == null ? "" : name.toLowerCase(Locale.ROOT);
            weight = program.getFontNames().getFontWeight();
        }
        boolean bold = weight >= 600 || fontName.contains("bold") || fontName.contains("black")
                || fontName.contains("heavy") || fontName.contains("semibold") || fontName.contains("demi");
        boolean italic = fontName.contains("italic") || fontName.contains("oblique");

        LineSegment baseline = info.getBaseline();
        float baselineY = baseline.getStartPoint().get(Vector.I2);
        float x0 = baseline.getStartPoint().get(Vector.I1);
        float x1 = baseline.getEndPoint().get(Vector.I1);
        float top = pageTop - info.getAscentLine().getStartPoint().get(Vector.I2);
        float bottom = pageTop - info.getDescentLine().getStartPoint().get(Vector.I2);

        if (runText.length() > 0) {
            float gap = x0 - runX1;
            boolean sameRun = Math.abs(baselineY - runBaseline) <= BASELINE_TOLERANCE
                    && Math.abs(size - runSize) <= SIZE_TOLERANCE
                    && bold == runBold
                    && italic == runItalic
                    && gap <= RUN_BREAK_GAP_RATIO * size;
            if (!sameRun) {
                flush();
            } else if (gap > WORD_GAP_RATIO * size && !endsWithSpace() && !text.startsWith(" ")) {
                runText.append(' ');
            }
        }

        if (runText.length() == 0) {
            if (text.trim().isEmpty()) return;
            runBaseline = baselineY;
            runSize = size;
            runBold = bold;
            runItalic = italic;
            runX0 = x0;
            runX1 = x1;
            runTop = top;
            runBottom = bottom;
        }
        runText.append(text);
        runX0 = Math.min(runX0, x0);
        runX1 = Math.max(runX1, x1);
        runTop = Math.min(runTop, top);
        runBottom = Math.max(runBottom, bottom);
    }

    /** Font size in user space: the text matrix may scale the nominal size. */
    private static float effectiveFontSize(TextRenderInfo info) {
        float nominal = info.getFontSize();
        float scaled = new Vector(0, nominal, 0).cross(info.getTextMatrix()).length();
        return scaled > 0 ? scaled : Math.abs(nominal);
    }

    private boolean endsWithSpace() {
        return runText.charAt(runText.length() - 1) == ' ';
    }

    private void flush() {
        String text = runText.toString().trim();
        if (!text.isEmpty()) {
            BoundingBox box = new BoundingBox(runX0, runTop, runX1, runBottom);
            spans.add(new TextSpan(text, runSize, runBold, runItalic, box, pageNumber));
        }
        runText.setLength(0);
    }

    public void finish() {
        flush();
    }

    @Override
    public Set<EventType> getSupportedEvents() {
        return Collections.singleton(EventType.RENDER_TEXT);
    }

    public List<TextSpan> getSpans() {
        return spans;
    }
}
