package com.example.pdfoutline.service;

import com.example.pdfoutline.model.HeadingEntry;
import com.example.pdfoutline.model.LeveledSpan;
import com.example.pdfoutline.model.Outline;
import com.example.pdfoutline.util.HeadingTextUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the surviving headings and produces the final outline.
 */
@Service
public class OutlineAssembler {

    private static final Comparator<LeveledSpan> READING_ORDER = Comparator
            .comparingInt(LeveledSpan::getPage)
            .thenComparingDouble(LeveledSpan::getTop)
            .thenComparingInt(LeveledSpan::getIndex);

    public Outline assemble(String title, List<LeveledSpan> headings) {
        List<LeveledSpan> ordered = new ArrayList<>(headings);
        ordered.sort(READING_ORDER);

        List<HeadingEntry> entries = new ArrayList<>(ordered.size());
        for (LeveledSpan heading : ordered) {
            // Downstream consumers expect the trailing space of the original output format
            String text = HeadingTextUtils.normalize(heading.getText()) + " ";
            entries.add(new HeadingEntry(heading.getLevel(), text, heading.getPage()));
        }
        return new Outline(HeadingTextUtils.normalize(title), entries);
    }
}
