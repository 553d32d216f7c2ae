package com.casewright.core.matching;

import com.casewright.core.model.LineRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A requirement document split into 1-based lines, with char-offset to line lookups.
 * A trailing newline does not produce an extra empty line.
 */
public final class DocumentLines {

    private final String text;
    private final List<String> lines;
    /** Char offset at which each line starts; index 0 is line 1. */
    private final int[] lineStarts;

    private DocumentLines(String text) {
        this.text = text;
        List<String> split = new ArrayList<>(Arrays.asList(text.split("\n", -1)));
        if (split.size() > 1 && split.get(split.size() - 1).isEmpty()) {
            split.remove(split.size() - 1);
        }
        this.lines = List.copyOf(split);
        this.lineStarts = new int[lines.size()];
        int offset = 0;
        for (int i = 0; i < lines.size(); i++) {
            lineStarts[i] = offset;
            offset += lines.get(i).length() + 1;
        }
    }

    public static DocumentLines of(String text) {
        return new DocumentLines(text == null ? "" : text);
    }

    public String text() {
        return text;
    }

    public int size() {
        return lines.size();
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    /** @param lineNumber 1-based */
    public String line(int lineNumber) {
        return lines.get(lineNumber - 1);
    }

    public LineRange whole() {
        return new LineRange(1, Math.max(1, lines.size()));
    }

    /** Lines in the range joined with "\n"; the range is clamped to the document. */
    public String slice(LineRange range) {
        int from = Math.max(1, range.start());
        int to = Math.min(lines.size(), range.end());
        if (from > to) {
            return "";
        }
        return String.join("\n", lines.subList(from - 1, to));
    }

    /** 1-based line containing the given char offset. */
    public int lineAt(int charOffset) {
        int idx = Arrays.binarySearch(lineStarts, charOffset);
        if (idx >= 0) {
            return idx + 1;
        }
        return -idx - 1;
    }
}
