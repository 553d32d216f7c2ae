package com.casewright.core.model;

import java.util.List;

/**
 * Inclusive, 1-based line span inside a requirement document.
 */
public record LineRange(int start, int end) {

    public LineRange {
        if (start < 1) {
            throw new IllegalArgumentException("Line range must start at 1 or later, got " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("Line range end " + end + " precedes start " + start);
        }
    }

    public boolean overlaps(LineRange other) {
        return start <= other.end && other.start <= end;
    }

    public int length() {
        return end - start + 1;
    }

    public List<Integer> toList() {
        return List.of(start, end);
    }

    public static LineRange fromList(List<Integer> positions) {
        if (positions == null || positions.isEmpty()) {
            return null;
        }
        if (positions.size() != 2 || positions.get(0) == null || positions.get(1) == null) {
            throw new IllegalArgumentException("matched_positions must be [start, end], got " + positions);
        }
        return new LineRange(positions.get(0), positions.get(1));
    }
}
