package com.casewright.core.matching;

import com.casewright.core.model.FunctionPoint;
import com.casewright.core.model.LineRange;
import com.casewright.core.model.MatchConfidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Anchors function points to line ranges of their requirement document.
 * <p>
 * Evidence is tried strongest first: verbatim phrases, then keyword density, then a
 * heading that matches the section hint or the point's name. With no evidence at all
 * the whole document is used. Sibling ranges are then made non-overlapping by clipping
 * the earlier range at the later one's start.
 * <p>
 * Stateless and thread-safe.
 */
@Component
public class PassageMatcher {

    private static final Logger log = LoggerFactory.getLogger(PassageMatcher.class);

    /** Mean keyword hits per line, over a window of +/- {@link #DENSITY_RADIUS}, a line must exceed. */
    static final double DENSITY_THRESHOLD = 0.3;
    static final int DENSITY_RADIUS = 1;
    /** Run density at or above which a keyword match counts as Medium rather than Low. */
    static final double MEDIUM_DENSITY = 0.6;

    private static final Pattern MARKDOWN_HEADING = Pattern.compile("^\\s{0,3}(#{1,6})\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern NUMBERED_HEADING =
            Pattern.compile("^\\s*(\\d+(?:\\.\\d+)*)[.、)]?\\s+(\\S.*)$");
    private static final Pattern CHINESE_NUMBERED_HEADING =
            Pattern.compile("^\\s*([一二三四五六七八九十]+)[、.]\\s*(\\S.*)$");
    private static final int PLAIN_HEADING_MAX_LENGTH = 30;

    /**
     * Finds the candidate range for one function point, before boundary resolution.
     */
    public MatchCandidate locate(DocumentLines doc, FunctionPoint point) {
        if (doc.isBlank()) {
            return new MatchCandidate(doc.whole(), MatchConfidence.LOW, MatchEvidence.FULL_DOCUMENT);
        }

        LineRange phraseRange = matchExactPhrases(doc, point.exactPhrases());
        if (phraseRange != null) {
            return new MatchCandidate(phraseRange, MatchConfidence.HIGH, MatchEvidence.EXACT_PHRASE);
        }

        MatchCandidate keywordMatch = matchKeywords(doc, point.keywords());
        if (keywordMatch != null) {
            return keywordMatch;
        }

        LineRange section = matchHeading(doc, point.sectionHint());
        if (section == null) {
            section = matchHeading(doc, point.name());
        }
        if (section != null) {
            return new MatchCandidate(section, MatchConfidence.LOW, MatchEvidence.SECTION_HEADING);
        }

        return new MatchCandidate(doc.whole(), MatchConfidence.LOW, MatchEvidence.FULL_DOCUMENT);
    }

    /**
     * Matches every point against the document and resolves overlaps between them.
     * Output order equals input order.
     */
    public MatchReport matchAll(String document, List<FunctionPoint> points) {
        DocumentLines doc = DocumentLines.of(document);
        List<MatchCandidate> candidates = new ArrayList<>(points.size());
        for (FunctionPoint point : points) {
            candidates.add(locate(doc, point));
        }

        List<Slot> slots = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            MatchCandidate c = candidates.get(i);
            if (c.isFallback()) {
                log.info("No evidence for function point '{}', using the full document", points.get(i).name());
            }
            slots.add(new Slot(i, points.get(i).name(), c.range(), c.isFallback()));
        }
        List<String> conflicts = new ArrayList<>();
        List<LineRange> resolved = resolveBoundaries(slots, conflicts);

        List<FunctionPoint> matched = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            LineRange range = resolved.get(i);
            matched.add(points.get(i).withMatch(doc.slice(range), range, candidates.get(i).confidence()));
        }
        return new MatchReport(matched, conflicts);
    }

    /**
     * Recomputes the range of {@code target} only, then clips it against the existing
     * ranges of its siblings. Siblings are never recomputed.
     */
    public RematchResult rematch(String document, FunctionPoint target, List<FunctionPoint> allPoints) {
        DocumentLines doc = DocumentLines.of(document);
        MatchCandidate candidate = locate(doc, target);

        List<Slot> slots = new ArrayList<>();
        slots.add(new Slot(0, target.name(), candidate.range(), candidate.isFallback()));
        if (allPoints != null) {
            for (FunctionPoint other : allPoints) {
                if (isSamePoint(target, other)) {
                    continue;
                }
                LineRange existing = other.range();
                if (existing == null) {
                    continue;
                }
                slots.add(new Slot(slots.size(), other.name(), existing, false));
            }
        }
        List<String> conflicts = new ArrayList<>();
        LineRange range = resolveBoundaries(slots, conflicts).get(0);
        return new RematchResult(doc.slice(range), range.toList(), candidate.confidence());
    }

    /**
     * Orders slots by start line and clips each range's end to the line before the next
     * overlapping start. When clipping would leave a range empty (equal starts) the overlap is
     * kept and described in {@code conflicts}. Fallback slots keep their range and do not clip
     * others; each one overlapping a matched sibling is also described in {@code conflicts}.
     *
     * @return resolved ranges indexed like {@code slots}
     */
    List<LineRange> resolveBoundaries(List<Slot> slots, List<String> conflicts) {
        List<LineRange> result = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            result.add(slot.range());
        }

        List<Slot> ordered = slots.stream()
                .filter(s -> !s.fallback())
                .sorted(Comparator.comparingInt((Slot s) -> s.range().start()).thenComparingInt(Slot::index))
                .toList();

        for (int a = 0; a < ordered.size(); a++) {
            Slot earlier = ordered.get(a);
            LineRange range = result.get(earlier.index());
            Integer clipAt = null;
            for (int b = a + 1; b < ordered.size(); b++) {
                Slot later = ordered.get(b);
                LineRange laterRange = later.range();
                if (!laterRange.overlaps(range)) {
                    continue;
                }
                if (laterRange.start() == range.start()) {
                    String note = "Function points '" + earlier.label() + "' and '" + later.label()
                            + "' both start at line " + range.start() + "; overlap kept";
                    log.warn("Boundary conflict accepted: {}", note);
                    conflicts.add(note);
                    continue;
                }
                if (clipAt == null || laterRange.start() < clipAt) {
                    clipAt = laterRange.start();
                }
            }
            if (clipAt != null) {
                result.set(earlier.index(), new LineRange(range.start(), clipAt - 1));
            }
        }

        for (Slot slot : slots) {
            if (!slot.fallback()) {
                continue;
            }
            List<String> overlapped = new ArrayList<>();
            for (Slot other : ordered) {
                if (result.get(other.index()).overlaps(slot.range())) {
                    overlapped.add("'" + other.label() + "'");
                }
            }
            if (!overlapped.isEmpty()) {
                String note = "Function point '" + slot.label() + "' has no matching evidence and spans the whole"
                        + " document, overlapping " + String.join(", ", overlapped);
                log.warn("Boundary conflict accepted: {}", note);
                conflicts.add(note);
            }
        }
        return result;
    }

    private static LineRange matchExactPhrases(DocumentLines doc, List<String> phrases) {
        int start = Integer.MAX_VALUE;
        int end = Integer.MIN_VALUE;
        String text = doc.text();
        for (String phrase : phrases) {
            if (phrase == null || phrase.isBlank()) {
                continue;
            }
            String p = phrase.strip();
            int at = text.indexOf(p);
            if (at < 0) {
                continue;
            }
            start = Math.min(start, doc.lineAt(at));
            end = Math.max(end, doc.lineAt(at + p.length() - 1));
        }
        return start == Integer.MAX_VALUE ? null : new LineRange(start, end);
    }

    private static MatchCandidate matchKeywords(DocumentLines doc, List<String> keywords) {
        Set<String> terms = new LinkedHashSet<>();
        for (String k : keywords) {
            if (k != null && !k.isBlank()) {
                terms.add(k.strip().toLowerCase(Locale.ROOT));
            }
        }
        if (terms.isEmpty()) {
            return null;
        }

        int n = doc.size();
        int[] hits = new int[n];
        boolean any = false;
        for (int i = 0; i < n; i++) {
            String line = doc.line(i + 1).toLowerCase(Locale.ROOT);
            for (String term : terms) {
                if (line.contains(term)) {
                    hits[i]++;
                }
            }
            any |= hits[i] > 0;
        }
        if (!any) {
            return null;
        }

        // longest run of lines whose windowed density exceeds the threshold
        int bestStart = -1;
        int bestEnd = -1;
        int runStart = -1;
        for (int i = 0; i <= n; i++) {
            boolean dense = i < n && windowDensity(hits, i) > DENSITY_THRESHOLD;
            if (dense && runStart < 0) {
                runStart = i;
            } else if (!dense && runStart >= 0) {
                if (bestStart < 0 || (i - 1 - runStart) > (bestEnd - bestStart)) {
                    bestStart = runStart;
                    bestEnd = i - 1;
                }
                runStart = -1;
            }
        }
        if (bestStart < 0) {
            return null;
        }
        while (bestStart < bestEnd && hits[bestStart] == 0) {
            bestStart++;
        }
        while (bestEnd > bestStart && hits[bestEnd] == 0) {
            bestEnd--;
        }

        int totalHits = 0;
        Set<String> distinct = new LinkedHashSet<>();
        for (int i = bestStart; i <= bestEnd; i++) {
            totalHits += hits[i];
            String line = doc.line(i + 1).toLowerCase(Locale.ROOT);
            for (String term : terms) {
                if (line.contains(term)) {
                    distinct.add(term);
                }
            }
        }
        double runDensity = (double) totalHits / (bestEnd - bestStart + 1);
        boolean strong = runDensity >= MEDIUM_DENSITY && distinct.size() >= Math.min(2, terms.size());
        return new MatchCandidate(new LineRange(bestStart + 1, bestEnd + 1),
                strong ? MatchConfidence.MEDIUM : MatchConfidence.LOW, MatchEvidence.KEYWORD_DENSITY);
    }

    private static double windowDensity(int[] hits, int i) {
        int from = Math.max(0, i - DENSITY_RADIUS);
        int to = Math.min(hits.length - 1, i + DENSITY_RADIUS);
        int sum = 0;
        for (int j = from; j <= to; j++) {
            sum += hits[j];
        }
        return (double) sum / (to - from + 1);
    }

    /**
     * Finds a heading line matching {@code hint} and returns the section it opens,
     * up to the line before the next heading of the same or a higher level.
     */
    private static LineRange matchHeading(DocumentLines doc, String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        String wanted = normalize(hint);
        if (wanted.isEmpty()) {
            return null;
        }
        for (int line = 1; line <= doc.size(); line++) {
            Heading heading = parseHeading(doc.line(line));
            String title;
            int level;
            if (heading != null) {
                title = normalize(heading.title());
                level = heading.level();
            } else {
                String plain = doc.line(line).strip();
                if (plain.isEmpty() || plain.length() > PLAIN_HEADING_MAX_LENGTH) {
                    continue;
                }
                title = normalize(plain);
                // a plain line only counts when it is the hint itself
                if (!title.equals(wanted)) {
                    continue;
                }
                level = Integer.MAX_VALUE;
            }
            if (title.isEmpty() || !(title.equals(wanted) || (wanted.length() >= 2 && title.contains(wanted)))) {
                continue;
            }
            int end = doc.size();
            for (int next = line + 1; next <= doc.size(); next++) {
                Heading h = parseHeading(doc.line(next));
                if (h != null && h.level() <= level) {
                    end = next - 1;
                    break;
                }
            }
            return new LineRange(line, end);
        }
        return null;
    }

    static Heading parseHeading(String line) {
        Matcher md = MARKDOWN_HEADING.matcher(line);
        if (md.matches()) {
            return new Heading(md.group(1).length(), md.group(2));
        }
        Matcher num = NUMBERED_HEADING.matcher(line);
        if (num.matches() && line.strip().length() <= 60) {
            return new Heading(num.group(1).split("\\.").length, num.group(2));
        }
        Matcher zh = CHINESE_NUMBERED_HEADING.matcher(line);
        if (zh.matches() && line.strip().length() <= 60) {
            return new Heading(1, zh.group(2));
        }
        return null;
    }

    private static String normalize(String s) {
        return s.replaceAll("[\\s\\p{Punct}：，。、（）【】]+", "").toLowerCase(Locale.ROOT);
    }

    private static boolean isSamePoint(FunctionPoint a, FunctionPoint b) {
        if (a.id() != null && b.id() != null) {
            return a.id().equals(b.id());
        }
        return Objects.equals(a.name(), b.name());
    }

    record Heading(int level, String title) {}

    /**
     * One range taking part in boundary resolution.
     *
     * @param index    position in the caller's list
     * @param fallback true for full-document fallbacks, which never clip or get clipped
     */
    record Slot(int index, String label, LineRange range, boolean fallback) {}
}
