package io.agentmail.reservation;

import java.util.ArrayList;
import java.util.List;

/**
 * Glob patterns over repository-relative paths.
 *
 * <p>{@code *} matches any run of characters inside one segment, {@code ?} matches one character
 * inside one segment, and a segment that is exactly {@code **} matches zero or more whole segments.
 * Two patterns overlap when at least one concrete path matches both, which is decided directly on
 * the patterns without enumerating the file tree.
 */
public final class PathPatterns {
    public static final String GLOBSTAR = "**";

    private PathPatterns() {
    }

    /**
     * Canonical spelling: forward slashes, no leading {@code ./} or {@code /}, no empty segments,
     * no trailing slash, and no repeated {@code **} segments.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim().replace('\\', '/');
        List<String> kept = new ArrayList<>();
        for (String segment : value.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if (GLOBSTAR.equals(segment) && !kept.isEmpty() && GLOBSTAR.equals(kept.get(kept.size() - 1))) {
                continue;
            }
            kept.add(segment);
        }
        return String.join("/", kept);
    }

    public static boolean overlaps(String left, String right) {
        String[] a = segments(left);
        String[] b = segments(right);
        Boolean[][] memo = new Boolean[a.length + 1][b.length + 1];
        return overlapSegments(a, 0, b, 0, memo);
    }

    /**
     * Whether the concrete {@code path} is matched by {@code pattern}.
     */
    static boolean matches(String pattern, String path) {
        String concrete = normalize(path);
        if (concrete.contains("*") || concrete.contains("?")) {
            throw new IllegalArgumentException("path must not contain wildcards: " + path);
        }
        return overlaps(pattern, concrete);
    }

    private static String[] segments(String pattern) {
        String normalized = normalize(pattern);
        return normalized.isEmpty() ? new String[0] : normalized.split("/");
    }

    private static boolean overlapSegments(String[] a, int i, String[] b, int j, Boolean[][] memo) {
        if (memo[i][j] != null) {
            return memo[i][j];
        }
        boolean result;
        boolean aDone = i == a.length;
        boolean bDone = j == b.length;
        if (aDone && bDone) {
            result = true;
        } else if (!aDone && GLOBSTAR.equals(a[i])) {
            // ** absorbs nothing, or absorbs b's next segment and stays available.
            result = overlapSegments(a, i + 1, b, j, memo)
                    || (!bDone && overlapSegments(a, i, b, j + 1, memo));
        } else if (!bDone && GLOBSTAR.equals(b[j])) {
            result = overlapSegments(a, i, b, j + 1, memo)
                    || (!aDone && overlapSegments(a, i + 1, b, j, memo));
        } else if (aDone || bDone) {
            result = false;
        } else {
            result = segmentOverlaps(a[i], b[j]) && overlapSegments(a, i + 1, b, j + 1, memo);
        }
        memo[i][j] = result;
        return result;
    }

    /**
     * Intersection test for two single-segment globs built from literals, {@code *} and {@code ?}.
     */
    static boolean segmentOverlaps(String x, String y) {
        Boolean[][] memo = new Boolean[x.length() + 1][y.length() + 1];
        return charsOverlap(x, 0, y, 0, memo);
    }

    private static boolean charsOverlap(String x, int i, String y, int j, Boolean[][] memo) {
        if (memo[i][j] != null) {
            return memo[i][j];
        }
        boolean xDone = i == x.length();
        boolean yDone = j == y.length();
        boolean result;
        if (xDone && yDone) {
            result = true;
        } else if (!xDone && x.charAt(i) == '*') {
            result = charsOverlap(x, i + 1, y, j, memo)
                    || (!yDone && charsOverlap(x, i, y, j + 1, memo));
        } else if (!yDone && y.charAt(j) == '*') {
            result = charsOverlap(x, i, y, j + 1, memo)
                    || (!xDone && charsOverlap(x, i + 1, y, j, memo));
        } else if (xDone || yDone) {
            result = false;
        } else {
            char cx = x.charAt(i);
            char cy = y.charAt(j);
            result = (cx == '?' || cy == '?' || cx == cy) && charsOverlap(x, i + 1, y, j + 1, memo);
        }
        memo[i][j] = result;
        return result;
    }
}
