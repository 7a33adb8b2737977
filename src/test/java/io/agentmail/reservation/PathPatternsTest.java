package io.agentmail.reservation;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class PathPatternsTest {

    @Test
    void normalizeCanonicalizesSeparatorsAndGlobstars() {
        Assertions.assertEquals("src/api", PathPatterns.normalize("./src//api/"));
        Assertions.assertEquals("src/api/x.py", PathPatterns.normalize("/src\\api\\x.py"));
        Assertions.assertEquals("a/**/b", PathPatterns.normalize("a/**/**/b"));
        Assertions.assertEquals("", PathPatterns.normalize("  "));
    }

    @Test
    void globstarCoversNestedPaths() {
        Assertions.assertTrue(PathPatterns.overlaps("src/**", "src/api/users.py"));
        Assertions.assertTrue(PathPatterns.overlaps("src/**", "src"));
        Assertions.assertTrue(PathPatterns.overlaps("**", "anything/at/all"));
        Assertions.assertTrue(PathPatterns.overlaps("src/**/test_*.py", "src/a/b/test_x.py"));
        Assertions.assertFalse(PathPatterns.overlaps("docs/**", "src/**"));
    }

    @Test
    void singleStarStaysInsideOneSegment() {
        Assertions.assertFalse(PathPatterns.overlaps("src/*.py", "src/api/x.py"));
        Assertions.assertTrue(PathPatterns.overlaps("src/*.py", "src/a*"));
        Assertions.assertFalse(PathPatterns.overlaps("a/?.txt", "a/ab.txt"));
        Assertions.assertTrue(PathPatterns.overlaps("a/??.txt", "a/ab.txt"));
    }

    @Test
    void overlapIsDecidedBetweenTwoWildcardPatterns() {
        Assertions.assertTrue(PathPatterns.segmentOverlaps("*.py", "test_*"));
        Assertions.assertFalse(PathPatterns.segmentOverlaps("*.py", "*.ts"));
        Assertions.assertFalse(PathPatterns.overlaps("src/**/*.py", "src/**/*.ts"));
        Assertions.assertTrue(PathPatterns.overlaps("src/**/models/*", "src/app/**"));
        Assertions.assertEquals(
                PathPatterns.overlaps("lib/*/core/**", "lib/net/**/x.c"),
                PathPatterns.overlaps("lib/net/**/x.c", "lib/*/core/**"));
    }

    @Test
    void matchesRejectsWildcardPaths() {
        Assertions.assertTrue(PathPatterns.matches("src/**", "src/main/App.java"));
        Assertions.assertFalse(PathPatterns.matches("src/*.java", "src/main/App.java"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> PathPatterns.matches("src/**", "src/*.java"));
    }
}
