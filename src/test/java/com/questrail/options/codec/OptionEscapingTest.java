package com.questrail.options.codec;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OptionEscapingTest
{
    // ---------------------------------------------------------------------
    // Escape
    // ---------------------------------------------------------------------

    @Test
    void escapeLeavesPlainTextUntouched() {
        assertEquals("abc", OptionEscaping.escape("abc", ':', '\\'));
        assertEquals("", OptionEscaping.escape("", ':', '\\'));
    }

    @Test
    void escapePrefixesSeparatorAndEscapeCharacter() {
        assertEquals("a\\:b", OptionEscaping.escape("a:b", ':', '\\'));
        assertEquals("a\\\\b", OptionEscaping.escape("a\\b", ':', '\\'));
        assertEquals("\\:\\\\\\:", OptionEscaping.escape(":\\:", ':', '\\'));
    }

    @Test
    void escapeIgnoresOtherSeparators() {
        assertEquals("a=b|c", OptionEscaping.escape("a=b|c", ':', '\\'));
    }

    // ---------------------------------------------------------------------
    // Split
    // ---------------------------------------------------------------------

    /**
     * Splitting the empty string yields exactly one empty segment; container
     * codecs rely on this and special-case empty input themselves.
     */
    @Test
    void splitEmptyStringYieldsOneEmptySegment() {
        assertEquals(List.of(""), OptionEscaping.split("", ':', '\\'));
    }

    @Test
    void splitKeepsEmptySegments() {
        assertEquals(List.of("a", "b", "", "c"), OptionEscaping.split("a:b::c", ':', '\\'));
        assertEquals(List.of("", ""), OptionEscaping.split(":", ':', '\\'));
        assertEquals(List.of("a", ""), OptionEscaping.split("a:", ':', '\\'));
    }

    @Test
    void splitHonoursEscapedSeparator() {
        assertEquals(List.of("a:b", "c"), OptionEscaping.split("a\\:b:c", ':', '\\'));
    }

    @Test
    void splitTreatsEscapedEscapeAsLiteralBackslash() {
        // a\\:b  ->  "a\" then "b"
        assertEquals(List.of("a\\", "b"), OptionEscaping.split("a\\\\:b", ':', '\\'));
    }

    @Test
    void splitKeepsUnrelatedAndDanglingEscapes() {
        assertEquals(List.of("a\\nb"), OptionEscaping.split("a\\nb", ':', '\\'));
        assertEquals(List.of("ab\\"), OptionEscaping.split("ab\\", ':', '\\'));
    }

    @Test
    void escapeThenSplitIsSingleSegmentRoundTrip() {
        List<String> samples = List.of(
                "", ":", "\\", "\\:", ":\\", "a:b:c", "a\\b", "\\\\", "::", "trailing\\",
                "x\\:y\\\\:z", "plain");

        for (String sample : samples) {
            String escaped = OptionEscaping.escape(sample, ':', '\\');
            assertEquals(List.of(sample), OptionEscaping.split(escaped, ':', '\\'),
                    "round trip of '" + sample + "'");
        }
    }

    @Test
    void plainSplitRecognizesNoEscapes() {
        assertEquals(List.of("1", "2"), OptionEscaping.split("1,2", ','));
        assertEquals(List.of("a\\", "b"), OptionEscaping.split("a\\,b", ','));
        assertEquals(List.of(""), OptionEscaping.split("", ','));
    }

    // ---------------------------------------------------------------------
    // Locate / unescape
    // ---------------------------------------------------------------------

    @Test
    void indexOfUnescapedSkipsEscapedSeparators() {
        assertEquals(4, OptionEscaping.indexOfUnescaped("a\\:b:c", ':', '\\'));
        assertEquals(3, OptionEscaping.indexOfUnescaped("a\\\\:b", ':', '\\'));
        assertEquals(-1, OptionEscaping.indexOfUnescaped("a\\:b", ':', '\\'));
        assertEquals(-1, OptionEscaping.indexOfUnescaped("", ':', '\\'));
    }

    @Test
    void unescapeInvertsEscape() {
        String text = "a:b\\c:";
        assertEquals(text, OptionEscaping.unescape(OptionEscaping.escape(text, ':', '\\'), ':', '\\'));
        assertEquals("plain", OptionEscaping.unescape("plain", ':', '\\'));
    }
}
