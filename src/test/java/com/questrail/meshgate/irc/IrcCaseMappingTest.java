package com.questrail.meshgate.irc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IrcCaseMappingTest
 * -----------------------------------------------------------------------------
 * RFC 1459 folding of letters and the bracket characters.
 */
class IrcCaseMappingTest {

    @Test
    void foldsAsciiLetters() {
        assertEquals("alice", IrcCaseMapping.toLower("ALiCe"));
        assertTrue(IrcCaseMapping.equalsIgnoreCase("#Mesh", "#mesh"));
    }

    @Test
    void bracketsFoldToBraces() {
        assertEquals("op{1}|^", IrcCaseMapping.toLower("Op[1]\\~"));
        assertTrue(IrcCaseMapping.equalsIgnoreCase("Op[1]", "op{1}"));
    }

    @Test
    void differentLengthsOrNullsAreNotEqual() {
        assertFalse(IrcCaseMapping.equalsIgnoreCase("abc", "abcd"));
        assertFalse(IrcCaseMapping.equalsIgnoreCase("abc", null));
        assertTrue(IrcCaseMapping.equalsIgnoreCase(null, null));
    }
}
