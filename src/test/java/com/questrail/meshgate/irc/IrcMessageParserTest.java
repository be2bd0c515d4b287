package com.questrail.meshgate.irc;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IrcMessageParserTest
 * -----------------------------------------------------------------------------
 * Line grammar: prefix, verb, middle params and trailing param.
 */
class IrcMessageParserTest {

    @Test
    void parsesVerbWithMiddleAndTrailingParams() {
        IrcMessage msg = IrcMessageParser.parse("USER alice 0 * :Alice Example").orElseThrow();

        assertNull(msg.prefix());
        assertEquals("USER", msg.command());
        assertEquals(List.of("alice", "0", "*", "Alice Example"), msg.params());
        assertEquals("Alice Example", msg.param(3));
        assertNull(msg.param(4));
    }

    @Test
    void verbIsUpperCasedAndLineEndingStripped() {
        IrcMessage msg = IrcMessageParser.parse("privmsg #mesh :hello there\r\n").orElseThrow();

        assertEquals("PRIVMSG", msg.command());
        assertEquals(List.of("#mesh", "hello there"), msg.params());
    }

    @Test
    void prefixAndTagsAreRecognized() {
        IrcMessage msg = IrcMessageParser.parse("@time=now :bob!b@host NICK :bobby").orElseThrow();

        assertEquals("bob!b@host", msg.prefix());
        assertEquals("NICK", msg.command());
        assertEquals("bobby", msg.param(0));
    }

    @Test
    void trailingParamKeepsLeadingColonsAndSpaces() {
        IrcMessage msg = IrcMessageParser.parse("PRIVMSG #mesh ::)  spaced").orElseThrow();

        assertEquals(":)  spaced", msg.param(1));
    }

    @Test
    void emptyTrailingParamIsPresent() {
        IrcMessage msg = IrcMessageParser.parse("PRIVMSG #mesh :").orElseThrow();

        assertEquals(2, msg.paramCount());
        assertEquals("", msg.param(1));
    }

    @Test
    void numericVerbsAreAccepted() {
        assertEquals("001", IrcMessageParser.parse(":srv 001 alice :Welcome").orElseThrow().command());
    }

    @Test
    void malformedLinesAreRejected() {
        assertEquals(Optional.empty(), IrcMessageParser.parse(null));
        assertEquals(Optional.empty(), IrcMessageParser.parse(""));
        assertEquals(Optional.empty(), IrcMessageParser.parse("   "));
        assertEquals(Optional.empty(), IrcMessageParser.parse(":prefixonly"));
        assertEquals(Optional.empty(), IrcMessageParser.parse("N1CK alice"));
        assertEquals(Optional.empty(), IrcMessageParser.parse("12 foo"));
    }

    @Test
    void paramsBeyondTheLimitFoldIntoTheLast() {
        StringBuilder line = new StringBuilder("MODE");
        for (int i = 1; i <= 17; i++) {
            line.append(' ').append('p').append(i);
        }

        IrcMessage msg = IrcMessageParser.parse(line.toString()).orElseThrow();

        assertEquals(IrcMessageParser.MAX_PARAMS, msg.paramCount());
        assertEquals("p15 p16 p17", msg.param(14));
    }
}
