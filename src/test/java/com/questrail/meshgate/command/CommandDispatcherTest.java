package com.questrail.meshgate.command;

import com.questrail.meshgate.observability.BridgeErrorEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandDispatcherTest
 * -----------------------------------------------------------------------------
 * Lookup, argument errors and failure containment.
 */
class CommandDispatcherTest {

    @Test
    void unknownVerbIsNotHandled() {
        CommandFixture fixture = new CommandFixture();

        assertFalse(fixture.dispatcher.handles("HELLO"));
        assertFalse(fixture.dispatcher.dispatch("alice", "HELLO", "world"));
        assertTrue(fixture.chat.notices().isEmpty());
    }

    @Test
    void verbMatchesCaseInsensitively() {
        CommandFixture fixture = new CommandFixture();

        assertTrue(fixture.dispatcher.handles("time"));
        List<String> replies = fixture.run("time");

        assertEquals(1, replies.size());
        assertTrue(replies.get(0).startsWith("Server time: "));
    }

    @Test
    void unbalancedQuoteIsReportedToTheRequester() {
        CommandFixture fixture = new CommandFixture();

        List<String> replies = fixture.run("INFO \"Mock Node");

        assertEquals(List.of("Error parsing arguments: No closing quotation"), replies);
    }

    @Test
    void failingCommandIsContainedAndReported() {
        CommandRegistry registry = CommandRegistry.builder().register(new BridgeCommand() {
            @Override
            public String name() {
                return "BOOM";
            }

            @Override
            public String help() {
                return "BOOM - always fails";
            }

            @Override
            public void execute(BridgeContext context, CommandInvocation invocation) {
                throw new IllegalStateException("kaboom");
            }
        }).build();
        CommandFixture fixture = new CommandFixture(registry);

        List<String> replies = fixture.run("boom now");

        assertEquals(List.of("Error executing command BOOM: kaboom"), replies);
        assertTrue(fixture.sink.hasEventOfType(BridgeErrorEvent.class));
    }

    @Test
    void repliesGoOnlyToTheRequester() {
        CommandFixture fixture = new CommandFixture();

        fixture.dispatcher.dispatch("bob", "TIME", "");

        assertEquals(1, fixture.chat.noticesTo("bob").size());
        assertTrue(fixture.chat.noticesTo("alice").isEmpty());
        assertTrue(fixture.chat.roomLines().isEmpty());
    }

    @Test
    void announcementsReachTheWholeRoom() {
        CommandRegistry registry = CommandRegistry.builder().register(new BridgeCommand() {
            @Override
            public String name() {
                return "SHOUT";
            }

            @Override
            public String help() {
                return "SHOUT <text> - posts text to the control room";
            }

            @Override
            public void execute(BridgeContext context, CommandInvocation invocation) {
                context.announce(context.requester() + " says: " + invocation.rawArguments());
                context.reply("Announced.");
            }
        }).build();
        CommandFixture fixture = new CommandFixture(registry);

        List<String> replies = fixture.run("shout tower is up");

        assertEquals(List.of("alice says: tower is up"), fixture.chat.roomLines());
        assertEquals(List.of("Announced."), replies);
    }
}
