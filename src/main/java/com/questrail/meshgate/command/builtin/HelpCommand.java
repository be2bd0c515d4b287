package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code HELP [command]}: the command list, or one command's usage.
 */
public final class HelpCommand implements BridgeCommand
{
    /** Longest list line sent; longer lists wrap. */
    static final int MAX_LINE_LENGTH = 400;

    @Override
    public String name()
    {
        return "HELP";
    }

    @Override
    public String help()
    {
        return "HELP [command] - Shows available commands or help for a specific command";
    }

    @Override
    public void execute(BridgeContext context, CommandInvocation invocation)
    {
        List<String> args = invocation.tokens();
        if (args.isEmpty()) {
            context.reply("*** Available Commands (Type HELP <command> for details):");
            context.replyAll(wrap(context.registry().names()));
            return;
        }

        String requested = args.get(0);
        Optional<BridgeCommand> command = context.registry().find(requested);
        if (command.isPresent()) {
            context.reply("Help for " + command.get().name() + ": " + command.get().help());
        }
        else {
            context.reply("Unknown command: '" + requested + "'. Type HELP for a list.");
        }
    }

    static List<String> wrap(List<String> names)
    {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String name : names) {
            if (line.length() == 0) {
                line.append(name);
            }
            else if (line.length() + name.length() + 2 < MAX_LINE_LENGTH) {
                line.append(", ").append(name);
            }
            else {
                lines.add(line.toString());
                line.setLength(0);
                line.append(name);
            }
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }
}
