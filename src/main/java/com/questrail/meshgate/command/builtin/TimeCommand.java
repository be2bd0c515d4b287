package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;

public final class TimeCommand implements BridgeCommand
{
    @Override
    public String name()
    {
        return "TIME";
    }

    @Override
    public String help()
    {
        return "TIME - Shows the current server date and time";
    }

    @Override
    public void execute(BridgeContext context, CommandInvocation invocation)
    {
        context.reply("Server time: " + Formats.timestampWithZone(context.wallClock().now(), context.zone()));
    }
}
