package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;
import com.questrail.meshgate.directory.MeshNodeRecord;

import java.util.Optional;

/**
 * {@code STATS}: directory size, gateway identity, uptime and load.
 */
public final class StatsCommand implements BridgeCommand
{
    @Override
    public String name()
    {
        return "STATS";
    }

    @Override
    public String help()
    {
        return "STATS - Shows basic mesh and gateway statistics";
    }

    @Override
    public void execute(BridgeContext context, CommandInvocation invocation)
    {
        context.reply("--- Gateway & Mesh Statistics ---");
        context.reply("Known Nodes: " + context.directory().size());

        Optional<MeshNodeRecord> local = context.directory().localNode();
        if (local.isPresent()) {
            context.reply("Gateway Node ID: " + local.get().nodeId() + " (Num: " + local.get().nodeNumber() + ")");
        }
        else {
            context.reply("Gateway Node Info: N/A (Interface not fully initialized?)");
        }

        context.reply("Gateway Uptime: " + Formats.uptime(context.uptime()));
        context.reply("Connected IRC Clients: " + context.activeSessionCount());
        context.reply("Pending Mesh Requests: " + context.correlator().pendingCount());
        context.reply("--- End of Stats ---");
    }
}
