package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;
import com.questrail.meshgate.directory.MeshNodeRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@code NODES}: lists the node directory, most recently heard first.
 */
public final class NodesCommand implements BridgeCommand
{
    static final Comparator<MeshNodeRecord> MOST_RECENT_FIRST = Comparator
            .comparing(MeshNodeRecord::lastHeard, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparingLong(MeshNodeRecord::nodeNumber);

    @Override
    public String name()
    {
        return "NODES";
    }

    @Override
    public String help()
    {
        return "NODES - Lists known nodes on the mesh";
    }

    @Override
    public void execute(BridgeContext context, CommandInvocation invocation)
    {
        context.reply("--- Meshtastic Nodes ---");
        List<MeshNodeRecord> nodes = new ArrayList<>(context.directory().all());
        if (nodes.isEmpty()) {
            context.reply("No nodes currently known to the gateway.");
        }
        else {
            nodes.sort(MOST_RECENT_FIRST);
            for (MeshNodeRecord node : nodes) {
                context.reply(line(node, context));
            }
            context.reply("Total: " + nodes.size() + (nodes.size() == 1 ? " node" : " nodes"));
        }
        context.reply("--- End of Node List ---");
    }

    private static String line(MeshNodeRecord node, BridgeContext context)
    {
        String lastHeard = node.lastHeard() == null
                ? "Never"
                : Formats.timestamp(node.lastHeard(), context.zone());
        return "Num: " + node.nodeNumber()
                + " | ID: " + node.nodeId()
                + " | Name: " + Formats.orNotAvailable(node.longName())
                + " (" + Formats.orNotAvailable(node.shortName()) + ")"
                + " | SNR: " + Formats.oneDecimal(node.snr())
                + " | LastHeard: " + lastHeard;
    }
}
