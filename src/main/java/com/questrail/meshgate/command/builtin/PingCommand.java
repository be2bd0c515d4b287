package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;
import com.questrail.meshgate.directory.MeshNodeRecord;
import com.questrail.meshgate.mesh.MeshOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * {@code PING <node>}: mesh-level ping; the pong (or timeout) is reported to the
 * requester with the reply's signal quality.
 */
public final class PingCommand implements BridgeCommand
{
    private static final Logger log = LoggerFactory.getLogger(PingCommand.class);

    @Override
    public String name()
    {
        return "PING";
    }

    @Override
    public String help()
    {
        return "PING <node_id|shortname|nodenum> - Sends a Meshtastic ping request to a node";
    }

    @Override
    public void execute(BridgeContext context, CommandInvocation invocation)
    {
        List<String> args = invocation.tokens();
        if (args.isEmpty()) {
            context.reply(Formats.usage(help()));
            return;
        }

        String reference = args.get(0);
        Optional<MeshNodeRecord> target = context.resolveNode(reference);
        if (target.isEmpty()) {
            context.reply("Error: Could not find node matching '" + reference + "'.");
            return;
        }

        MeshNodeRecord node = target.get();
        context.reply("Sending Meshtastic Ping to " + node.displayName() + " (" + node.nodeId() + ")...");
        try {
            context.ping(node);
            context.reply("Ping request sent to " + node.displayName() + ". Waiting for reply (PONG)...");
        }
        catch (MeshOperationException e) {
            log.error("Mesh error sending PING to {} for {}: {}", node.nodeId(), context.requester(), e.getMessage());
            context.reply("Meshtastic Error sending PING: " + e.getMessage());
        }
    }
}
