package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.ArgumentTokenizer;
import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;
import com.questrail.meshgate.correlation.PendingRequest;
import com.questrail.meshgate.directory.MeshNodeRecord;
import com.questrail.meshgate.mesh.MeshOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * {@code DM <node> <message>}: acknowledged direct message to one node.
 *
 * <p>The node reference is the first (possibly quoted) word; everything after
 * it is sent exactly as typed. The ACK, NAK or timeout is reported to the
 * requester later.</p>
 */
public final class DirectMessageCommand implements BridgeCommand
{
    private static final Logger log = LoggerFactory.getLogger(DirectMessageCommand.class);

    static final int MAX_LENGTH = 240;

    @Override
    public String name()
    {
        return "DM";
    }

    @Override
    public String help()
    {
        return "DM <node_id|shortname|nodenum> <message> - Sends direct message to a node";
    }

    @Override
    public void execute(BridgeContext context, CommandInvocation invocation)
    {
        String[] parts = ArgumentTokenizer.splitFirst(invocation.rawArguments());
        String reference = parts[0];
        String text = parts[1].strip();
        if (reference.isEmpty() || text.isEmpty()) {
            context.reply(Formats.usage(help()));
            return;
        }
        if (text.length() > MAX_LENGTH) {
            context.reply("Error: Message too long (" + text.length() + " chars). Maximum is "
                    + MAX_LENGTH + " characters.");
            return;
        }

        Optional<MeshNodeRecord> target = context.resolveNode(reference);
        if (target.isEmpty()) {
            context.reply("Error: Could not find node matching '" + reference + "'. Use NODES command.");
            return;
        }

        MeshNodeRecord node = target.get();
        context.reply("Sending DM '" + text + "' to " + node.displayName() + " (" + node.nodeId() + ")...");
        try {
            PendingRequest request = context.sendDirect(node, text);
            log.debug("DM request {} to {} registered for {}", request.requestId(), node.nodeId(), context.requester());
            context.reply("DM request sent to " + node.displayName() + ". Waiting for ACK/NAK...");
        }
        catch (MeshOperationException e) {
            log.error("Mesh error sending DM to {} for {}: {}", node.nodeId(), context.requester(), e.getMessage());
            context.reply("Meshtastic Error sending DM: " + e.getMessage());
        }
    }
}
