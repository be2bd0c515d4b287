package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;
import com.questrail.meshgate.mesh.MeshOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code SEND <message>}: broadcasts text on the default mesh channel.
 * Broadcasts are not acknowledged, so nothing is correlated.
 */
public final class SendCommand implements BridgeCommand
{
    private static final Logger log = LoggerFactory.getLogger(SendCommand.class);

    static final int MAX_LENGTH = 240;

    @Override
    public String name()
    {
        return "SEND";
    }

    @Override
    public String help()
    {
        return "SEND <message> - Sends message to default mesh channel";
    }

    @Override
    public void execute(BridgeContext context, CommandInvocation invocation)
    {
        if (!invocation.hasArguments()) {
            context.reply(Formats.usage(help()));
            return;
        }
        String text = invocation.rawArguments().strip();
        if (text.length() > MAX_LENGTH) {
            context.reply("Error: Message too long (" + text.length() + " chars). Maximum is "
                    + MAX_LENGTH + " characters.");
            return;
        }

        int channel = context.defaultChannel();
        context.reply("Sending '" + text + "' to mesh channel " + channel + "...");
        try {
            context.sendBroadcast(text);
            context.reply("Message sent to mesh channel " + channel + ".");
        }
        catch (MeshOperationException e) {
            log.error("Mesh error sending message for {}: {}", context.requester(), e.getMessage());
            context.reply("Meshtastic Error sending message: " + e.getMessage());
        }
    }
}
