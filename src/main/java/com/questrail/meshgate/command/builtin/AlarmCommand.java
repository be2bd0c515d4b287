package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;
import com.questrail.meshgate.mesh.MeshOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code ALARM <message>}: a {@code SEND} whose text carries the alarm marker,
 * so receivers can pick it out on the channel.
 */
public final class AlarmCommand implements BridgeCommand
{
    private static final Logger log = LoggerFactory.getLogger(AlarmCommand.class);

    static final String MARKER = "ALARM: ";
    static final int MAX_LENGTH = 230;

    @Override
    public String name()
    {
        return "ALARM";
    }

    @Override
    public String help()
    {
        return "ALARM <message> - Broadcasts an ALARM message to the default mesh channel";
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
            context.reply("Error: Alarm message too long (" + text.length() + " chars). Maximum is "
                    + MAX_LENGTH + " characters.");
            return;
        }

        int channel = context.defaultChannel();
        context.reply("Broadcasting Alarm to mesh channel " + channel + ": '" + text + "'...");
        try {
            context.sendBroadcast(MARKER + text);
            context.reply("Alarm message sent to mesh channel " + channel + ".");
        }
        catch (MeshOperationException e) {
            log.error("Mesh error sending ALARM for {}: {}", context.requester(), e.getMessage());
            context.reply("Meshtastic Error sending ALARM: " + e.getMessage());
        }
    }
}
