package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;
import com.questrail.meshgate.directory.MeshNodeRecord;
import com.questrail.meshgate.directory.Position;

import java.util.Locale;
import java.util.Optional;

/**
 * {@code LOCATION}: last GPS fix of the gateway's own radio.
 */
public final class LocationCommand implements BridgeCommand
{
    @Override
    public String name()
    {
        return "LOCATION";
    }

    @Override
    public String help()
    {
        return "LOCATION - Shows the gateway node's GPS location (if available)";
    }

    @Override
    public void execute(BridgeContext context, CommandInvocation invocation)
    {
        context.reply("--- Gateway Location ---");
        Optional<MeshNodeRecord> local = context.directory().localNode();
        if (local.isEmpty()) {
            context.reply("Error: Could not retrieve gateway node info.");
        }
        else if (local.get().position() == null) {
            context.reply("Location data not available or incomplete for the gateway node.");
            context.reply("(Node needs a GPS fix and position sharing enabled).");
        }
        else {
            Position position = local.get().position();
            context.reply(String.format(Locale.ROOT, "Latitude: %.5f, Longitude: %.5f",
                    position.latitude(), position.longitude()));
            if (position.altitude() != null) {
                context.reply("Altitude: " + position.altitude() + " m");
            }
            if (position.time() != null) {
                context.reply("Position Time: " + Formats.timestampWithZone(position.time(), context.zone()));
            }
            context.reply("Map Link (approx): https://www.google.com/maps?q="
                    + position.latitude() + "," + position.longitude());
        }
        context.reply("--- End of Location ---");
    }
}
