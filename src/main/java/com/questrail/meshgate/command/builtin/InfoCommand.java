package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;
import com.questrail.meshgate.directory.DeviceMetrics;
import com.questrail.meshgate.directory.MeshNodeRecord;
import com.questrail.meshgate.directory.Position;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@code INFO <node>}: every cached attribute of one node.
 */
public final class InfoCommand implements BridgeCommand
{
    @Override
    public String name()
    {
        return "INFO";
    }

    @Override
    public String help()
    {
        return "INFO <node_id|shortname|nodenum> - Shows detailed info for a node";
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
        Optional<MeshNodeRecord> found = context.resolveNode(reference);
        if (found.isEmpty()) {
            context.reply("Error: Could not find node matching '" + reference + "'.");
            return;
        }

        MeshNodeRecord node = found.get();
        context.reply("--- Info for Node " + node.displayName() + " (" + node.nodeId() + ") ---");
        context.reply("  num: " + node.nodeNumber());
        context.reply("  user.id: " + node.nodeId());
        context.reply("  user.longName: " + Formats.orNotAvailable(node.longName()));
        context.reply("  user.shortName: " + Formats.orNotAvailable(node.shortName()));
        context.reply("  lastHeard: " + (node.lastHeard() == null
                ? "Never"
                : Formats.timestamp(node.lastHeard(), context.zone())));
        context.reply("  snr: " + Formats.oneDecimal(node.snr()));
        context.reply("  rssi: " + Formats.orNotAvailable(node.rssi()));

        Position position = node.position();
        if (position != null) {
            String time = position.time() == null
                    ? Formats.NOT_AVAILABLE
                    : Formats.timestamp(position.time(), context.zone());
            context.reply(String.format(Locale.ROOT, "    position: Lat %.5f, Lon %.5f, Alt %sm (Time: %s)",
                    position.latitude(), position.longitude(), Formats.orNotAvailable(position.altitude()), time));
        }

        DeviceMetrics metrics = node.deviceMetrics();
        if (metrics != null) {
            context.reply("    metrics: Batt " + Formats.orNotAvailable(metrics.batteryLevel()) + "%"
                    + ", Volt " + twoDecimals(metrics.voltage()) + "V"
                    + ", ChUtil " + Formats.oneDecimal(metrics.channelUtilization()) + "%"
                    + ", AirUtil " + Formats.oneDecimal(metrics.airUtilTx()) + "%"
                    + ", Uptime " + Formats.orNotAvailable(metrics.uptimeSeconds()) + "s");
        }
        context.reply("--- End of Info ---");
    }

    private static String twoDecimals(Double value)
    {
        return value == null ? Formats.NOT_AVAILABLE : String.format(Locale.ROOT, "%.2f", value);
    }
}
