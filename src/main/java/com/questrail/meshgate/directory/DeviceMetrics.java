package com.questrail.meshgate.directory;

/**
 * Telemetry a node reports about itself. Every field is optional.
 */
public record DeviceMetrics(
        Integer batteryLevel,
        Double voltage,
        Double channelUtilization,
        Double airUtilTx,
        Long uptimeSeconds)
{
}
