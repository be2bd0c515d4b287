package com.questrail.meshgate.directory;

import java.time.Instant;

/**
 * A partial set of node attributes to merge into the directory.
 *
 * <p>{@code null} means "not supplied". A non-null {@code heardAt} marks the
 * update as coming from a "heard" event and refreshes the record's last-heard
 * time.</p>
 */
public record NodeUpdate(
        String nodeId,
        String shortName,
        String longName,
        Instant heardAt,
        Double snr,
        Integer rssi,
        Position position,
        DeviceMetrics deviceMetrics)
{
    public static NodeUpdate heard(Instant at)
    {
        return builder().heardAt(at).build();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private String nodeId;
        private String shortName;
        private String longName;
        private Instant heardAt;
        private Double snr;
        private Integer rssi;
        private Position position;
        private DeviceMetrics deviceMetrics;

        private Builder() {}

        public Builder nodeId(String nodeId)
        {
            this.nodeId = nodeId;
            return this;
        }

        public Builder shortName(String shortName)
        {
            this.shortName = shortName;
            return this;
        }

        public Builder longName(String longName)
        {
            this.longName = longName;
            return this;
        }

        public Builder heardAt(Instant heardAt)
        {
            this.heardAt = heardAt;
            return this;
        }

        public Builder snr(Double snr)
        {
            this.snr = snr;
            return this;
        }

        public Builder rssi(Integer rssi)
        {
            this.rssi = rssi;
            return this;
        }

        public Builder position(Position position)
        {
            this.position = position;
            return this;
        }

        public Builder deviceMetrics(DeviceMetrics deviceMetrics)
        {
            this.deviceMetrics = deviceMetrics;
            return this;
        }

        public NodeUpdate build()
        {
            return new NodeUpdate(nodeId, shortName, longName, heardAt, snr, rssi, position, deviceMetrics);
        }
    }
}
