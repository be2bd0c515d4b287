package com.questrail.meshgate.directory;

import java.time.Instant;

/**
 * Last reported GPS fix of a node.
 *
 * @param latitude  degrees, WGS84
 * @param longitude degrees, WGS84
 * @param altitude  metres above sea level, or {@code null} when not reported
 * @param time      time of the fix, or {@code null} when not reported
 */
public record Position(double latitude, double longitude, Integer altitude, Instant time)
{
    public Position
    {
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
    }
}
