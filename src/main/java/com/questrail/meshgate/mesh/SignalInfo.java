package com.questrail.meshgate.mesh;

/**
 * Receive-side link quality of one packet. Either value may be {@code null}
 * when the radio did not report it.
 *
 * @param snr  signal-to-noise ratio in dB
 * @param rssi received signal strength in dBm
 */
public record SignalInfo(Double snr, Integer rssi)
{
    public static final SignalInfo UNKNOWN = new SignalInfo(null, null);

    public String snrText()
    {
        return snr == null ? "N/A" : String.valueOf(snr);
    }

    public String rssiText()
    {
        return rssi == null ? "N/A" : String.valueOf(rssi);
    }
}
