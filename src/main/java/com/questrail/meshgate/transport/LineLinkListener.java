package com.questrail.meshgate.transport;

/**
 * Callback sink for {@link LineLink}. Callbacks are serialized.
 */
public interface LineLinkListener
{
    void onLinkUp();

    /**
     * @param cause diagnostic cause; {@code null} for an orderly close
     */
    void onLinkDown(Throwable cause);

    void onLine(String line);
}
