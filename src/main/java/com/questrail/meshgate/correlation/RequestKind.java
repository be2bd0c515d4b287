package com.questrail.meshgate.correlation;

/**
 * Kind of correlated mesh request.
 */
public enum RequestKind
{
    DIRECT_MESSAGE("DM", "no acknowledgement"),
    PING("PING", "no reply");

    private final String label;
    private final String silence;

    RequestKind(String label, String silence)
    {
        this.label = label;
        this.silence = silence;
    }

    /** Short label used in chat lines. */
    public String label()
    {
        return label;
    }

    /** What "nothing came back" means for this kind, e.g. {@code no reply}. */
    String silence()
    {
        return silence;
    }
}
