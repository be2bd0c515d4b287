package com.questrail.meshgate.lookup;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of an external data lookup: display-ready lines, or the reason the
 * service could not answer.
 */
public sealed interface LookupResult permits LookupResult.Available, LookupResult.Unavailable
{
    record Available(List<String> lines) implements LookupResult
    {
        public Available
        {
            lines = List.copyOf(lines);
        }
    }

    record Unavailable(String reason) implements LookupResult
    {
        public Unavailable
        {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
