package com.questrail.meshgate.lookup;

/**
 * Solar and HF radio propagation indicators.
 */
public interface HfConditionsLookup
{
    /**
     * Fetches the latest indicators. Never throws for service failures; they
     * come back as {@link LookupResult.Unavailable}.
     */
    LookupResult currentConditions();
}
