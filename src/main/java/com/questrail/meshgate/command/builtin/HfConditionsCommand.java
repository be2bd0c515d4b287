package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;
import com.questrail.meshgate.lookup.LookupResult;

/**
 * {@code HFCONDITIONS}: solar flux, Kp and NOAA scale forecasts.
 */
public final class HfConditionsCommand implements BridgeCommand
{
    @Override
    public String name()
    {
        return "HFCONDITIONS";
    }

    @Override
    public String help()
    {
        return "HFCONDITIONS - Shows current Solar/HF propagation indicators (NOAA SWPC)";
    }

    @Override
    public void execute(BridgeContext context, CommandInvocation invocation)
    {
        context.reply("Fetching HF conditions from NOAA SWPC...");
        LookupResult result = context.hfConditions().currentConditions();
        if (result instanceof LookupResult.Available available) {
            context.replyAll(available.lines());
        }
        else if (result instanceof LookupResult.Unavailable unavailable) {
            context.reply("Error: " + unavailable.reason());
        }
    }
}
