package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.BridgeCommand;
import com.questrail.meshgate.command.BridgeContext;
import com.questrail.meshgate.command.CommandInvocation;
import com.questrail.meshgate.lookup.LookupResult;
import com.questrail.meshgate.lookup.WeatherLookup;

/**
 * {@code WEATHER}: current conditions for the configured location.
 */
public final class WeatherCommand implements BridgeCommand
{
    @Override
    public String name()
    {
        return "WEATHER";
    }

    @Override
    public String help()
    {
        return "WEATHER - Shows current weather conditions (OpenWeatherMap)";
    }

    @Override
    public void execute(BridgeContext context, CommandInvocation invocation)
    {
        WeatherLookup weather = context.weather();
        if (!weather.isConfigured()) {
            context.reply("Weather command is not configured (API key or location missing).");
            return;
        }

        context.reply("Fetching weather for " + weather.location() + "...");
        LookupResult result = weather.currentConditions();
        if (result instanceof LookupResult.Available available) {
            context.replyAll(available.lines());
        }
        else if (result instanceof LookupResult.Unavailable unavailable) {
            context.reply("Error: " + unavailable.reason());
        }
    }
}
