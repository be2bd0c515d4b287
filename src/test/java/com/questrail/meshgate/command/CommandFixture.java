package com.questrail.meshgate.command;

import com.questrail.meshgate.correlation.CorrelationPolicy;
import com.questrail.meshgate.correlation.RequestCorrelator;
import com.questrail.meshgate.directory.NodeDirectory;
import com.questrail.meshgate.directory.NodeResolver;
import com.questrail.meshgate.irc.RecordingChatOutput;
import com.questrail.meshgate.lookup.HfConditionsLookup;
import com.questrail.meshgate.lookup.LookupResult;
import com.questrail.meshgate.lookup.WeatherLookup;
import com.questrail.meshgate.mesh.RecordingMeshInterface;
import com.questrail.meshgate.observability.RecordingObservabilitySink;
import com.questrail.meshgate.time.ManualMonotonicClock;
import com.questrail.meshgate.time.ManualWallClock;

import java.time.ZoneOffset;
import java.util.List;

/**
 * CommandFixture
 * -----------------------------------------------------------------------------
 * Wires the discovered command set to recording doubles so command tests can
 * dispatch a line and inspect what the requester was told.
 */
public final class CommandFixture {

    public static final String REQUESTER = "alice";

    public final ManualMonotonicClock clock = new ManualMonotonicClock();
    public final ManualWallClock wallClock = new ManualWallClock();
    public final NodeDirectory directory = new NodeDirectory();
    public final RecordingMeshInterface mesh = new RecordingMeshInterface();
    public final RecordingChatOutput chat = new RecordingChatOutput();
    public final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    public final RequestCorrelator correlator =
            new RequestCorrelator(clock, wallClock, CorrelationPolicy.defaults(), sink);
    public final StubWeather weather = new StubWeather();
    public final StubHfConditions hfConditions = new StubHfConditions();
    public final CommandRegistry registry;
    public final CommandDispatcher dispatcher;

    public CommandFixture() {
        this(CommandRegistry.discover());
    }

    public CommandFixture(CommandRegistry registry) {
        this.registry = registry;
        BridgeServices services = new BridgeServices(
                directory, new NodeResolver(directory), correlator, mesh, chat, registry,
                weather, hfConditions, clock, wallClock, 0L, 0, ZoneOffset.UTC);
        this.dispatcher = new CommandDispatcher(services, sink);
    }

    /**
     * Dispatches {@code line} as typed by {@link #REQUESTER} and returns the
     * notices sent back to them by this call.
     */
    public List<String> run(String line) {
        chat.clear();
        String trimmed = line.strip();
        int split = trimmed.indexOf(' ');
        String verb = split < 0 ? trimmed : trimmed.substring(0, split);
        String rest = split < 0 ? "" : trimmed.substring(split + 1).stripLeading();
        dispatcher.dispatch(REQUESTER, verb, rest);
        return chat.noticesTo(REQUESTER);
    }

    public static final class StubWeather implements WeatherLookup {
        public boolean configured = true;
        public LookupResult result = new LookupResult.Available(List.of("sunny"));
        public int calls;

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public String location() {
            return "Port Colborne";
        }

        @Override
        public LookupResult currentConditions() {
            calls++;
            return result;
        }
    }

    public static final class StubHfConditions implements HfConditionsLookup {
        public LookupResult result = new LookupResult.Available(List.of("quiet sun"));

        @Override
        public LookupResult currentConditions() {
            return result;
        }
    }
}
