package com.questrail.meshgate.irc;

import com.questrail.meshgate.internal.time.MonotonicClock;
import com.questrail.meshgate.internal.time.MonotonicScheduler;
import com.questrail.meshgate.internal.time.WallClock;
import com.questrail.meshgate.observability.BridgeObservabilitySink;
import com.questrail.meshgate.observability.SessionTransitionEvent;
import com.questrail.meshgate.transport.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ChatServer
 * =============================================================================
 * Line-protocol state machine for the gateway's chat side: registration,
 * nickname ownership, the single control room, and delivery of
 * server-originated lines.
 *
 * <h2>Architectural Role</h2>
 * The server sees connections only through {@link ClientConnection} and never
 * touches sockets. It knows nothing about the mesh: room lines that start with
 * a command verb go to the attached {@link RoomCommandHandler}, everything else
 * is chat.
 *
 * <h2>Concurrency</h2>
 * Connection threads, the mesh event relay, and the expiry sweeper all call in.
 * Session table, nickname table and room membership are guarded by one lock.
 * Outbound writes are non-blocking and happen under the lock so every client
 * sees room traffic in the same order. The command handler is always invoked
 * after the lock is released.
 *
 * <h2>Failure Semantics</h2>
 * Malformed lines are dropped silently. Protocol misuse is answered with the
 * standard numeric and never closes the connection.
 */
public final class ChatServer implements ChatOutput
{
    private static final Logger log = LoggerFactory.getLogger(ChatServer.class);

    static final int MAX_NICK_LENGTH = 30;

    private static final DateTimeFormatter CREATED_FORMAT =
            DateTimeFormatter.ofPattern("EEE MMM dd yyyy 'at' HH:mm:ss z", Locale.ROOT);

    private final ChatServerSettings settings;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final BridgeObservabilitySink sink;
    private final String createdText;

    private final Object lock = new Object();
    private final Map<String, ClientSession> sessions = new LinkedHashMap<>();
    private final Map<String, ClientSession> nicknames = new LinkedHashMap<>();
    private final Set<ClientSession> room = new LinkedHashSet<>();

    private volatile RoomCommandHandler commandHandler;

    public ChatServer(ChatServerSettings settings,
                      MonotonicClock clock,
                      MonotonicScheduler scheduler,
                      WallClock wallClock,
                      BridgeObservabilitySink sink)
    {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.createdText = CREATED_FORMAT.format(wallClock.now().atZone(ZoneId.systemDefault()));
    }

    /**
     * Attaches the handler for command verbs. Until one is attached every room
     * message is chat.
     */
    public void attachCommandHandler(RoomCommandHandler handler)
    {
        this.commandHandler = Objects.requireNonNull(handler, "handler");
    }

    public ChatServerSettings settings()
    {
        return settings;
    }

    // -------------------------------------------------------------------------
    // Connection lifecycle
    // -------------------------------------------------------------------------

    /**
     * Creates an unregistered session for a newly accepted connection and arms
     * its registration timer.
     */
    public ClientSession acceptConnection(ClientConnection connection)
    {
        Objects.requireNonNull(connection, "connection");
        ClientSession session = new ClientSession(connection);
        synchronized (lock) {
            sessions.put(connection.id(), session);
        }
        session.registrationTimer(scheduler.scheduleAfter(
                settings.registrationTimeout(), clock, () -> expireRegistration(session)));
        log.info("Client connected: {} from {}", connection.id(), connection.remoteHost());
        return session;
    }

    /**
     * Closes the session's connection, frees its nickname, and tells the
     * remaining room members it left. Calling it again is a no-op.
     */
    public void disconnect(ClientSession session, String reason)
    {
        Objects.requireNonNull(session, "session");
        String why = reason == null || reason.isBlank() ? "Client exited" : reason;

        synchronized (lock) {
            SessionState before = session.state();
            if (before == SessionState.DISCONNECTED) {
                return;
            }
            session.cancelRegistrationTimer();
            sessions.remove(session.id());
            String nick = session.nickname();
            if (nick != null) {
                nicknames.remove(IrcCaseMapping.toLower(nick), session);
            }
            if (room.remove(session)) {
                String quit = ":" + session.mask() + " QUIT :" + sanitize(why);
                for (ClientSession member : room) {
                    member.send(quit);
                }
            }
            session.state(SessionState.DISCONNECTED);
            transition(session, before, SessionState.DISCONNECTED);
        }
        session.connection().close();
        log.info("Client disconnected: {} ({})", session.id(), why);
    }

    /**
     * Disconnects every session, e.g. on shutdown.
     */
    public void disconnectAll(String reason)
    {
        List<ClientSession> all;
        synchronized (lock) {
            all = new ArrayList<>(sessions.values());
            for (ClientSession s : all) {
                s.send("ERROR :Closing link: " + sanitize(reason));
            }
        }
        for (ClientSession s : all) {
            disconnect(s, reason);
        }
    }

    // -------------------------------------------------------------------------
    // Inbound lines
    // -------------------------------------------------------------------------

    /**
     * Processes one line received on {@code session}'s connection.
     */
    public void handleLine(ClientSession session, String rawLine)
    {
        Objects.requireNonNull(session, "session");
        Optional<IrcMessage> parsed = IrcMessageParser.parse(rawLine);
        if (parsed.isEmpty()) {
            log.debug("Dropped malformed line from {}", session.id());
            return;
        }

        Runnable deferred;
        synchronized (lock) {
            if (session.state() == SessionState.DISCONNECTED) {
                return;
            }
            deferred = process(session, parsed.get());
        }
        if (deferred != null) {
            deferred.run();
        }
    }

    /**
     * Routes a room message: command verbs go to the command handler, anything
     * else is relayed to every other room member.
     */
    public void routeRoomMessage(ClientSession session, String text)
    {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(text, "text");

        String nickname;
        String verb;
        String rest;
        RoomCommandHandler handler = commandHandler;

        synchronized (lock) {
            if (session.state() != SessionState.REGISTERED_IN_ROOM) {
                session.send(IrcReplies.numeric(settings.serverName(), IrcReplies.ERR_NOTONCHANNEL,
                        session.replyTarget(), settings.roomName() + " :You're not on that channel"));
                return;
            }
            nickname = session.nickname();

            String trimmed = text.strip();
            int split = firstWhitespace(trimmed);
            verb = split < 0 ? trimmed : trimmed.substring(0, split);
            rest = split < 0 ? "" : trimmed.substring(split).stripLeading();

            if (verb.isEmpty() || handler == null || !handler.handles(verb)) {
                String line = ":" + session.mask() + " PRIVMSG " + settings.roomName() + " :" + text;
                for (ClientSession member : room) {
                    if (member != session) {
                        member.send(line);
                    }
                }
                return;
            }
        }

        log.info("Command from {}: {} {}", nickname, verb, rest);
        handler.handle(nickname, verb, rest);
    }

    // -------------------------------------------------------------------------
    // ChatOutput
    // -------------------------------------------------------------------------

    @Override
    public void sendToRoom(String text)
    {
        String server = settings.serverName();
        String line = ":" + server + "!" + server + "@" + server
                + " PRIVMSG " + settings.roomName() + " :" + sanitize(text);
        synchronized (lock) {
            for (ClientSession member : room) {
                member.send(line);
            }
        }
    }

    @Override
    public void sendToSession(String nickname, String text)
    {
        if (nickname == null) {
            return;
        }
        synchronized (lock) {
            ClientSession target = nicknames.get(IrcCaseMapping.toLower(nickname));
            if (target == null || target.state() != SessionState.REGISTERED_IN_ROOM) {
                log.debug("Dropping notice for {}: not in {}", nickname, settings.roomName());
                return;
            }
            target.send(":" + settings.serverName() + " NOTICE " + target.nickname() + " :" + sanitize(text));
        }
    }

    @Override
    public int activeSessionCount()
    {
        synchronized (lock) {
            return sessions.size();
        }
    }

    /** Nicknames of the current room members, in join order. */
    public List<String> roomMembers()
    {
        synchronized (lock) {
            List<String> names = new ArrayList<>(room.size());
            for (ClientSession member : room) {
                names.add(member.nickname());
            }
            return names;
        }
    }

    // -------------------------------------------------------------------------
    // Verb handling (lock held)
    // -------------------------------------------------------------------------

    private Runnable process(ClientSession session, IrcMessage msg)
    {
        String verb = msg.command();

        if (!session.state().isRegistered()) {
            switch (verb) {
                case "NICK":
                    onNick(session, msg);
                    return null;
                case "USER":
                    onUser(session, msg);
                    return null;
                case "PASS":
                case "CAP":
                case "PONG":
                    return null;
                case "PING":
                    onPing(session, msg);
                    return null;
                case "QUIT":
                    return onQuit(session, msg);
                default:
                    session.send(IrcReplies.numeric(settings.serverName(), IrcReplies.ERR_NOTREGISTERED,
                            "*", ":You have not registered"));
                    return null;
            }
        }

        switch (verb) {
            case "NICK":
                onNick(session, msg);
                return null;
            case "USER":
                session.send(numeric(session, IrcReplies.ERR_ALREADYREGISTRED, ":You may not reregister"));
                return null;
            case "JOIN":
                onJoin(session, msg);
                return null;
            case "PART":
                onPart(session, msg);
                return null;
            case "PRIVMSG":
                return onPrivmsg(session, msg);
            case "NOTICE":
            case "PONG":
            case "PASS":
            case "CAP":
                return null;
            case "NAMES":
                sendNames(session);
                return null;
            case "TOPIC":
                onTopic(session, msg);
                return null;
            case "WHO":
                onWho(session, msg);
                return null;
            case "MODE":
                onMode(session, msg);
                return null;
            case "PING":
                onPing(session, msg);
                return null;
            case "QUIT":
                return onQuit(session, msg);
            default:
                session.send(numeric(session, IrcReplies.ERR_UNKNOWNCOMMAND, verb + " :Unknown command"));
                return null;
        }
    }

    private void onNick(ClientSession session, IrcMessage msg)
    {
        String requested = msg.param(0);
        if (requested == null || requested.isEmpty()) {
            session.send(numeric(session, IrcReplies.ERR_NONICKNAMEGIVEN, ":No nickname given"));
            return;
        }
        if (!isValidNickname(requested)) {
            session.send(numeric(session, IrcReplies.ERR_ERRONEUSNICKNAME, requested + " :Erroneous nickname"));
            return;
        }

        String folded = IrcCaseMapping.toLower(requested);
        ClientSession holder = nicknames.get(folded);
        if (holder != null && holder != session) {
            String target = session.state().isRegistered() ? session.nickname() : "*";
            session.send(IrcReplies.numeric(settings.serverName(), IrcReplies.ERR_NICKNAMEINUSE,
                    target, requested + " :Nickname is already in use"));
            return;
        }

        String previous = session.nickname();
        if (requested.equals(previous)) {
            return;
        }

        String previousMask = session.mask();
        if (previous != null) {
            nicknames.remove(IrcCaseMapping.toLower(previous), session);
        }
        nicknames.put(folded, session);
        session.nickname(requested);

        if (session.state().isRegistered()) {
            String line = ":" + previousMask + " NICK :" + requested;
            session.send(line);
            for (ClientSession member : room) {
                if (member != session) {
                    member.send(line);
                }
            }
            log.info("{} is now known as {}", previous, requested);
            return;
        }

        completeRegistrationIfReady(session);
    }

    private void onUser(ClientSession session, IrcMessage msg)
    {
        if (msg.paramCount() < 4) {
            session.send(numeric(session, IrcReplies.ERR_NEEDMOREPARAMS, "USER :Not enough parameters"));
            return;
        }
        session.user(msg.param(0), msg.param(3));
        completeRegistrationIfReady(session);
    }

    private void completeRegistrationIfReady(ClientSession session)
    {
        if (session.nickname() == null || session.username() == null) {
            return;
        }

        session.cancelRegistrationTimer();
        session.state(SessionState.REGISTERED_NOT_IN_ROOM);
        transition(session, SessionState.UNREGISTERED, SessionState.REGISTERED_NOT_IN_ROOM);

        String server = settings.serverName();
        String version = "meshgate-" + settings.version();
        session.send(numeric(session, IrcReplies.RPL_WELCOME,
                ":Welcome to the Meshtastic IRC Gateway " + session.mask()));
        session.send(numeric(session, IrcReplies.RPL_YOURHOST,
                ":Your host is " + server + ", running version " + version));
        session.send(numeric(session, IrcReplies.RPL_CREATED,
                ":This server was created " + createdText));
        session.send(numeric(session, IrcReplies.RPL_MYINFO,
                server + " " + version + " o nt"));
        notice(session, "*** Welcome to the Akita Meshtastic IRC Gateway (AMIG) (" + server + ")");
        notice(session, "*** Type HELP in " + settings.roomName() + " for commands.");

        joinRoom(session);
    }

    private void onJoin(ClientSession session, IrcMessage msg)
    {
        String targets = msg.param(0);
        if (targets == null || targets.isEmpty()) {
            session.send(numeric(session, IrcReplies.ERR_NEEDMOREPARAMS, "JOIN :Not enough parameters"));
            return;
        }
        for (String target : targets.split(",")) {
            if (target.isEmpty()) {
                continue;
            }
            if (!IrcCaseMapping.equalsIgnoreCase(target, settings.roomName())) {
                session.send(numeric(session, IrcReplies.ERR_NOSUCHCHANNEL,
                        target + " :Cannot join channel - only " + settings.roomName() + " is allowed."));
                continue;
            }
            if (session.state() != SessionState.REGISTERED_IN_ROOM) {
                joinRoom(session);
            }
        }
    }

    private void joinRoom(ClientSession session)
    {
        room.add(session);
        SessionState before = session.state();
        session.state(SessionState.REGISTERED_IN_ROOM);
        transition(session, before, SessionState.REGISTERED_IN_ROOM);

        String join = ":" + session.mask() + " JOIN :" + settings.roomName();
        for (ClientSession member : room) {
            member.send(join);
        }
        session.send(numeric(session, IrcReplies.RPL_TOPIC, settings.roomName() + " :" + settings.topic()));
        sendNames(session);
    }

    private void onPart(ClientSession session, IrcMessage msg)
    {
        String target = msg.param(0) != null ? msg.param(0) : settings.roomName();
        if (!IrcCaseMapping.equalsIgnoreCase(target, settings.roomName())) {
            session.send(numeric(session, IrcReplies.ERR_NOSUCHCHANNEL, target + " :No such channel"));
            return;
        }
        if (session.state() != SessionState.REGISTERED_IN_ROOM) {
            session.send(numeric(session, IrcReplies.ERR_NOTONCHANNEL,
                    settings.roomName() + " :You're not on that channel"));
            return;
        }

        String reason = msg.param(1);
        String part = ":" + session.mask() + " PART " + settings.roomName()
                + (reason != null ? " :" + reason : "");
        for (ClientSession member : room) {
            member.send(part);
        }
        room.remove(session);
        session.state(SessionState.REGISTERED_NOT_IN_ROOM);
        transition(session, SessionState.REGISTERED_IN_ROOM, SessionState.REGISTERED_NOT_IN_ROOM);
    }

    private Runnable onPrivmsg(ClientSession session, IrcMessage msg)
    {
        String target = msg.param(0);
        if (target == null || target.isEmpty()) {
            session.send(numeric(session, IrcReplies.ERR_NORECIPIENT, ":No recipient given (PRIVMSG)"));
            return null;
        }
        String text = msg.param(1);
        if (text == null || text.isEmpty()) {
            session.send(numeric(session, IrcReplies.ERR_NOTEXTTOSEND, ":No text to send"));
            return null;
        }

        if (IrcCaseMapping.equalsIgnoreCase(target, settings.roomName())) {
            return () -> routeRoomMessage(session, text);
        }
        if (IrcCaseMapping.equalsIgnoreCase(target, settings.serverName())) {
            notice(session, "Please send commands inside the control channel.");
            return null;
        }
        session.send(numeric(session, IrcReplies.ERR_NOSUCHNICK, target + " :No such nick/channel"));
        return null;
    }

    private void onTopic(ClientSession session, IrcMessage msg)
    {
        String target = msg.param(0);
        if (target == null || !IrcCaseMapping.equalsIgnoreCase(target, settings.roomName())) {
            session.send(numeric(session, IrcReplies.ERR_NOSUCHCHANNEL,
                    (target != null ? target : "*") + " :No such channel"));
            return;
        }
        if (msg.paramCount() > 1) {
            session.send(numeric(session, IrcReplies.ERR_CHANOPRIVSNEEDED,
                    settings.roomName() + " :You're not channel operator"));
            return;
        }
        session.send(numeric(session, IrcReplies.RPL_TOPIC, settings.roomName() + " :" + settings.topic()));
    }

    private void onWho(ClientSession session, IrcMessage msg)
    {
        String mask = msg.param(0) != null ? msg.param(0) : "*";
        if (IrcCaseMapping.equalsIgnoreCase(mask, settings.roomName())) {
            for (ClientSession member : room) {
                session.send(numeric(session, IrcReplies.RPL_WHOREPLY,
                        settings.roomName() + " " + member.username() + " " + member.host() + " "
                                + settings.serverName() + " " + member.nickname() + " H :0 " + member.realname()));
            }
        }
        session.send(numeric(session, IrcReplies.RPL_ENDOFWHO, mask + " :End of /WHO list."));
    }

    private void onMode(ClientSession session, IrcMessage msg)
    {
        String target = msg.param(0);
        if (target != null && IrcCaseMapping.equalsIgnoreCase(target, settings.roomName())) {
            session.send(numeric(session, IrcReplies.RPL_CHANNELMODEIS, settings.roomName() + " +nt"));
        }
    }

    private void onPing(ClientSession session, IrcMessage msg)
    {
        String token = msg.param(0);
        if (token == null) {
            session.send(numeric(session, IrcReplies.ERR_NOORIGIN, ":No origin specified"));
            return;
        }
        session.send(":" + settings.serverName() + " PONG " + settings.serverName() + " :" + token);
    }

    private Runnable onQuit(ClientSession session, IrcMessage msg)
    {
        String reason = msg.param(0) != null ? "Quit: " + msg.param(0) : "Quit";
        session.send("ERROR :Closing link: " + session.host() + " (" + reason + ")");
        return () -> disconnect(session, reason);
    }

    private void sendNames(ClientSession session)
    {
        StringBuilder names = new StringBuilder();
        for (ClientSession member : room) {
            if (names.length() > 0) {
                names.append(' ');
            }
            names.append(member.nickname());
        }
        session.send(numeric(session, IrcReplies.RPL_NAMREPLY, "= " + settings.roomName() + " :" + names));
        session.send(numeric(session, IrcReplies.RPL_ENDOFNAMES, settings.roomName() + " :End of /NAMES list."));
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void expireRegistration(ClientSession session)
    {
        synchronized (lock) {
            if (session.state() != SessionState.UNREGISTERED) {
                return;
            }
            session.send("ERROR :Closing link: registration timeout");
        }
        disconnect(session, "Registration timeout");
    }

    private String numeric(ClientSession session, String code, String rest)
    {
        return IrcReplies.numeric(settings.serverName(), code, session.replyTarget(), rest);
    }

    private void notice(ClientSession session, String text)
    {
        session.send(":" + settings.serverName() + " NOTICE " + session.replyTarget() + " :" + text);
    }

    private void transition(ClientSession session, SessionState from, SessionState to)
    {
        sink.onSessionTransition(new SessionTransitionEvent(
                wallClock.now(), session.id(), session.nickname(), from.name(), to.name()));
    }

    static boolean isValidNickname(String nick)
    {
        if (nick.isEmpty() || nick.length() > MAX_NICK_LENGTH) {
            return false;
        }
        char first = nick.charAt(0);
        if (!isLetter(first) && !isSpecial(first)) {
            return false;
        }
        for (int i = 1; i < nick.length(); i++) {
            char c = nick.charAt(i);
            if (!isLetter(c) && !isSpecial(c) && !(c >= '0' && c <= '9') && c != '-') {
                return false;
            }
        }
        return true;
    }

    private static boolean isLetter(char c)
    {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isSpecial(char c)
    {
        return "[]\\`_^{|}".indexOf(c) >= 0;
    }

    private static int firstWhitespace(String s)
    {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    /** Outbound text must stay on one protocol line. */
    private static String sanitize(String text)
    {
        return text.replace('\r', ' ').replace('\n', ' ');
    }
}
