package com.questrail.meshgate.irc;

import com.questrail.meshgate.internal.time.Cancellable;
import com.questrail.meshgate.transport.ClientConnection;

import java.util.Objects;

/**
 * ClientSession
 * -----------------------------------------------------------------------------
 * Chat-side state of one accepted connection.
 *
 * <p>The session owns its {@link ClientConnection} exclusively. All mutable
 * fields are guarded by the owning {@link ChatServer}'s lock; only the server
 * mutates them.</p>
 */
public final class ClientSession
{
    private final ClientConnection connection;

    private SessionState state = SessionState.UNREGISTERED;
    private String nickname;
    private String username;
    private String realname;
    private Cancellable registrationTimer;

    ClientSession(ClientConnection connection)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    public ClientConnection connection()
    {
        return connection;
    }

    public String id()
    {
        return connection.id();
    }

    public synchronized SessionState state()
    {
        return state;
    }

    /** Chosen nickname, or {@code null} before the first valid NICK. */
    public synchronized String nickname()
    {
        return nickname;
    }

    public synchronized String username()
    {
        return username;
    }

    public synchronized String realname()
    {
        return realname;
    }

    public String host()
    {
        return connection.remoteHost();
    }

    /** {@code nick!user@host} as used in message prefixes. */
    synchronized String mask()
    {
        return nickname + "!" + (username != null ? username : "unknown") + "@" + host();
    }

    /** Nickname for numeric replies; {@code *} before one is chosen. */
    synchronized String replyTarget()
    {
        return nickname != null ? nickname : "*";
    }

    synchronized void state(SessionState state)
    {
        this.state = state;
    }

    synchronized void nickname(String nickname)
    {
        this.nickname = nickname;
    }

    synchronized void user(String username, String realname)
    {
        this.username = username;
        this.realname = realname;
    }

    synchronized void registrationTimer(Cancellable timer)
    {
        this.registrationTimer = timer;
    }

    synchronized void cancelRegistrationTimer()
    {
        if (registrationTimer != null) {
            registrationTimer.cancel();
            registrationTimer = null;
        }
    }

    void send(String line)
    {
        connection.sendLine(line);
    }

    @Override
    public String toString()
    {
        return "ClientSession[" + id() + ", " + nickname() + ", " + state() + "]";
    }
}
