package com.questrail.meshgate.transport.tcp.netty;

import com.questrail.meshgate.transport.ClientConnection;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * {@link ClientConnection} over an accepted Netty {@link Channel}.
 *
 * <p>{@code Channel.writeAndFlush} is safe from any thread, so the relay thread
 * and the connection's own executor can both write.</p>
 */
final class NettyClientConnection implements ClientConnection
{
    static final String LINE_TERMINATOR = "\r\n";

    private final String id;
    private final Channel channel;

    NettyClientConnection(String id, Channel channel)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public String remoteHost()
    {
        SocketAddress remote = channel.remoteAddress();
        if (remote instanceof InetSocketAddress inet) {
            return inet.getHostString();
        }
        return String.valueOf(remote);
    }

    @Override
    public void sendLine(String line)
    {
        Objects.requireNonNull(line, "line");
        if (channel.isActive()) {
            channel.writeAndFlush(line + LINE_TERMINATOR);
        }
    }

    @Override
    public void close()
    {
        if (channel.isOpen()) {
            channel.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public String toString()
    {
        return id + "(" + channel.remoteAddress() + ")";
    }
}
