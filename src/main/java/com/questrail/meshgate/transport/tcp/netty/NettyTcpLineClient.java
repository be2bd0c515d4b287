package com.questrail.meshgate.transport.tcp.netty;

import com.questrail.meshgate.transport.LineLink;
import com.questrail.meshgate.transport.LineLinkListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Netty-backed {@link LineLink}: a TCP client exchanging LF-terminated lines.
 *
 * <p>All listener callbacks run on the channel's single event loop, so they are
 * serialized. {@link #connect()} may be called again after the link went down;
 * {@link #close()} is final and releases the event loop.</p>
 */
public final class NettyTcpLineClient implements LineLink
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpLineClient.class);

    static final int MAX_LINE_BYTES = 64 * 1024;

    private final InetSocketAddress remoteAddress;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile LineLinkListener listener;
    private volatile Channel channel;
    private volatile boolean closed;

    public NettyTcpLineClient(InetSocketAddress remoteAddress)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(MAX_LINE_BYTES, true, false));
                        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(LineLinkListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect()
    {
        LineLinkListener l = listener;
        if (l == null) {
            throw new IllegalStateException("LineLinkListener must be set before connect()");
        }
        if (closed) {
            throw new IllegalStateException("link is closed");
        }

        bootstrap.connect(remoteAddress).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                log.info("Connected to mesh daemon at {}", remoteAddress);
                l.onLinkUp();
            }
            else {
                l.onLinkDown(future.cause());
            }
        });
    }

    @Override
    public void close()
    {
        closed = true;
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        group.shutdownGracefully();
    }

    @Override
    public boolean send(String line)
    {
        Objects.requireNonNull(line, "line");
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return false;
        }
        ch.writeAndFlush(line + "\n");
        return true;
    }

    @Override
    public boolean isConnected()
    {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    private final class InboundHandler extends SimpleChannelInboundHandler<String>
    {
        private Throwable failure;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            LineLinkListener l = listener;
            if (l != null) {
                l.onLine(line);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            channel = null;
            LineLinkListener l = listener;
            if (l != null) {
                l.onLinkDown(failure);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof TooLongFrameException) {
                log.warn("Discarded over-long line from mesh daemon");
                return;
            }
            failure = cause;
            ctx.close();
        }
    }
}
