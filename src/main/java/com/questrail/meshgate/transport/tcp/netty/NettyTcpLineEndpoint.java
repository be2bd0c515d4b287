package com.questrail.meshgate.transport.tcp.netty;

import com.questrail.meshgate.transport.ClientConnection;
import com.questrail.meshgate.transport.LineEndpoint;
import com.questrail.meshgate.transport.LineEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyTcpLineEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link LineEndpoint} port: a TCP listener
 * that frames inbound bytes into lines.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT parse
 * chat verbs, track nicknames, or decide who receives what.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   LineBasedFrameDecoder (max 512 bytes, CR LF or LF)
 *        → StringDecoder (UTF-8)
 *            → InboundHandler  (on a separate executor group)
 *   StringEncoder (UTF-8) for outbound lines
 * </pre>
 *
 * <p>The inbound handler runs on a {@link DefaultEventExecutorGroup} rather than
 * the I/O event loop: command handlers may wait on external lookups and must
 * not stall socket I/O for every other client. Netty still delivers the
 * callbacks of one connection in order.</p>
 *
 * <p>Lines longer than the frame limit are discarded and never reach the
 * listener.</p>
 */
public final class NettyTcpLineEndpoint implements LineEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpLineEndpoint.class);

    static final int MAX_LINE_BYTES = 512;

    private final InetSocketAddress bindAddress;
    private final AtomicLong connectionSequence = new AtomicLong();

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final EventExecutorGroup handlerGroup;
    private final ChannelGroup acceptedChannels;
    private final ServerBootstrap bootstrap;

    private volatile LineEndpointListener listener;
    private volatile Channel serverChannel;

    public NettyTcpLineEndpoint(InetSocketAddress bindAddress)
    {
        this(bindAddress, 4);
    }

    public NettyTcpLineEndpoint(InetSocketAddress bindAddress, int handlerThreads)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (handlerThreads < 1) {
            throw new IllegalArgumentException("handlerThreads must be >= 1");
        }

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.handlerGroup = new DefaultEventExecutorGroup(handlerThreads);
        this.acceptedChannels = new DefaultChannelGroup("chat-clients", GlobalEventExecutor.INSTANCE);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 64)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("framer", new LineBasedFrameDecoder(MAX_LINE_BYTES, true, false));
                        p.addLast("decoder", new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast("encoder", new StringEncoder(StandardCharsets.UTF_8));
                        p.addLast(handlerGroup, "session", new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(LineEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            shutdownGroups();
            throw new IllegalStateException("Failed to bind chat listener to " + bindAddress, f.cause());
        }
        serverChannel = f.channel();
        log.info("Chat listener bound to {}", serverChannel.localAddress());
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        acceptedChannels.close().awaitUninterruptibly();
        shutdownGroups();
    }

    @Override
    public Optional<SocketAddress> boundAddress()
    {
        Channel ch = serverChannel;
        return ch == null ? Optional.empty() : Optional.ofNullable(ch.localAddress());
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        handlerGroup.shutdownGracefully();
    }

    private LineEndpointListener requireListener()
    {
        LineEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("LineEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * One instance per accepted channel; holds that channel's connection handle.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<String>
    {
        private ClientConnection connection;
        private Throwable failure;

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            acceptedChannels.add(ctx.channel());
            connection = new NettyClientConnection("conn-" + connectionSequence.incrementAndGet(), ctx.channel());
            LineEndpointListener l = listener;
            if (l != null) {
                l.onConnectionOpened(connection);
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            LineEndpointListener l = listener;
            if (l == null || connection == null) {
                return;
            }
            l.onLine(connection, line);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            LineEndpointListener l = listener;
            if (l != null && connection != null) {
                l.onConnectionClosed(connection, failure);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof TooLongFrameException) {
                log.debug("Discarded over-long line from {}", ctx.channel().remoteAddress());
                return;
            }
            log.debug("Connection {} failed", ctx.channel().remoteAddress(), cause);
            failure = cause;
            ctx.close();
        }
    }
}
