package com.questrail.groupchat.transport.tcp.netty;

import com.questrail.groupchat.transport.PeerLink;
import com.questrail.groupchat.transport.PeerTransport;
import com.questrail.groupchat.transport.PeerTransportListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.util.AttributeKey;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyTcpPeerTransport
 * =============================================================================
 * Netty-backed implementation of the {@link PeerTransport} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>: it binds, dials,
 * frames lines and writes bytes. It does not decode messages, keep a registry,
 * or decide which ports to dial.
 *
 * <h2>Threading</h2>
 * One {@link NioEventLoopGroup} with a single thread serves the listener and
 * every link, inbound and outbound. All listener callbacks therefore arrive on
 * the same thread as tasks submitted through {@link #loop()}.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code ByteBuf}) do not escape this
 * package. Links are exposed as {@link PeerLink}; the loop is exposed as a
 * plain {@link ScheduledExecutorService}.
 *
 * <h2>Reading</h2>
 * Every channel starts with auto-read off. Nothing is read from a link until
 * {@link PeerLink#startReading()} is called, which the mesh does only after the
 * link is registered.
 */
public final class NettyTcpPeerTransport implements PeerTransport
{
    /**
     * Longest accepted line. Longer lines are discarded and reported through
     * {@link PeerTransportListener#onMalformedLine(PeerLink, Throwable)}.
     */
    public static final int MAX_LINE_BYTES = 64 * 1024;

    private static final AttributeKey<NettyPeerLink> LINK = AttributeKey.valueOf("group-chat-link");

    private final EventLoopGroup group;
    private final EventLoop loop;
    private final AtomicLong linkIds = new AtomicLong();

    private volatile PeerTransportListener listener;
    private volatile Channel serverChannel;

    public NettyTcpPeerTransport()
    {
        this.group = new NioEventLoopGroup(1);
        this.loop = group.next();
    }

    @Override
    public void setListener(PeerTransportListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public ScheduledExecutorService loop()
    {
        return loop;
    }

    @Override
    public boolean inLoop()
    {
        return loop.inEventLoop();
    }

    @Override
    public CompletionStage<InetSocketAddress> bind(InetSocketAddress local)
    {
        Objects.requireNonNull(local, "local");
        requireListener();

        CompletableFuture<InetSocketAddress> result = new CompletableFuture<>();
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.AUTO_READ, false)
                .childHandler(new LinkInitializer(PeerLink.Direction.INBOUND, -1));

        try {
            bootstrap.bind(local).addListener((ChannelFutureListener) f -> {
                if (f.isSuccess()) {
                    serverChannel = f.channel();
                    result.complete((InetSocketAddress) f.channel().localAddress());
                }
                else {
                    result.completeExceptionally(f.cause());
                }
            });
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    @Override
    public boolean isBound()
    {
        Channel ch = serverChannel;
        return ch != null && ch.isActive();
    }

    @Override
    public CompletionStage<PeerLink> connect(InetSocketAddress remote, Duration timeout)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(timeout, "timeout");
        requireListener();

        CompletableFuture<PeerLink> result = new CompletableFuture<>();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(1, timeout.toMillis()))
                .option(ChannelOption.AUTO_READ, false)
                .handler(new LinkInitializer(PeerLink.Direction.OUTBOUND, remote.getPort()));

        try {
            bootstrap.connect(remote).addListener((ChannelFutureListener) f -> {
                if (f.isSuccess()) {
                    result.complete(f.channel().attr(LINK).get());
                }
                else {
                    result.completeExceptionally(f.cause());
                }
            });
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    @Override
    public CompletionStage<Void> closeListener()
    {
        CompletableFuture<Void> done = new CompletableFuture<>();
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch == null) {
            done.complete(null);
            return done;
        }
        ch.close().addListener(f -> done.complete(null));
        return done;
    }

    @Override
    public void shutdown()
    {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
    }

    private PeerTransportListener requireListener()
    {
        PeerTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("PeerTransportListener must be set before bind() or connect()");
        }
        return l;
    }

    /**
     * Installs line framing and the link handler on every new socket channel.
     */
    private final class LinkInitializer extends ChannelInitializer<SocketChannel>
    {
        private final PeerLink.Direction direction;
        private final int knownPort;

        private LinkInitializer(PeerLink.Direction direction, int knownPort)
        {
            this.direction = direction;
            this.knownPort = knownPort;
        }

        @Override
        protected void initChannel(SocketChannel ch)
        {
            // Outbound channels are initialised before connecting, so the
            // dialled port stands in for the remote address.
            int port = knownPort;
            if (port < 0 && ch.remoteAddress() != null) {
                port = ch.remoteAddress().getPort();
            }

            NettyPeerLink link = new NettyPeerLink(linkIds.incrementAndGet(), direction, port, ch);
            ch.attr(LINK).set(link);

            ch.pipeline().addLast(
                    new LineBasedFrameDecoder(MAX_LINE_BYTES),
                    new StringDecoder(StandardCharsets.UTF_8),
                    new LinkHandler(link));
        }
    }

    /**
     * LinkHandler
     * -------------------------------------------------------------------------
     * Forwards framed lines and lifecycle transitions of one link to the
     * transport listener.
     */
    private final class LinkHandler extends SimpleChannelInboundHandler<String>
    {
        private final NettyPeerLink link;

        private LinkHandler(NettyPeerLink link)
        {
            this.link = link;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            if (link.direction() == PeerLink.Direction.INBOUND) {
                listener.onLinkAccepted(link);
            }
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            listener.onLine(link, line);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof DecoderException) {
                // Framing defect of one line; the decoder has already skipped it.
                listener.onMalformedLine(link, cause);
                return;
            }
            link.recordFailure(cause);
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            if (link.markCloseReported()) {
                listener.onLinkClosed(link, link.failure());
            }
            super.channelInactive(ctx);
        }
    }
}
