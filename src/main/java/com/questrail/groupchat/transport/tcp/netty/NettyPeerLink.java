package com.questrail.groupchat.transport.tcp.netty;

import com.questrail.groupchat.transport.PeerLink;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link PeerLink} over one Netty socket channel.
 *
 * <p>Package-private: the channel never leaves the Netty adapter.</p>
 */
final class NettyPeerLink implements PeerLink
{
    private final long id;
    private final Direction direction;
    private final int remotePort;
    private final Channel channel;

    private final AtomicBoolean closeReported = new AtomicBoolean(false);
    private volatile Throwable failure;

    NettyPeerLink(long id, Direction direction, int remotePort, Channel channel)
    {
        this.id = id;
        this.direction = Objects.requireNonNull(direction, "direction");
        this.remotePort = remotePort;
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public long id()
    {
        return id;
    }

    @Override
    public Direction direction()
    {
        return direction;
    }

    @Override
    public OptionalInt remotePort()
    {
        return remotePort > 0 ? OptionalInt.of(remotePort) : OptionalInt.empty();
    }

    @Override
    public CompletionStage<Void> write(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        CompletableFuture<Void> done = new CompletableFuture<>();
        if (!channel.isActive()) {
            done.completeExceptionally(new ClosedChannelException());
            return done;
        }

        channel.writeAndFlush(Unpooled.wrappedBuffer(payload))
                .addListener((ChannelFutureListener) f -> {
                    if (f.isSuccess()) {
                        done.complete(null);
                    }
                    else {
                        done.completeExceptionally(f.cause());
                    }
                });
        return done;
    }

    @Override
    public void startReading()
    {
        channel.config().setAutoRead(true);
    }

    @Override
    public CompletionStage<Void> close()
    {
        CompletableFuture<Void> done = new CompletableFuture<>();
        channel.close().addListener(f -> done.complete(null));
        return done;
    }

    @Override
    public boolean isOpen()
    {
        return channel.isOpen();
    }

    /**
     * @return {@code true} the first time only; guards the single
     *         {@code onLinkClosed} notification
     */
    boolean markCloseReported()
    {
        return closeReported.compareAndSet(false, true);
    }

    void recordFailure(Throwable cause)
    {
        if (failure == null) {
            failure = cause;
        }
    }

    Throwable failure()
    {
        return failure;
    }

    @Override
    public String toString()
    {
        return "link#" + id + "(" + direction + (remotePort > 0 ? ", port " + remotePort : "") + ")";
    }
}
