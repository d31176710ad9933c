package com.questrail.wrpbridge.transport.tcp.netty;

import com.questrail.wrpbridge.transport.OutboundSocket;
import com.questrail.wrpbridge.transport.SendTimeoutException;
import com.questrail.wrpbridge.transport.SocketClosedException;
import com.questrail.wrpbridge.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyPushSocket
 * =============================================================================
 * Dialed PUSH socket connected to a single PULL peer.
 *
 * <h2>Queue depth one</h2>
 * At most one frame is ever pending in the channel. {@link #send(byte[])}
 * waits, up to the send deadline, for the previous frame to leave for the
 * kernel and only then writes its own; on timeout the frame is never written.
 * A send therefore succeeds once its frame is queued, and the failure of a
 * queued write surfaces on the next send.
 */
final class NettyPushSocket implements OutboundSocket
{
    private static final Logger log = LoggerFactory.getLogger(NettyPushSocket.class);

    private final EventLoopGroup group;
    private final Duration sendDeadline;
    private static final long CLOSE_LINGER_MILLIS = 1000;

    private final CompletableFuture<Void> handshake = new CompletableFuture<>();
    private final Object sendLock = new Object();

    private volatile Channel channel;
    private volatile boolean closed;
    private volatile ChannelFuture pending; // written under sendLock

    private NettyPushSocket(Duration sendDeadline) {
        this.group = new NioEventLoopGroup(1);
        this.sendDeadline = sendDeadline;
    }

    static NettyPushSocket connect(InetSocketAddress remote, Duration sendDeadline, TcpTransportConfig config) {
        NettyPushSocket socket = new NettyPushSocket(sendDeadline);
        long connectMillis = config.connectTimeout().toMillis();

        Bootstrap bootstrap = new Bootstrap()
                .group(socket.group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectMillis))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        // Handshake sits nearest the wire so its header is not length-prefixed.
                        p.addLast(new SpHandshakeHandler(SpProtocol.PUSH));
                        p.addLast(new LengthFieldPrepender(SpProtocol.LENGTH_FIELD_BYTES));
                        p.addLast(socket.new PeerHandler());
                    }
                });

        try {
            ChannelFuture f = bootstrap.connect(remote).awaitUninterruptibly();
            if (!f.isSuccess()) {
                throw new TransportException("failed to dial " + remote, f.cause());
            }
            socket.channel = f.channel();
            socket.handshake.get(connectMillis, TimeUnit.MILLISECONDS);
        } catch (TransportException e) {
            socket.close();
            throw e;
        } catch (TimeoutException e) {
            socket.close();
            throw new TransportException("handshake with " + remote + " timed out", e);
        } catch (ExecutionException e) {
            socket.close();
            throw new TransportException("handshake with " + remote + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            socket.close();
            throw new TransportException("interrupted while dialing " + remote, e);
        }

        log.debug("Connected to {}", remote);
        return socket;
    }

    @Override
    public void send(byte[] frame) {
        Channel ch = channel;
        if (closed || ch == null) {
            throw new SocketClosedException("socket closed");
        }

        synchronized (sendLock) {
            ChannelFuture previous = pending;
            if (previous != null) {
                if (!awaitWrite(previous)) {
                    throw new SendTimeoutException(sendDeadline);
                }
                pending = null;
                if (!previous.isSuccess()) {
                    throw writeFailure(ch, previous.cause());
                }
            }
            if (closed) {
                throw new SocketClosedException("socket closed");
            }
            if (!ch.isActive()) {
                throw new SocketClosedException("peer " + ch.remoteAddress() + " disconnected");
            }
            pending = ch.writeAndFlush(Unpooled.wrappedBuffer(frame));
        }
    }

    private boolean awaitWrite(ChannelFuture f) {
        if (sendDeadline.isZero()) {
            f.awaitUninterruptibly();
            return true;
        }
        return f.awaitUninterruptibly(sendDeadline.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static TransportException writeFailure(Channel ch, Throwable cause) {
        if (cause instanceof ClosedChannelException || !ch.isActive()) {
            return new SocketClosedException("peer " + ch.remoteAddress() + " disconnected", cause);
        }
        return new TransportException("send to " + ch.remoteAddress() + " failed", cause);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        // Let the last queued frame reach the kernel; closing fails it otherwise,
        // which also releases a sender waiting on it.
        ChannelFuture last = pending;
        if (last != null) {
            last.awaitUninterruptibly(CLOSE_LINGER_MILLIS, TimeUnit.MILLISECONDS);
        }

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        handshake.completeExceptionally(new SocketClosedException("socket closed"));
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    /**
     * Tracks the handshake and discards anything the peer sends afterwards;
     * a PULL peer never sends frames.
     */
    private final class PeerHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt == SpHandshakeHandler.COMPLETE) {
                handshake.complete(null);
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof ByteBuf) {
                log.trace("Discarding {} unexpected bytes from {}", ((ByteBuf) msg).readableBytes(),
                        ctx.channel().remoteAddress());
            }
            ReferenceCountUtil.release(msg);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            handshake.completeExceptionally(new SocketClosedException("peer closed the connection"));
            log.debug("Peer {} disconnected", ctx.channel().remoteAddress());
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Connection to {} failed: {}", ctx.channel().remoteAddress(), cause.toString());
            ctx.close();
        }
    }
}
