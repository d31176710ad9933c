package com.questrail.wrpbridge.transport.tcp.netty;

import com.questrail.wrpbridge.transport.InboundSocket;
import com.questrail.wrpbridge.transport.ReceiveTimeoutException;
import com.questrail.wrpbridge.transport.SocketClosedException;
import com.questrail.wrpbridge.transport.TransportException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * NettyPullSocket
 * =============================================================================
 * Listening PULL socket. Any number of PUSH peers may connect; their frames
 * are interleaved onto one queue drained by {@link #receive()}.
 *
 * <h2>Back-pressure</h2>
 * The queue is unbounded, but once it holds more than the high water mark the
 * peer that pushed it over stops being read. Peers resume as soon as the
 * consumer brings the queue down to the low water mark.
 */
final class NettyPullSocket implements InboundSocket
{
    private static final Logger log = LoggerFactory.getLogger(NettyPullSocket.class);

    // Identity sentinel; a real zero-length frame is a different array.
    private static final byte[] CLOSED = new byte[0];

    private static final long CLOSE_WAIT_SECONDS = 2;

    private final EventLoopGroup group;
    private final Duration receiveDeadline;
    private final TcpTransportConfig config;

    private final BlockingQueue<byte[]> frames = new LinkedBlockingQueue<>();
    private final Set<Channel> paused = ConcurrentHashMap.newKeySet();
    private final ChannelGroup peers = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private volatile Channel serverChannel;
    private volatile boolean closed;

    private NettyPullSocket(Duration receiveDeadline, TcpTransportConfig config) {
        this.group = new NioEventLoopGroup(1);
        this.receiveDeadline = receiveDeadline;
        this.config = config;
    }

    static NettyPullSocket bind(InetSocketAddress bindAddress, Duration receiveDeadline, TcpTransportConfig config) {
        NettyPullSocket socket = new NettyPullSocket(receiveDeadline, config);

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(socket.group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new SpHandshakeHandler(SpProtocol.PULL));
                        p.addLast(new LengthFieldBasedFrameDecoder(
                                config.maxFrameBytes(), 0, SpProtocol.LENGTH_FIELD_BYTES,
                                0, SpProtocol.LENGTH_FIELD_BYTES));
                        p.addLast(socket.new FrameHandler());
                        socket.peers.add(ch);
                    }
                });

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            socket.group.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            throw new TransportException("failed to listen on " + bindAddress, f.cause());
        }

        socket.serverChannel = f.channel();
        log.debug("Listening on {}", socket.serverChannel.localAddress());
        return socket;
    }

    @Override
    public byte[] receive() {
        if (closed) {
            throw new SocketClosedException("socket closed");
        }

        byte[] frame;
        try {
            if (receiveDeadline.isZero()) {
                frame = frames.take();
            } else {
                frame = frames.poll(receiveDeadline.toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while receiving", e);
        }

        if (frame == null) {
            throw new ReceiveTimeoutException(receiveDeadline);
        }
        if (frame == CLOSED) {
            // Leave the sentinel for any other receiver.
            frames.offer(CLOSED);
            throw new SocketClosedException("socket closed");
        }

        if (!paused.isEmpty() && frames.size() <= config.lowWaterMark()) {
            resumeAll();
        }
        return frame;
    }

    @Override
    public SocketAddress localAddress() {
        Channel ch = serverChannel;
        return ch == null ? null : ch.localAddress();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        frames.offer(CLOSED);

        Channel ch = serverChannel;
        if (ch != null) {
            // Once close() returns the port no longer accepts connections.
            ch.close().awaitUninterruptibly(CLOSE_WAIT_SECONDS, TimeUnit.SECONDS);
        }
        peers.close();
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        log.debug("Closed listener {}", ch == null ? "(unbound)" : ch.localAddress());
    }

    private void enqueue(Channel from, byte[] frame) {
        if (closed) {
            return;
        }
        frames.offer(frame);

        if (frames.size() > config.highWaterMark() && paused.add(from)) {
            from.config().setAutoRead(false);
            // The consumer may have drained the queue while we were pausing.
            if (frames.size() <= config.lowWaterMark()) {
                resumeAll();
            }
        }
    }

    private void resumeAll() {
        for (Channel ch : paused) {
            if (paused.remove(ch)) {
                ch.config().setAutoRead(true);
            }
        }
    }

    /**
     * Copies each decoded frame out of Netty's buffer and onto the queue.
     */
    private final class FrameHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);
            enqueue(ctx.channel(), bytes);
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt == SpHandshakeHandler.COMPLETE) {
                log.debug("Peer {} connected", ctx.channel().remoteAddress());
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            paused.remove(ctx.channel());
            log.debug("Peer {} disconnected", ctx.channel().remoteAddress());
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            // Oversize or malformed frames end up here; only this peer is dropped.
            log.debug("Dropping peer {}: {}", ctx.channel().remoteAddress(), cause.toString());
            ctx.close();
        }
    }
}
