package com.questrail.wrpbridge.transport.tcp.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * SpHandshakeHandler
 * -----------------------------------------------------------------------------
 * Exchanges the 8-byte SP header on a fresh connection.
 *
 * <p>Sends our header as soon as the channel is active and waits for the
 * peer's. A matching peer fires {@link #COMPLETE} as a user event and removes
 * this handler from the pipeline; any bytes already received are handed on to
 * the frame decoder. A mismatching peer is disconnected.</p>
 */
final class SpHandshakeHandler extends ByteToMessageDecoder
{
    static final Object COMPLETE = new Object() {
        @Override
        public String toString() {
            return "SP_HANDSHAKE_COMPLETE";
        }
    };

    private static final Logger log = LoggerFactory.getLogger(SpHandshakeHandler.class);

    private final int protocol;

    SpHandshakeHandler(int protocol) {
        this.protocol = protocol;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        ctx.writeAndFlush(Unpooled.wrappedBuffer(SpProtocol.header(protocol)));
        super.channelActive(ctx);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (in.readableBytes() < SpProtocol.HEADER_LENGTH) {
            return;
        }

        byte[] header = new byte[SpProtocol.HEADER_LENGTH];
        in.readBytes(header);

        if (header[0] != 0x00 || header[1] != 'S' || header[2] != 'P' || header[3] != 0x00
                || header[6] != 0x00 || header[7] != 0x00) {
            log.debug("Rejecting {}: not an SP peer", ctx.channel().remoteAddress());
            in.skipBytes(in.readableBytes());
            ctx.close();
            return;
        }

        int peer = ((header[4] & 0xff) << 8) | (header[5] & 0xff);
        if (peer != SpProtocol.peerOf(protocol)) {
            log.debug("Rejecting {}: {} socket cannot talk to {}",
                    ctx.channel().remoteAddress(), SpProtocol.name(protocol), SpProtocol.name(peer));
            in.skipBytes(in.readableBytes());
            ctx.close();
            return;
        }

        ctx.fireUserEventTriggered(COMPLETE);
        ctx.pipeline().remove(this);
    }
}
