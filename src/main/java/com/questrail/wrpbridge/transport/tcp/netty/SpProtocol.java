package com.questrail.wrpbridge.transport.tcp.netty;

/**
 * nanomsg scalability-protocol (SP) constants for the TCP mapping.
 *
 * <pre>
 *   handshake: 0x00 'S' 'P' 0x00 proto-hi proto-lo 0x00 0x00
 *   frame:     u64 big-endian length, then that many bytes
 * </pre>
 */
final class SpProtocol
{
    static final int PUSH = 0x50;
    static final int PULL = 0x51;

    static final int HEADER_LENGTH = 8;
    static final int LENGTH_FIELD_BYTES = 8;

    private SpProtocol() {
    }

    static byte[] header(int protocol) {
        return new byte[] {
                0x00, 'S', 'P', 0x00,
                (byte) (protocol >>> 8), (byte) protocol,
                0x00, 0x00
        };
    }

    /**
     * @return the only protocol a socket speaking {@code protocol} accepts as its peer
     */
    static int peerOf(int protocol) {
        return switch (protocol) {
            case PUSH -> PULL;
            case PULL -> PUSH;
            default -> throw new IllegalArgumentException("unsupported protocol 0x" + Integer.toHexString(protocol));
        };
    }

    static String name(int protocol) {
        return switch (protocol) {
            case PUSH -> "push";
            case PULL -> "pull";
            default -> "0x" + Integer.toHexString(protocol);
        };
    }
}
