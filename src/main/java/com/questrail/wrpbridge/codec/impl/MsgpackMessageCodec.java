package com.questrail.wrpbridge.codec.impl;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.wrpbridge.codec.MessageCodec;
import com.questrail.wrpbridge.codec.MessageCodecException;
import com.questrail.wrpbridge.model.Message;
import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MsgpackMessageCodec
 * =============================================================================
 * WRP MessagePack encoding: one message is one MessagePack map keyed by the
 * WRP field names ({@code msg_type}, {@code dest}, {@code service_name}, ...).
 *
 * <h2>Wire rules</h2>
 * <ul>
 *   <li>empty fields are omitted on encode</li>
 *   <li>unknown keys are ignored on decode</li>
 *   <li>the payload is a MessagePack {@code bin}</li>
 *   <li>a frame must hold exactly one value, and no length or element count
 *       in it may claim more bytes than the frame has left</li>
 * </ul>
 *
 * <p>Instances are thread-safe; the underlying {@link ObjectMapper} is
 * configured once and never mutated afterwards.</p>
 */
public final class MsgpackMessageCodec implements MessageCodec
{
    private final ObjectMapper mapper;

    public MsgpackMessageCodec() {
        this.mapper = new ObjectMapper(new MessagePackFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] encode(Message message) {
        Objects.requireNonNull(message, "message");
        try {
            return mapper.writeValueAsBytes(WireMessage.from(message));
        } catch (IOException e) {
            throw new MessageCodecException("failed to encode " + message, e);
        }
    }

    @Override
    public Message decode(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        if (frame.length == 0) {
            throw new MessageCodecException("empty frame");
        }
        try {
            checkStructure(frame);
            WireMessage wire = mapper.readValue(frame, WireMessage.class);
            if (wire == null) {
                throw new MessageCodecException("frame does not contain a message");
            }
            return wire.toMessage();
        } catch (IOException | MessagePackException e) {
            throw new MessageCodecException("failed to decode " + frame.length + " byte frame", e);
        }
    }

    /**
     * Walks every value header in {@code frame} without materializing
     * anything, so that a declared length is never trusted before the bytes
     * behind it are known to exist.
     */
    static void checkStructure(byte[] frame) throws IOException {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(frame)) {
            long pending = 1;
            while (pending > 0) {
                if (!unpacker.hasNext()) {
                    throw new MessageCodecException("truncated frame");
                }
                pending--;

                MessageFormat format = unpacker.getNextFormat();
                switch (format.getValueType()) {
                    case ARRAY -> pending += claim(frame, unpacker, unpacker.unpackArrayHeader());
                    case MAP -> pending += claim(frame, unpacker, 2L * unpacker.unpackMapHeader());
                    case STRING -> skipPayload(frame, unpacker, unpacker.unpackRawStringHeader());
                    case BINARY -> skipPayload(frame, unpacker, unpacker.unpackBinaryHeader());
                    case EXTENSION -> skipPayload(frame, unpacker, unpacker.unpackExtensionTypeHeader().getLength());
                    default -> unpacker.skipValue();
                }
            }
            if (unpacker.hasNext()) {
                throw new MessageCodecException("trailing bytes after message");
            }
        }
    }

    // Every element takes at least one byte.
    private static long claim(byte[] frame, MessageUnpacker unpacker, long elements) {
        long remaining = frame.length - unpacker.getTotalReadBytes();
        if (elements > remaining) {
            throw new MessageCodecException(elements + " elements declared, " + remaining + " bytes left");
        }
        return elements;
    }

    private static void skipPayload(byte[] frame, MessageUnpacker unpacker, int length) throws IOException {
        long remaining = frame.length - unpacker.getTotalReadBytes();
        if (length > remaining) {
            throw new MessageCodecException(length + " byte value declared, " + remaining + " bytes left");
        }
        unpacker.readPayloadAsReference(length);
    }

    /**
     * Jackson binding of the WRP wire map.
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    static final class WireMessage
    {
        @JsonProperty("msg_type")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        public Integer msgType;

        @JsonProperty("source")
        public String source;

        @JsonProperty("dest")
        public String dest;

        @JsonProperty("transaction_uuid")
        public String transactionUuid;

        @JsonProperty("content_type")
        public String contentType;

        @JsonProperty("accept")
        public String accept;

        @JsonProperty("status")
        public Long status;

        @JsonProperty("rdr")
        public Long rdr;

        @JsonProperty("headers")
        public List<String> headers;

        @JsonProperty("metadata")
        public Map<String, String> metadata;

        @JsonProperty("path")
        public String path;

        @JsonProperty("payload")
        public byte[] payload;

        @JsonProperty("service_name")
        public String serviceName;

        @JsonProperty("url")
        public String url;

        @JsonProperty("partner_ids")
        public List<String> partnerIds;

        @JsonProperty("session_id")
        public String sessionId;

        @JsonProperty("qos")
        public Integer qos;

        static WireMessage from(Message m) {
            WireMessage w = new WireMessage();
            w.msgType = m.typeCode();
            w.source = m.source();
            w.dest = m.destination();
            w.transactionUuid = m.transactionUuid();
            w.contentType = m.contentType();
            w.accept = m.accept();
            w.status = m.status();
            w.rdr = m.requestDeliveryResponse();
            w.headers = m.headers();
            w.metadata = m.metadata();
            w.path = m.path();
            w.payload = m.payload();
            w.serviceName = m.serviceName();
            w.url = m.url();
            w.partnerIds = m.partnerIds();
            w.sessionId = m.sessionId();
            w.qos = m.qualityOfService() == 0 ? null : m.qualityOfService();
            return w;
        }

        Message toMessage() {
            return Message.builder()
                    .typeCode(msgType == null ? 0 : msgType)
                    .source(source)
                    .destination(dest)
                    .transactionUuid(transactionUuid)
                    .contentType(contentType)
                    .accept(accept)
                    .status(status)
                    .requestDeliveryResponse(rdr)
                    .headers(headers)
                    .metadata(metadata)
                    .path(path)
                    .payload(payload)
                    .serviceName(serviceName)
                    .url(url)
                    .partnerIds(partnerIds)
                    .sessionId(sessionId)
                    .qualityOfService(qos == null ? 0 : qos)
                    .build();
        }
    }
}
