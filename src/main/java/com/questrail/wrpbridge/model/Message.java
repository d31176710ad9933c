package com.questrail.wrpbridge.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Message
 * =============================================================================
 * Immutable WRP message.
 *
 * <p>The routing core inspects only three things: the type code, the
 * {@link #destination()} locator and, for registrations, {@link #serviceName()}
 * and {@link #url()}. Everything else is carried through unchanged.</p>
 *
 * <h2>Normalization</h2>
 * <ul>
 *   <li>empty strings are stored as absent ({@code null})</li>
 *   <li>absent lists, maps and payloads are stored as empty</li>
 *   <li>equality compares payload bytes by content</li>
 * </ul>
 *
 * <p>This makes a message equal to its own encode/decode round trip, since the
 * wire format omits empty fields.</p>
 */
public final class Message
{
    private static final byte[] NO_PAYLOAD = new byte[0];

    private final int typeCode;
    private final String source;
    private final String destination;
    private final String transactionUuid;
    private final String contentType;
    private final String accept;
    private final Long status;
    private final Long requestDeliveryResponse;
    private final List<String> headers;
    private final Map<String, String> metadata;
    private final String path;
    private final byte[] payload;
    private final String serviceName;
    private final String url;
    private final List<String> partnerIds;
    private final String sessionId;
    private final int qualityOfService;

    private Message(Builder b) {
        this.typeCode = b.typeCode;
        this.source = emptyToNull(b.source);
        this.destination = emptyToNull(b.destination);
        this.transactionUuid = emptyToNull(b.transactionUuid);
        this.contentType = emptyToNull(b.contentType);
        this.accept = emptyToNull(b.accept);
        this.status = b.status;
        this.requestDeliveryResponse = b.requestDeliveryResponse;
        this.headers = copyOf(b.headers);
        this.metadata = b.metadata == null || b.metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.path = emptyToNull(b.path);
        this.payload = b.payload == null || b.payload.length == 0 ? NO_PAYLOAD : b.payload.clone();
        this.serviceName = emptyToNull(b.serviceName);
        this.url = emptyToNull(b.url);
        this.partnerIds = copyOf(b.partnerIds);
        this.sessionId = emptyToNull(b.sessionId);
        this.qualityOfService = b.qualityOfService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(MessageType type) {
        return new Builder().type(type);
    }

    public Builder toBuilder() {
        return new Builder()
                .typeCode(typeCode)
                .source(source)
                .destination(destination)
                .transactionUuid(transactionUuid)
                .contentType(contentType)
                .accept(accept)
                .status(status)
                .requestDeliveryResponse(requestDeliveryResponse)
                .headers(headers)
                .metadata(metadata)
                .path(path)
                .payload(payload)
                .serviceName(serviceName)
                .url(url)
                .partnerIds(partnerIds)
                .sessionId(sessionId)
                .qualityOfService(qualityOfService);
    }

    public int typeCode() {
        return typeCode;
    }

    /**
     * @return the type, or empty when the code is outside the known enumeration
     */
    public Optional<MessageType> type() {
        return MessageType.fromCode(typeCode);
    }

    public boolean is(MessageType type) {
        return typeCode == type.code();
    }

    public String source() {
        return source;
    }

    /**
     * The destination locator string ({@code scheme:authority/service/...}).
     */
    public String destination() {
        return destination;
    }

    public String transactionUuid() {
        return transactionUuid;
    }

    public String contentType() {
        return contentType;
    }

    public String accept() {
        return accept;
    }

    public Long status() {
        return status;
    }

    public Long requestDeliveryResponse() {
        return requestDeliveryResponse;
    }

    public List<String> headers() {
        return headers;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public String path() {
        return path;
    }

    public byte[] payload() {
        return payload.clone();
    }

    public String serviceName() {
        return serviceName;
    }

    public String url() {
        return url;
    }

    public List<String> partnerIds() {
        return partnerIds;
    }

    public String sessionId() {
        return sessionId;
    }

    public int qualityOfService() {
        return qualityOfService;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message)) {
            return false;
        }
        Message other = (Message) o;
        return typeCode == other.typeCode
                && qualityOfService == other.qualityOfService
                && Objects.equals(source, other.source)
                && Objects.equals(destination, other.destination)
                && Objects.equals(transactionUuid, other.transactionUuid)
                && Objects.equals(contentType, other.contentType)
                && Objects.equals(accept, other.accept)
                && Objects.equals(status, other.status)
                && Objects.equals(requestDeliveryResponse, other.requestDeliveryResponse)
                && headers.equals(other.headers)
                && metadata.equals(other.metadata)
                && Objects.equals(path, other.path)
                && Arrays.equals(payload, other.payload)
                && Objects.equals(serviceName, other.serviceName)
                && Objects.equals(url, other.url)
                && partnerIds.equals(other.partnerIds)
                && Objects.equals(sessionId, other.sessionId);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(typeCode, source, destination, transactionUuid, contentType, accept,
                status, requestDeliveryResponse, headers, metadata, path, serviceName, url, partnerIds,
                sessionId, qualityOfService);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Message{type=" + type().map(Enum::name).orElse(String.valueOf(typeCode))
                + (source != null ? ", source=" + source : "")
                + (destination != null ? ", dest=" + destination : "")
                + (transactionUuid != null ? ", transactionUuid=" + transactionUuid : "")
                + (serviceName != null ? ", serviceName=" + serviceName : "")
                + (url != null ? ", url=" + url : "")
                + (status != null ? ", status=" + status : "")
                + ", payload=" + payload.length + "B}";
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static List<String> copyOf(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static final class Builder {
        private int typeCode;
        private String source;
        private String destination;
        private String transactionUuid;
        private String contentType;
        private String accept;
        private Long status;
        private Long requestDeliveryResponse;
        private List<String> headers;
        private Map<String, String> metadata;
        private String path;
        private byte[] payload;
        private String serviceName;
        private String url;
        private List<String> partnerIds;
        private String sessionId;
        private int qualityOfService;

        private Builder() {
        }

        public Builder type(MessageType type) {
            this.typeCode = Objects.requireNonNull(type, "type").code();
            return this;
        }

        public Builder typeCode(int typeCode) {
            this.typeCode = typeCode;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder destination(String destination) {
            this.destination = destination;
            return this;
        }

        public Builder transactionUuid(String transactionUuid) {
            this.transactionUuid = transactionUuid;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder accept(String accept) {
            this.accept = accept;
            return this;
        }

        public Builder status(Long status) {
            this.status = status;
            return this;
        }

        public Builder requestDeliveryResponse(Long requestDeliveryResponse) {
            this.requestDeliveryResponse = requestDeliveryResponse;
            return this;
        }

        public Builder headers(List<String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder partnerIds(List<String> partnerIds) {
            this.partnerIds = partnerIds;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder qualityOfService(int qualityOfService) {
            this.qualityOfService = qualityOfService;
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }
}
