package io.agentmail.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One typed entry of a message's ordered attachment list.
 *
 * @param id        stable identifier within the message
 * @param kind      how {@code pointer} is interpreted
 * @param pointer   repository-relative path, inline data URI, or URL depending on {@code kind}
 * @param mediaType optional MIME type
 * @param bytes     optional payload size
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Attachment(
        @JsonProperty("id") String id,
        @JsonProperty("kind") AttachmentKind kind,
        @JsonProperty("pointer") String pointer,
        @JsonProperty("media_type") String mediaType,
        @JsonProperty("bytes") Long bytes
) {
    public static Attachment file(String path, String mediaType) {
        return new Attachment(null, AttachmentKind.FILE, path, mediaType, null);
    }

    public static Attachment url(String url) {
        return new Attachment(null, AttachmentKind.URL, url, null, null);
    }

    public Attachment withId(String newId) {
        return new Attachment(newId, kind, pointer, mediaType, bytes);
    }
}
