package com.warden.sandbox.relay;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A base64-encoded file sent along with a prompt.
 */
public record Attachment(
        @JsonProperty("type") String type,
        @JsonProperty("media_type") String mediaType,
        @JsonProperty("data") String data,
        @JsonProperty("filename") String filename
) {

    public static Attachment base64(String mediaType, String data, String filename) {
        return new Attachment("base64", mediaType, data, filename);
    }
}
