package com.automagik.telemetry.transport.http;

/**
 * Request body ready to post.
 *
 * @param contentEncoding {@code gzip}, or {@code null} when the body is sent as-is
 */
public record CompressedPayload(byte[] body, String contentEncoding) {

    public boolean isCompressed() {
        return contentEncoding != null;
    }
}
