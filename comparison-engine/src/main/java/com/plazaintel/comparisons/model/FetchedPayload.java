package com.plazaintel.comparisons.model;

/**
 * Raw bytes of a downloaded period plus whatever hints the transport gave
 * about their format (content type, file name from the manifest).
 */
public record FetchedPayload(byte[] bytes, String contentType, String name) {

    public int size() {
        return bytes == null ? 0 : bytes.length;
    }
}
