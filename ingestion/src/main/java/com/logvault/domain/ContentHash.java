package com.logvault.domain;

import java.nio.ByteBuffer;

public record ContentHash(long high, long low) {

    public static ContentHash of(byte[] digest) {
        if (digest.length != 16) {
            throw new IllegalArgumentException("Expected a 128-bit digest, got " + digest.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(digest);
        return new ContentHash(buffer.getLong(), buffer.getLong());
    }
}
