package com.di.execmaps.codec;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * UUIDs are stored as 16 raw bytes, most significant half first. Identities are
 * only ever written and matched, never decoded.
 */
public final class UuidCodec {

    private UuidCodec() {
    }

    public static byte[] toBytes(UUID uuid) {
        if (uuid == null) {
            return null;
        }
        return ByteBuffer.allocate(16)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
    }
}
