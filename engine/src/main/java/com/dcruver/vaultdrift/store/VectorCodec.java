package com.dcruver.vaultdrift.store;

import com.dcruver.vaultdrift.domain.CacheCorruptionException;

import java.nio.ByteBuffer;

/**
 * Packs vectors into BLOB columns as big-endian IEEE-754 doubles.
 */
public final class VectorCodec {

    private VectorCodec() {
    }

    public static byte[] encode(double[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Double.BYTES);
        for (double v : vector) {
            buffer.putDouble(v);
        }
        return buffer.array();
    }

    /**
     * Decode a stored vector, checking it against the dimension recorded next to it.
     */
    public static double[] decode(byte[] blob, int expectedDimension, String owner) {
        if (blob == null) {
            throw new CacheCorruptionException("Missing vector for " + owner);
        }
        if (blob.length % Double.BYTES != 0 || blob.length / Double.BYTES != expectedDimension) {
            throw new CacheCorruptionException(String.format(
                "Vector for %s has %d bytes, expected %d dimensions", owner, blob.length, expectedDimension));
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob);
        double[] vector = new double[expectedDimension];
        for (int i = 0; i < expectedDimension; i++) {
            vector[i] = buffer.getDouble();
            if (!Double.isFinite(vector[i])) {
                throw new CacheCorruptionException("Non-finite component in vector for " + owner);
            }
        }
        return vector;
    }
}
