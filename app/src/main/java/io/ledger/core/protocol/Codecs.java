package io.ledger.core.protocol;

import io.ledger.core.exception.DecodeException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Small helpers shared by the record codecs.
 * Everything is big-endian: raw 32-byte hashes, length-prefixed UTF-8 strings, raw longs.
 */
public final class Codecs {
    private Codecs() {}

    public static int stringSize(String s) {
        return 4 + (s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length);
    }

    public static void writeString(ByteBuffer buf, String s) {
        byte[] b = s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
        buf.putInt(b.length);
        buf.put(b);
    }

    public static String readString(ByteBuffer buf, int maxLen) {
        int len = buf.getInt();
        if (len < 0 || len > maxLen || len > buf.remaining()) {
            throw new DecodeException("Bad string length: " + len + " (remaining=" + buf.remaining() + ")");
        }
        byte[] out = new byte[len];
        buf.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }

    public static void writeHash(ByteBuffer buf, Hash h) {
        buf.put(h.bytes());
    }

    public static Hash readHash(ByteBuffer buf) {
        byte[] out = new byte[Hash.LENGTH];
        buf.get(out);
        return new Hash(out);
    }

    public static int readCount(ByteBuffer buf, int max, String what) {
        int count = buf.getInt();
        if (count < 0 || count > max) {
            throw new DecodeException("bad " + what + " count: " + count);
        }
        return count;
    }

    public static byte[] toArray(ByteBuffer buf) {
        buf.flip();
        byte[] out = new byte[buf.remaining()];
        buf.get(out);
        return out;
    }

    public static void ensureConsumed(ByteBuffer buf, String what) {
        if (buf.hasRemaining()) {
            throw new DecodeException("Trailing " + buf.remaining() + " bytes after " + what);
        }
    }

    /** Runs a decode step, turning buffer and validation failures into DecodeException. */
    public static <T> T decode(String what, java.util.function.Supplier<T> reader) {
        try {
            return reader.get();
        } catch (DecodeException e) {
            throw e;
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new DecodeException("Malformed " + what + " bytes", e);
        }
    }
}
