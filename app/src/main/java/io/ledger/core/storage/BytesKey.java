package io.ledger.core.storage;

import java.util.Arrays;

/** Value-based key wrapper around byte[] so we can use it in maps/sets. Orders like RocksDB's default comparator. */
final class BytesKey implements Comparable<BytesKey> {
    private final byte[] bytes;
    private final int hash; // cache hashCode

    BytesKey(byte[] src) {
        if (src == null) throw new IllegalArgumentException("null key");
        this.bytes = src.clone();
        this.hash = Arrays.hashCode(this.bytes);
    }

    byte[] bytes() {
        return bytes.clone();
    }

    @Override public int compareTo(BytesKey other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BytesKey)) return false;
        BytesKey other = (BytesKey) o;
        return Arrays.equals(this.bytes, other.bytes);
    }

    @Override public int hashCode() {
        return hash;
    }
}
