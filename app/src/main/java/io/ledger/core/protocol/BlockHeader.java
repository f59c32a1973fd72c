package io.ledger.core.protocol;

import java.nio.ByteBuffer;

/**
 * Block header.
 * - version: header format version
 * - time: producer clock, copied into the head of every output the block creates
 * - seq: block number (genesis = 0), copied into every created output
 * - prevHash: link to previous block (zero for genesis)
 * - bodyHash: Merkle root over the transaction hashes
 * - uxHash: unspent checksum before this block's outputs were applied
 */
public final class BlockHeader {
    public static final int VERSION = 1;
    static final int SIZE = 4 + 8 + 8 + Hash.LENGTH * 3;

    private final int version;
    private final long time;
    private final long seq;
    private final Hash prevHash;
    private final Hash bodyHash;
    private final Hash uxHash;

    public BlockHeader(int version, long time, long seq, Hash prevHash, Hash bodyHash, Hash uxHash) {
        this.version = version;
        this.time = time;
        this.seq = seq;
        this.prevHash = prevHash != null ? prevHash : Hash.ZERO;
        this.bodyHash = bodyHash != null ? bodyHash : Hash.ZERO;
        this.uxHash = uxHash != null ? uxHash : Hash.ZERO;
        basicValidate();
    }

    public int version() { return version; }
    public long time() { return time; }
    public long seq() { return seq; }
    public Hash prevHash() { return prevHash; }
    public Hash bodyHash() { return bodyHash; }
    public Hash uxHash() { return uxHash; }

    public byte[] serialize() {
        ByteBuffer buf = ByteBuffer.allocate(SIZE);
        buf.putInt(version);
        buf.putLong(time);
        buf.putLong(seq);
        Codecs.writeHash(buf, prevHash);
        Codecs.writeHash(buf, bodyHash);
        Codecs.writeHash(buf, uxHash);
        return Codecs.toArray(buf);
    }

    public Hash hash() {
        return Hash.of(serialize());
    }

    public void basicValidate() {
        if (version != VERSION) throw new IllegalArgumentException("Unsupported header version: " + version);
        if (seq < 0) throw new IllegalArgumentException("seq must be >= 0");
        if (time < 0) throw new IllegalArgumentException("time must be >= 0");
    }

    static BlockHeader read(ByteBuffer buf) {
        int version = buf.getInt();
        long time = buf.getLong();
        long seq = buf.getLong();
        Hash prev = Codecs.readHash(buf);
        Hash body = Codecs.readHash(buf);
        Hash ux = Codecs.readHash(buf);
        return new BlockHeader(version, time, seq, prev, body, ux);
    }

    @Override public String toString() {
        return "BlockHeader{seq=" + seq + ", time=" + time + "}";
    }
}
