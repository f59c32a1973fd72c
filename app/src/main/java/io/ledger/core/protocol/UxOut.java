package io.ledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * One unspent transaction output.
 *
 * Head (provenance): time and sequence of the block that created it.
 * Body (content): source transaction, owner address, coins and hours.
 *
 * - {@link #hash()} is SHA-256 of the body and identifies the record; it is the
 *   key under which the record is stored.
 * - {@link #snapshotHash()} is SHA-256(head || hash()) and is only used for the
 *   aggregate unspent checksum.
 *
 * Records are immutable: they are inserted once and deleted once.
 */
public final class UxOut {
    static final int HEAD_SIZE = 8 + 8;

    private final long time;
    private final long bkSeq;
    private final Hash srcTransaction;
    private final String address;
    private final long coins;
    private final long hours;

    private final Hash hash;
    private final Hash snapshotHash;

    public UxOut(long time, long bkSeq, Hash srcTransaction, String address, long coins, long hours) {
        this.time = time;
        this.bkSeq = bkSeq;
        this.srcTransaction = Objects.requireNonNull(srcTransaction, "srcTransaction");
        this.address = address;
        this.coins = coins;
        this.hours = hours;
        basicValidate();
        this.hash = Hash.of(bodyBytes());
        this.snapshotHash = new Hash(Hashes.sha256(headBytes(), hash.bytes()));
    }

    public long time() { return time; }
    public long bkSeq() { return bkSeq; }
    public Hash srcTransaction() { return srcTransaction; }
    public String address() { return address; }
    public long coins() { return coins; }
    public long hours() { return hours; }

    public Hash hash() { return hash; }
    public Hash snapshotHash() { return snapshotHash; }

    /** Deterministic encoding: head || body. */
    public byte[] serialize() {
        byte[] head = headBytes();
        byte[] body = bodyBytes();
        ByteBuffer buf = ByteBuffer.allocate(head.length + body.length);
        buf.put(head);
        buf.put(body);
        return Codecs.toArray(buf);
    }

    byte[] headBytes() {
        ByteBuffer buf = ByteBuffer.allocate(HEAD_SIZE);
        buf.putLong(time);
        buf.putLong(bkSeq);
        return Codecs.toArray(buf);
    }

    byte[] bodyBytes() {
        ByteBuffer buf = ByteBuffer.allocate(Hash.LENGTH + Codecs.stringSize(address) + 8 + 8);
        Codecs.writeHash(buf, srcTransaction);
        Codecs.writeString(buf, address);
        buf.putLong(coins);
        buf.putLong(hours);
        return Codecs.toArray(buf);
    }

    public void basicValidate() {
        if (address == null || address.isBlank()) throw new IllegalArgumentException("Missing address");
        if (address.length() > ProtocolLimits.MAX_ADDRESS_LEN) throw new IllegalArgumentException("Address too long");
        if (coins < 0) throw new IllegalArgumentException("coins must be >= 0");
        if (hours < 0) throw new IllegalArgumentException("hours must be >= 0");
        if (time < 0) throw new IllegalArgumentException("time must be >= 0");
        if (bkSeq < 0) throw new IllegalArgumentException("bkSeq must be >= 0");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UxOut)) return false;
        UxOut other = (UxOut) o;
        return time == other.time && bkSeq == other.bkSeq && hash.equals(other.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, bkSeq, hash);
    }

    @Override public String toString() {
        return "UxOut{" + hash + ", addr=" + address + ", coins=" + coins + ", hours=" + hours + ", seq=" + bkSeq + "}";
    }
}
