package io.ledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.Objects;

/** Output declared by a transaction; becomes a {@link UxOut} once its block is applied. */
public final class TransactionOutput {
    private final String address;
    private final long coins;
    private final long hours;

    public TransactionOutput(String address, long coins, long hours) {
        this.address = address;
        this.coins = coins;
        this.hours = hours;
        if (address == null || address.isBlank()) throw new IllegalArgumentException("Missing output address");
        if (address.length() > ProtocolLimits.MAX_ADDRESS_LEN) throw new IllegalArgumentException("Address too long");
        if (coins < 0) throw new IllegalArgumentException("coins must be >= 0");
        if (hours < 0) throw new IllegalArgumentException("hours must be >= 0");
    }

    public String address() { return address; }
    public long coins() { return coins; }
    public long hours() { return hours; }

    int size() {
        return Codecs.stringSize(address) + 8 + 8;
    }

    void write(ByteBuffer buf) {
        Codecs.writeString(buf, address);
        buf.putLong(coins);
        buf.putLong(hours);
    }

    static TransactionOutput read(ByteBuffer buf) {
        String address = Codecs.readString(buf, ProtocolLimits.MAX_ADDRESS_LEN * 4);
        long coins = buf.getLong();
        long hours = buf.getLong();
        return new TransactionOutput(address, coins, hours);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof TransactionOutput)) return false;
        TransactionOutput other = (TransactionOutput) o;
        return coins == other.coins && hours == other.hours && address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, coins, hours);
    }
}
