package io.ledger.core.protocol;

import java.nio.ByteBuffer;

public final class UxOutCodec {
    private UxOutCodec(){}

    public static byte[] toBytes(UxOut ux) {
        return ux.serialize();
    }

    /** Inverse of {@link UxOut#serialize()}; rejects truncated or trailing input. */
    public static UxOut fromBytes(byte[] bytes) {
        return Codecs.decode("UxOut", () -> {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            UxOut ux = read(buf);
            Codecs.ensureConsumed(buf, "UxOut");
            return ux;
        });
    }

    static UxOut read(ByteBuffer buf) {
        long time = buf.getLong();
        long bkSeq = buf.getLong();
        Hash src = Codecs.readHash(buf);
        String address = Codecs.readString(buf, ProtocolLimits.MAX_ADDRESS_LEN * 4);
        long coins = buf.getLong();
        long hours = buf.getLong();
        return new UxOut(time, bkSeq, src, address, coins, hours);
    }
}
