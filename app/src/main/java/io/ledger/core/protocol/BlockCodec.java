package io.ledger.core.protocol;

import io.ledger.core.exception.DecodeException;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

public final class BlockCodec {
    private BlockCodec(){}

    public static Block fromBytes(byte[] bytes) {
        return Codecs.decode("Block", () -> {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            BlockHeader header = BlockHeader.read(buf);

            int count = Codecs.readCount(buf, ProtocolLimits.MAX_TXS_PER_BLOCK, "tx");
            List<Transaction> txs = new ArrayList<>(Math.min(count, 1024));
            for (int i = 0; i < count; i++) {
                int len = buf.getInt();
                if (len < 0 || len > ProtocolLimits.MAX_TX_BYTES || len > buf.remaining()) {
                    throw new DecodeException("bad tx length: " + len);
                }
                byte[] txBytes = new byte[len];
                buf.get(txBytes);
                txs.add(TransactionCodec.fromBytes(txBytes));
            }
            Codecs.ensureConsumed(buf, "Block");
            return new Block(header, txs);
        });
    }
}
