package io.ledger.core.protocol;

import java.nio.ByteBuffer;

public final class TransactionCodec {
    private TransactionCodec(){}

    public static Transaction fromBytes(byte[] bytes) {
        return Codecs.decode("Transaction", () -> {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            Transaction tx = read(buf);
            Codecs.ensureConsumed(buf, "Transaction");
            return tx;
        });
    }

    static Transaction read(ByteBuffer buf) {
        Transaction.Builder b = Transaction.builder();
        int inCount = Codecs.readCount(buf, ProtocolLimits.MAX_INPUTS_PER_TX, "input");
        for (int i = 0; i < inCount; i++) {
            b.input(Codecs.readHash(buf));
        }
        int outCount = Codecs.readCount(buf, ProtocolLimits.MAX_OUTPUTS_PER_TX, "output");
        for (int i = 0; i < outCount; i++) {
            b.output(TransactionOutput.read(buf));
        }
        return b.build();
    }
}
