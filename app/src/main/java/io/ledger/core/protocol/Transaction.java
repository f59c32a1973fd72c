package io.ledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Spends a set of unspent outputs (inputs, by id) and declares new outputs.
 * Signatures and balance rules are checked before a transaction reaches the ledger.
 */
public final class Transaction {

    private final List<Hash> inputs;
    private final List<TransactionOutput> outputs;
    private final Hash hash;

    private Transaction(List<Hash> inputs, List<TransactionOutput> outputs) {
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        basicValidate();
        this.hash = Hash.of(serialize());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final List<Hash> inputs = new ArrayList<>();
        private final List<TransactionOutput> outputs = new ArrayList<>();

        public Builder input(Hash id) { this.inputs.add(id); return this; }
        public Builder inputs(List<Hash> ids) { this.inputs.addAll(ids); return this; }
        public Builder output(String address, long coins, long hours) {
            this.outputs.add(new TransactionOutput(address, coins, hours));
            return this;
        }
        public Builder output(TransactionOutput out) { this.outputs.add(out); return this; }

        public Transaction build() {
            return new Transaction(inputs, outputs);
        }
    }

    // -------------------- getters --------------------
    public List<Hash> inputs() { return inputs; }
    public List<TransactionOutput> outputs() { return outputs; }
    public Hash hash() { return hash; }

    // -------------------- core methods --------------------
    /** inputCount || input[i] (32 bytes each) || outputCount || output[i] */
    public byte[] serialize() {
        int size = 4 + inputs.size() * Hash.LENGTH + 4;
        for (TransactionOutput out : outputs) size += out.size();
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(inputs.size());
        for (Hash in : inputs) Codecs.writeHash(buf, in);
        buf.putInt(outputs.size());
        for (TransactionOutput out : outputs) out.write(buf);
        return Codecs.toArray(buf);
    }

    public void basicValidate() {
        if (inputs.size() > ProtocolLimits.MAX_INPUTS_PER_TX) throw new IllegalArgumentException("too many inputs");
        if (outputs.size() > ProtocolLimits.MAX_OUTPUTS_PER_TX) throw new IllegalArgumentException("too many outputs");
        if (inputs.isEmpty() && outputs.isEmpty()) throw new IllegalArgumentException("empty transaction");
    }

    @Override public String toString() {
        return "Transaction{" + hash + ", in=" + inputs.size() + ", out=" + outputs.size() + "}";
    }
}
