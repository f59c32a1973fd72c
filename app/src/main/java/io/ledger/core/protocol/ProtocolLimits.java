package io.ledger.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_ADDRESS_LEN = 128;         // sanity cap
    public static final int MAX_INPUTS_PER_TX = 4_096;
    public static final int MAX_OUTPUTS_PER_TX = 4_096;
    public static final int MAX_TXS_PER_BLOCK = 1_000_000;
    public static final int MAX_TX_BYTES = 16_000_000;
}
