package io.ledger.core.unspent;

import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.UxOut;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the unspent pool. Every call is answered from memory and
 * never touches the durable store.
 */
public interface UnspentGetter {

    /** Output with the given id, empty when not in the pool. */
    Optional<UxOut> get(Hash id);

    /**
     * Outputs for every id, in the order given.
     *
     * @throws io.ledger.core.exception.NotFoundException naming the first missing id
     */
    List<UxOut> getArray(List<Hash> ids);

    /** Snapshot of every output, in no particular order. */
    List<UxOut> getAll();

    int len();

    boolean contains(Hash id);

    /** True if any of the ids is already in the pool. */
    boolean collides(Collection<Hash> ids);

    List<UxOut> getUnspentsOfAddr(String address);

    /** Outputs grouped by owner; addresses without outputs are absent from the map. */
    Map<String, List<UxOut>> getUnspentsOfAddrs(Collection<String> addresses);

    /** Current aggregate checksum: XOR of all snapshot hashes. */
    Hash getUxHash();
}
