package io.ledger.core.unspent;

import io.ledger.core.exception.NotFoundException;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.UxOut;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory mirror of the output region plus the cached checksum.
 * Every access goes through the monitor of this object; nothing leaks the map.
 */
final class UnspentCache {

    private final Map<Hash, UxOut> pool = new HashMap<>();
    private Hash uxHash = Hash.ZERO;

    synchronized void reset(Map<Hash, UxOut> outputs, Hash checksum) {
        pool.clear();
        pool.putAll(outputs);
        uxHash = checksum;
    }

    synchronized Optional<UxOut> get(Hash id) {
        return Optional.ofNullable(pool.get(id));
    }

    /** Fails on the first id that is not cached. */
    synchronized List<UxOut> getArray(List<Hash> ids) {
        List<UxOut> out = new ArrayList<>(ids.size());
        for (Hash id : ids) {
            UxOut ux = pool.get(id);
            if (ux == null) {
                throw new NotFoundException(id);
            }
            out.add(ux);
        }
        return out;
    }

    synchronized List<UxOut> getAll() {
        return new ArrayList<>(pool.values());
    }

    synchronized int size() {
        return pool.size();
    }

    synchronized boolean contains(Hash id) {
        return pool.containsKey(id);
    }

    synchronized boolean collides(Collection<Hash> ids) {
        for (Hash id : ids) {
            if (pool.containsKey(id)) return true;
        }
        return false;
    }

    synchronized List<UxOut> forAddress(String address) {
        List<UxOut> out = new ArrayList<>();
        for (UxOut ux : pool.values()) {
            if (ux.address().equals(address)) out.add(ux);
        }
        return out;
    }

    synchronized Map<String, List<UxOut>> forAddresses(Collection<String> addresses) {
        Set<String> wanted = new HashSet<>(addresses);
        Map<String, List<UxOut>> out = new LinkedHashMap<>();
        for (UxOut ux : pool.values()) {
            if (wanted.contains(ux.address())) {
                out.computeIfAbsent(ux.address(), a -> new ArrayList<>()).add(ux);
            }
        }
        return out;
    }

    synchronized Hash uxHash() {
        return uxHash;
    }

    /** XOR of every cached snapshot hash; equals {@link #uxHash()} when consistent. */
    synchronized Hash recompute() {
        Hash acc = Hash.ZERO;
        for (UxOut ux : pool.values()) {
            acc = acc.xor(ux.snapshotHash());
        }
        return acc;
    }

    /** Batched mutation: remove, then insert, then set the checksum, all under one lock hold. */
    synchronized void apply(List<UxOut> remove, List<UxOut> add, Hash newUxHash) {
        for (UxOut ux : remove) {
            pool.remove(ux.hash());
        }
        for (UxOut ux : add) {
            pool.put(ux.hash(), ux);
        }
        uxHash = newUxHash;
    }
}
