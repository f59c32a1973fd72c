package io.ledger.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple Merkle tree helper over hash leaves.
 * - If there are no leaves, root = 32 zero bytes.
 * - If odd count at a level, duplicate the last (Bitcoin-style) for simplicity.
 */
public final class Merkle {
    private Merkle(){}

    public static Hash rootOf(List<Hash> leaves) {
        if (leaves == null || leaves.isEmpty()) return Hash.ZERO;
        List<Hash> level = new ArrayList<>(leaves);
        while (level.size() > 1) {
            List<Hash> next = new ArrayList<>((level.size()+1)/2);
            for (int i=0; i<level.size(); i+=2) {
                Hash left = level.get(i);
                Hash right = (i+1 < level.size()) ? level.get(i+1) : left;
                next.add(new Hash(Hashes.sha256(left.bytes(), right.bytes())));
            }
            level = next;
        }
        return level.get(0);
    }
}
