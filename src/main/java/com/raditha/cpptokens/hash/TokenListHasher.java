package com.raditha.cpptokens.hash;

import com.raditha.cpptokens.model.Token;

/**
 * Fingerprint of a token list for cheap equivalence checks.
 * <p>
 * Each token contributes its value and type flags; tokens are chained in list order
 * so that reordering changes the result. Source locations are not part of the hash.
 * This is not a cryptographic digest and collisions are possible.
 */
public final class TokenListHasher {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;
    private static final long SEED = 0x9e3779b97f4a7c15L;

    private TokenListHasher() {
    }

    public static long hash(Token front) {
        long h = SEED;
        for (Token tok = front; tok != null; tok = tok.next()) {
            long th = fnv1a(tok.str());
            th ^= (long) (tok.flags() & Token.TYPE_FLAGS) << 32;
            h = mix(h ^ th) + SEED;
        }
        return mix(h);
    }

    static long fnv1a(String s) {
        long h = FNV_OFFSET;
        for (int i = 0; i < s.length(); i++) {
            h ^= s.charAt(i);
            h *= FNV_PRIME;
        }
        return h;
    }

    // murmur3 finalizer
    static long mix(long value) {
        long h = value;
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }
}
