package org.rescuenet.core.id;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

import java.util.Arrays;

/**
 * IDMapper backed by fastutil primitive collections.
 * This class is immutable and thread-safe for concurrent reads.
 */
public class FastUtilIDMapper implements IDMapper {

    // fastutil map for long -> int (forward lookup), no boxing
    private final Long2IntOpenHashMap forward;
    // internal index -> persisted id
    private final long[] reverse;

    /**
     * Constructs the mapper from a dense reverse table: {@code reverse[i]} is the persisted
     * id for internal index {@code i}.
     */
    public FastUtilIDMapper(long[] reverse) {
        if (reverse == null) {
            throw new IllegalArgumentException("Mappings cannot be null");
        }
        this.reverse = reverse.clone();
        this.forward = new Long2IntOpenHashMap(reverse.length);
        this.forward.defaultReturnValue(-1);

        for (int i = 0; i < this.reverse.length; i++) {
            int previous = this.forward.put(this.reverse[i], i);
            if (previous != -1) {
                throw new IllegalArgumentException(
                        "Duplicate external id detected in input: " + this.reverse[i]
                );
            }
        }
        this.forward.trim();
    }

    static FastUtilIDMapper sortedOf(long[] externalIds) {
        if (externalIds == null) {
            throw new IllegalArgumentException("Mappings cannot be null");
        }
        long[] sorted = externalIds.clone();
        Arrays.sort(sorted);
        return new FastUtilIDMapper(sorted);
    }

    @Override
    public int toInternal(long externalId) throws UnknownIDException {
        int id = forward.get(externalId);
        if (id == -1) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public long toExternal(int internalId) {
        if (internalId < 0 || internalId >= reverse.length) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(long externalId) {
        return forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
