package org.rescuenet.core.id;

import lombok.experimental.StandardException;

/**
 * Bidirectional mapping contract between persisted long ids and dense internal integer indices.
 *
 * <p>Internal indices are scoped to one loaded subgraph and are rebuilt on every load.</p>
 */
public interface IDMapper {

    /**
     * Converts a persisted id to an internal index.
     * @param externalId The persisted node or edge id.
     * @return The internal integer index.
     * @throws UnknownIDException If the id is not mapped.
     */
    int toInternal(long externalId) throws UnknownIDException;

    /**
     * Converts an internal index back to the persisted id.
     * @param internalId The internal index.
     * @return The persisted id.
     * @throws IndexOutOfBoundsException If the internal index is invalid.
     */
    long toExternal(int internalId);

    /**
     * Checks whether a persisted id has a mapped internal index.
     *
     * @param externalId id to test.
     * @return true when the id is present.
     */
    boolean containsExternal(long externalId);

    /**
     * Checks whether an internal index is within mapper bounds.
     *
     * @param internalId internal index to test.
     * @return true when the index is present.
     */
    boolean containsInternal(int internalId);

    /**
     * Returns number of id pairs in the mapping.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when a persisted id cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates an immutable mapper that assigns internal indices in ascending order of the
     * persisted ids, so index order and id order agree.
     *
     * @param externalIds distinct persisted ids in any order.
     * @return An immutable IDMapper instance.
     */
    static IDMapper sortedOf(long[] externalIds) {
        return FastUtilIDMapper.sortedOf(externalIds);
    }
}
