package org.repcluster.core.id;

import lombok.experimental.StandardException;

import java.util.List;
import java.util.Map;

/**
 * Bidirectional mapping contract between external profile names and dense series indices.
 */
public interface IDMapper {

    /**
     * Converts an external profile name to its dense series index.
     * @param externalId external profile name, e.g. {@code demand-Midgard_E_demand}.
     * @return The internal series index.
     * @throws UnknownIDException If the name is not found.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts a dense series index back to its external profile name.
     * @param internalId The internal series index.
     * @return The external profile name.
     * @throws IndexOutOfBoundsException If the internal ID is invalid.
     */
    String toExternal(int internalId);

    /**
     * Checks whether an external name has a mapped series index.
     *
     * @param externalId external name to test.
     * @return true when the external name is present.
     */
    boolean containsExternal(String externalId);

    /**
     * Checks whether a series index is within mapper bounds.
     *
     * @param internalId internal index to test.
     * @return true when the index is present.
     */
    boolean containsInternal(int internalId);

    /**
     * @return number of mapped series.
     */
    int size();

    /**
     * Exception thrown when an external name cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Factory method to create the default immutable implementation.
     *
     * @param mappings external name to dense index, indices in {@code [0, size)}.
     * @return An immutable IDMapper instance.
     */
    static IDMapper createImmutable(Map<String, Integer> mappings) {
        return new FastUtilIDMapper(mappings);
    }

    /**
     * Creates a mapper whose indices follow the order of the given names.
     *
     * @param orderedNames distinct external names; position becomes the internal index.
     * @return An immutable IDMapper instance.
     */
    static IDMapper fromOrderedNames(List<String> orderedNames) {
        return FastUtilIDMapper.fromOrderedNames(orderedNames);
    }
}
