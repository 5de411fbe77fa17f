package org.repcluster.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;
import java.util.Map;

/**
 * Series index translation backed by fastutil.
 * Immutable after construction and safe for concurrent readers.
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;
    // dense reverse lookup, index == series position
    private final String[] reverse;

    /**
     * @param mappings series name to position; positions must cover {@code [0, size)} exactly once.
     */
    public FastUtilIDMapper(Map<String, Integer> mappings) {
        if (mappings == null) {
            throw new IllegalArgumentException("series mappings cannot be null");
        }
        int size = mappings.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (Map.Entry<String, Integer> entry : mappings.entrySet()) {
            String key = entry.getKey();
            if (key == null) {
                throw new IllegalArgumentException("series names cannot be null");
            }
            int value = checkedIndex(entry.getValue(), size, reverse);
            this.forward.put(key, value);
            this.reverse[value] = key;
        }
        this.forward.trim();
    }

    static FastUtilIDMapper fromOrderedNames(List<String> orderedNames) {
        if (orderedNames == null) {
            throw new IllegalArgumentException("series names cannot be null");
        }
        Object2IntOpenHashMap<String> mappings = new Object2IntOpenHashMap<>(orderedNames.size());
        for (int i = 0; i < orderedNames.size(); i++) {
            String name = orderedNames.get(i);
            if (mappings.containsKey(name)) {
                throw new IllegalArgumentException("duplicate series name: " + name);
            }
            mappings.put(name, i);
        }
        return new FastUtilIDMapper(mappings);
    }

    private static int checkedIndex(Integer boxed, int size, String[] reverse) {
        if (boxed == null) {
            throw new IllegalArgumentException("series index cannot be null");
        }
        int value = boxed;
        if (value < 0 || value >= size) {
            throw new IllegalArgumentException(
                    "series indices must be dense in [0,size), found " + value
            );
        }
        if (reverse[value] != null) {
            throw new IllegalArgumentException(
                    "series index assigned twice: " + value
            );
        }
        return value;
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        int index = forward.getInt(externalId);
        if (index == MISSING) {
            throw new UnknownIDException("unknown series: " + externalId);
        }
        return index;
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("series index out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
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
