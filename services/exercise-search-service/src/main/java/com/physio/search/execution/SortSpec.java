package com.physio.search.execution;

import com.physio.search.query.SortOrder;
import java.util.List;

/**
 * Ordered sort keys, most significant first.
 */
public record SortSpec(List<Key> keys) {
    public SortSpec {
        keys = List.copyOf(keys);
    }

    public static SortSpec of(Key... keys) {
        return new SortSpec(List.of(keys));
    }

    public static Key key(SortColumn column, SortOrder order) {
        return new Key(column, order);
    }

    public record Key(SortColumn column, SortOrder order) {}
}
