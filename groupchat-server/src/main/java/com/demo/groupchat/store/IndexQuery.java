package com.demo.groupchat.store;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Equality query on a secondary index, optionally restricted to sort keys strictly
 * greater than {@code after}.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class IndexQuery {

    private final String index;
    private final String value;
    private final String after;

    public static IndexQuery on(String index, String value) {
        return new IndexQuery(index, value, null);
    }

    public IndexQuery after(String sortKeyExclusive) {
        return new IndexQuery(index, value, sortKeyExclusive);
    }

    public boolean accepts(String sortKey) {
        return after == null || sortKey.compareTo(after) > 0;
    }
}
