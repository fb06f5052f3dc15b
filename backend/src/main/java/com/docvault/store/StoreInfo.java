package com.docvault.store;

import java.time.Instant;
import java.util.List;

/** Metadata view of a store's rows; never includes plaintext. */
public record StoreInfo(
        boolean initialized,
        int totalItems,
        int expiredItems,
        List<Item> items
) {

    public record Item(String key, int accessCount, Instant lastAccessedAt, Instant expiresAt) {}
}
