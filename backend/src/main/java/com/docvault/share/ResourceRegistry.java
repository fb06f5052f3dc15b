package com.docvault.share;

import reactor.core.publisher.Mono;

/** Knows whether a shared resource still exists. */
public interface ResourceRegistry {

    Mono<Boolean> exists(String resourceId);

    Mono<Void> markDeleted(String resourceId, String deletedBy);
}
