package com.docvault.share;

/** The parts of a {@code /shared/<id>?token=...} URL. */
public record ShareUrl(String shareId, String token, boolean passwordProtected) {
}
