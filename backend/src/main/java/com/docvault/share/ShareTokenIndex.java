package com.docvault.share;

/** Stored under the SHA-256 of a token so a token lookup does not scan every share. */
public record ShareTokenIndex(String shareId) {
}
