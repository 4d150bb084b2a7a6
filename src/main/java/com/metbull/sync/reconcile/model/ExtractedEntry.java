package com.metbull.sync.reconcile.model;

public record ExtractedEntry(long externalId, String rawName) {
}
