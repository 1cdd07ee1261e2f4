package com.example.courtalert.model;

import java.time.Instant;

/** Snapshot handed to user-facing readers, flagged when the source could not be refreshed. */
public record CachedSnapshot(Snapshot snapshot, boolean stale, Instant lastRefreshedAt) {}
