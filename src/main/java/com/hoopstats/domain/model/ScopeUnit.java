package com.hoopstats.domain.model;

/**
 * Smallest retryable piece of a source fetch: one page, one team, one file.
 *
 * @param id       stable identifier used in logs and run errors
 * @param location adapter-specific address (URL, query string, resource path)
 */
public record ScopeUnit(String id, String location) {
}
