package com.hoopstats.domain.model;

/**
 * Player identity exactly as a source reported it. Not yet canonicalized.
 */
public record RawEntityKey(String name, String team, int season) {
}
