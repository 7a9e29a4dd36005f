package com.shadows.core.catalog;

import com.shadows.core.model.Difficulty;

/**
 * @param difficulty lowest difficulty at which this boss may appear
 */
public record BossConfig(String type, String name, String spawnMessage, Difficulty difficulty) {}
