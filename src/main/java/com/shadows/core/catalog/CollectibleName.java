package com.shadows.core.catalog;

public record CollectibleName(String key, String singular, String plural) {}
