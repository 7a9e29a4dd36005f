package com.shadows.core.catalog;

public record QuestItemDefinition(String name, String description) {}
