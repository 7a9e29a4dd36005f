package com.shadows.core.catalog;

import com.shadows.core.model.Atmosphere;
import com.shadows.core.model.TileSet;

public record LocationOption(String name, TileSet tileSet, Atmosphere atmosphere) {}
