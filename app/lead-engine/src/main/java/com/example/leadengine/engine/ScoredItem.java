package com.example.leadengine.engine;

import com.example.leadengine.model.CatalogItem;

public record ScoredItem(CatalogItem item, int score) {}
