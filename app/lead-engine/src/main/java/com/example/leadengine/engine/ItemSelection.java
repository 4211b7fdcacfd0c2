package com.example.leadengine.engine;

import com.example.leadengine.model.CatalogItem;
import java.util.List;

public record ItemSelection(List<ScoredItem> selected, int candidatesFound, int cap) {

  public ItemSelection {
    selected = List.copyOf(selected);
  }

  public List<Long> selectedIds() {
    return selected.stream().map(scored -> scored.item().itemId()).toList();
  }

  public List<String> selectedNames() {
    return selected.stream().map(ScoredItem::item).map(CatalogItem::name).toList();
  }
}
