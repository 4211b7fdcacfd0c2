package com.example.leadengine.service;

import com.example.leadengine.model.CatalogItem;
import com.example.leadengine.model.LeverageAssignment;
import com.example.leadengine.repository.CatalogItemRepository;
import com.example.leadengine.repository.LeverageAssignmentRepository;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 割り当て済み商品 ID を選定順のまま商品名へ引き直す。 */
@Component
@RequiredArgsConstructor
public class SelectedItemNames {

  private final LeverageAssignmentRepository leverageAssignmentRepository;
  private final CatalogItemRepository catalogItemRepository;

  public List<String> forLead(UUID leadId) {
    return leverageAssignmentRepository
        .findByLeadId(leadId)
        .map(LeverageAssignment::selectedItemIds)
        .map(this::names)
        .orElse(List.of());
  }

  public List<String> names(List<Long> itemIds) {
    if (itemIds.isEmpty()) {
      return List.of();
    }
    final Map<Long, CatalogItem> byId =
        catalogItemRepository.findByIds(itemIds).stream()
            .collect(Collectors.toMap(CatalogItem::itemId, Function.identity()));
    return itemIds.stream().filter(byId::containsKey).map(id -> byId.get(id).name()).toList();
  }
}
