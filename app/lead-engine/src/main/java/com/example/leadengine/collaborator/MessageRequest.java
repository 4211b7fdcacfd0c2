package com.example.leadengine.collaborator;

import java.util.List;

public record MessageRequest(
    String companyName,
    String niche,
    String angle,
    int touchIndex,
    List<String> itemNames,
    String siteExcerpt,
    List<String> categories) {

  public MessageRequest {
    itemNames = itemNames == null ? List.of() : List.copyOf(itemNames);
    categories = categories == null ? List.of() : List.copyOf(categories);
  }
}
