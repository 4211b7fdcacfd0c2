package com.example.leadengine.engine;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 生成前のテンプレート変数。extras には任意キーの追加変数が入る。
 */
public record MessageVariables(String companyName, List<String> itemNames, Map<String, String> extras) {

  public MessageVariables {
    itemNames =
        itemNames == null ? List.of() : itemNames.stream().filter(Objects::nonNull).toList();
    // キーか値が null の変数は渡されなかったものとして扱う
    extras =
        extras == null
            ? Map.of()
            : extras.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
  }
}
