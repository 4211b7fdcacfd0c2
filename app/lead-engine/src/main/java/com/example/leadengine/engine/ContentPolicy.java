package com.example.leadengine.engine;

import java.util.List;

/** 禁止語句と上限値。プロセス全体で共有する不変値。 */
public record ContentPolicy(
    int maxItemsPerMessage, List<String> forbiddenPhrases, List<String> forbiddenVariableKeys) {

  public ContentPolicy {
    forbiddenPhrases = List.copyOf(forbiddenPhrases);
    forbiddenVariableKeys = List.copyOf(forbiddenVariableKeys);
  }
}
