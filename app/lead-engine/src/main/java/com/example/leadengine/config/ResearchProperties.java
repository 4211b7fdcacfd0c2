package com.example.leadengine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** 調査コラボレータへ渡す時間/ページ数の予算。 */
@ConfigurationProperties(prefix = "leadengine.research")
public record ResearchProperties(Duration budget, Integer maxPages) {

  public ResearchProperties {
    if (budget == null) {
      budget = Duration.ofSeconds(25);
    }
    if (maxPages == null) {
      maxPages = 6;
    }
  }
}
