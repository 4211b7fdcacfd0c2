/*
 * どこで: Leverage ルールエンジン
 * 何を: ルールの各述語を宣言的に定義する
 * なぜ: 述語の追加をエンジン本体に触れずに行えるようにするため
 */
package com.example.leadengine.engine;

import com.example.leadengine.model.LeverageRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public enum RuleCondition {
  CHANNEL {
    @Override
    boolean appliesTo(LeverageRule rule) {
      return rule.channelMatch() != null && !rule.channelMatch().isBlank();
    }

    @Override
    boolean holds(LeverageRule rule, LeadProfile profile) {
      return profile.channel() != null && rule.channelMatch().equalsIgnoreCase(profile.channel().trim());
    }
  },
  MIN_SCALE_SCORE {
    @Override
    boolean appliesTo(LeverageRule rule) {
      return rule.minScaleScore() != null;
    }

    @Override
    boolean holds(LeverageRule rule, LeadProfile profile) {
      return profile.scaleScore() >= rule.minScaleScore();
    }
  },
  MAX_PRIVATE_LABEL_RATIO {
    @Override
    boolean appliesTo(LeverageRule rule) {
      return rule.maxPrivateLabelRatio() != null;
    }

    @Override
    boolean holds(LeverageRule rule, LeadProfile profile) {
      return profile.privateLabelRatio() <= rule.maxPrivateLabelRatio();
    }
  },
  MIN_MAP_BEHAVIOR {
    @Override
    boolean appliesTo(LeverageRule rule) {
      return rule.minMapBehavior() != null;
    }

    @Override
    boolean holds(LeverageRule rule, LeadProfile profile) {
      return profile.mapBehaviorScore() >= rule.minMapBehavior();
    }
  },
  MIN_STORE_COUNT {
    @Override
    boolean appliesTo(LeverageRule rule) {
      return rule.minStoreCount() != null;
    }

    @Override
    boolean holds(LeverageRule rule, LeadProfile profile) {
      return profile.storeCount() >= rule.minStoreCount();
    }
  },
  BRAND_OVERLAP {
    @Override
    boolean appliesTo(LeverageRule rule) {
      return rule.requiresBrandOverlap();
    }

    // 照合先のブランド一覧が存在しないため常に不成立とする
    @Override
    boolean holds(LeverageRule rule, LeadProfile profile) {
      logger.warn(
          "brand overlap predicate is not implemented; rule never matches ruleId={} priority={}",
          rule.ruleId(),
          rule.priority());
      return false;
    }
  },
  ADJACENT_BRANDS {
    @Override
    boolean appliesTo(LeverageRule rule) {
      return rule.requiresAdjacentBrands();
    }

    @Override
    boolean holds(LeverageRule rule, LeadProfile profile) {
      return !profile.brandList().isEmpty();
    }
  };

  private static final Logger logger = LoggerFactory.getLogger(RuleCondition.class);

  abstract boolean appliesTo(LeverageRule rule);

  abstract boolean holds(LeverageRule rule, LeadProfile profile);
}
