/*
 * どこで: Lead Engine 起動処理
 * 何を: レバレッジルール/商品カタログ/異議テンプレートを classpath の JSON から投入する
 * なぜ: 空の環境でもパイプラインが参照データ込みで動き出せるようにするため
 */
package com.example.leadengine.service;

import com.example.leadengine.config.CatalogProperties;
import com.example.leadengine.config.SeedProperties;
import com.example.leadengine.model.CatalogItem;
import com.example.leadengine.model.ItemSelectionQuery;
import com.example.leadengine.model.LeverageRule;
import com.example.leadengine.model.ObjectionTemplate;
import com.example.leadengine.repository.CatalogItemRepository;
import com.example.leadengine.repository.LeverageRuleRepository;
import com.example.leadengine.repository.ObjectionTemplateRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "leadengine.seed.enabled", havingValue = "true")
public class ReferenceDataSeeder implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(ReferenceDataSeeder.class);
  static final String LEVERAGE_RULES_FILE = "leverage_rules.json";
  static final String CATALOG_ITEMS_FILE = "catalog_items.json";
  static final String OBJECTION_TEMPLATES_FILE = "objection_templates.json";

  private final LeverageRuleRepository leverageRuleRepository;
  private final CatalogItemRepository catalogItemRepository;
  private final ObjectionTemplateRepository objectionTemplateRepository;
  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;
  private final SeedProperties seedProperties;
  private final CatalogProperties catalogProperties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  @Override
  public void run(ApplicationArguments args) {
    seed();
  }

  /** テーブルごとに、空のときだけ投入する。 */
  public void seed() {
    final Instant now = Instant.now(clock);
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              seedLeverageRules(now);
              seedCatalogItems(now);
              seedObjectionTemplates(now);
            });
  }

  private void seedLeverageRules(Instant now) {
    final int existing = leverageRuleRepository.count();
    if (existing > 0) {
      logger.info("leverage rules already seeded count={}", existing);
      return;
    }
    final List<RuleSeed> rules = load(LEVERAGE_RULES_FILE, new TypeReference<List<RuleSeed>>() {});
    rules.forEach(rule -> leverageRuleRepository.insert(rule.toRule(), now));
    logger.info("leverage rules seeded count={}", rules.size());
  }

  private void seedCatalogItems(Instant now) {
    final int existing = catalogItemRepository.count();
    if (existing > 0) {
      logger.info("catalog items already seeded count={}", existing);
      return;
    }
    final List<ItemSeed> items = load(CATALOG_ITEMS_FILE, new TypeReference<List<ItemSeed>>() {});
    items.forEach(
        item ->
            catalogItemRepository.insertIfAbsent(
                item.toItem(catalogProperties.priorityDiscountThreshold()), now));
    logger.info("catalog items seeded count={}", items.size());
  }

  private void seedObjectionTemplates(Instant now) {
    final int existing = objectionTemplateRepository.count();
    if (existing > 0) {
      logger.info("objection templates already seeded count={}", existing);
      return;
    }
    final List<TemplateSeed> templates =
        load(OBJECTION_TEMPLATES_FILE, new TypeReference<List<TemplateSeed>>() {});
    templates.forEach(template -> objectionTemplateRepository.insertIfAbsent(template.toTemplate(), now));
    logger.info("objection templates seeded count={}", templates.size());
  }

  private <T> List<T> load(String fileName, TypeReference<List<T>> type) {
    final Resource resource = resourceLoader.getResource(seedProperties.location() + fileName);
    if (!resource.exists()) {
      logger.warn("seed file not found location={}", resource.getDescription());
      return List.of();
    }
    try (InputStream in = resource.getInputStream()) {
      return objectMapper.readValue(in, type);
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read seed file " + fileName, ex);
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record RuleSeed(
      int priority,
      Boolean active,
      String channelMatch,
      Integer minScaleScore,
      Double maxPrivateLabelRatio,
      Integer minMapBehavior,
      Integer minStoreCount,
      boolean requiresBrandOverlap,
      boolean requiresAdjacentBrands,
      String primaryAngle,
      String secondaryAngle,
      ItemSelectionQuery selectionQuery,
      String description) {

    LeverageRule toRule() {
      return new LeverageRule(
          0L,
          priority,
          active == null || active,
          channelMatch,
          minScaleScore,
          maxPrivateLabelRatio,
          minMapBehavior,
          minStoreCount,
          requiresBrandOverlap,
          requiresAdjacentBrands,
          primaryAngle,
          secondaryAngle,
          selectionQuery,
          description);
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record ItemSeed(
      String name,
      List<String> categories,
      double discountPct,
      List<String> channelFit,
      boolean replenishable,
      Boolean priority,
      Boolean active) {

    // priority 未指定なら割引率から決める
    CatalogItem toItem(double priorityDiscountThreshold) {
      return new CatalogItem(
          0L,
          name,
          categories,
          discountPct,
          channelFit,
          replenishable,
          priority == null ? discountPct >= priorityDiscountThreshold : priority,
          active == null || active);
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record TemplateSeed(
      String objectionType, String templateSubject, String templateBody, Boolean active) {

    ObjectionTemplate toTemplate() {
      return new ObjectionTemplate(objectionType, templateSubject, templateBody, active == null || active);
    }
  }
}
