package com.example.leadengine.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.leadengine.Fixtures;
import com.example.leadengine.model.CatalogItem;
import com.example.leadengine.model.ItemSelectionQuery;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CatalogMatcherTest {

  private final CatalogMatcher matcher =
      new CatalogMatcher(new CatalogScoring(60.0, "amazon", "multi-channel", 2));

  @Test
  void selectsAtMostCapItemsPreferringChannelFit() {
    final List<CatalogItem> catalog =
        List.of(
            Fixtures.item(1, "A", "home", 50, List.of("retail"), true),
            Fixtures.item(2, "B", "outdoor", 50, List.of("amazon"), true),
            Fixtures.item(3, "C", "beauty", 65, List.of("multi-channel"), true),
            Fixtures.item(4, "D", "pet", 46, List.of("retail"), true));

    final ItemSelection selection =
        matcher.select(catalog, "retail", List.of(), new ItemSelectionQuery(true, 3));

    assertThat(selection.selectedNames()).containsExactly("C", "A", "D");
    assertThat(selection.candidatesFound()).isEqualTo(4);
  }

  @Test
  void primaryCategoryCapIsRespected() {
    final List<CatalogItem> catalog =
        List.of(
            Fixtures.item(1, "A", "home", 55, List.of("retail"), true),
            Fixtures.item(2, "B", "home", 54, List.of("retail"), true),
            Fixtures.item(3, "C", "home", 53, List.of("retail"), true),
            Fixtures.item(4, "D", "garden", 45, List.of(), true));

    final ItemSelection selection =
        matcher.select(catalog, "retail", List.of(), new ItemSelectionQuery(true, 3));

    assertThat(selection.selectedNames()).containsExactly("A", "B", "D");
  }

  @Test
  void nonPriorityItemsFillShortfallByDiscount() {
    final List<CatalogItem> catalog =
        List.of(
            Fixtures.item(1, "Priority", "home", 50, List.of(), true),
            Fixtures.item(2, "Low", "pet", 10, List.of(), false),
            Fixtures.item(3, "High", "tools", 30, List.of(), false));

    final ItemSelection selection =
        matcher.select(catalog, "retail", List.of(), new ItemSelectionQuery(true, 3));

    assertThat(selection.selectedNames()).containsExactly("Priority", "High", "Low");
  }

  @Test
  void categoryOverlapRaisesScore() {
    final CatalogItem item = Fixtures.item(1, "A", "kitchen", 20, List.of(), true);

    assertThat(matcher.score(item, "retail", Set.of("kitchen")))
        .isEqualTo(CatalogMatcher.CATEGORY_OVERLAP_POINTS);
  }

  @Test
  void zeroCapSelectsNothing() {
    final ItemSelection selection =
        matcher.select(
            List.of(Fixtures.item(1, "A", "home", 50, List.of(), true)),
            "retail",
            List.of(),
            new ItemSelectionQuery(true, 0));

    assertThat(selection.selected()).isEmpty();
  }

  @Test
  void randomCatalogsKeepSelectionBounds() {
    final Random random = new Random(42);
    final List<String> categoryPool = List.of("home", "pet", "beauty", "tools", "outdoor");
    final List<String> channelPool = List.of("retail", "amazon", "multi-channel", "wholesale");
    for (int round = 0; round < 200; round++) {
      final int size = round % 12;
      final List<CatalogItem> catalog = new ArrayList<>();
      for (int i = 0; i < size; i++) {
        catalog.add(
            new CatalogItem(
                i + 1,
                "item-" + i,
                List.of(categoryPool.get(random.nextInt(categoryPool.size()))),
                random.nextInt(80),
                List.of(channelPool.get(random.nextInt(channelPool.size()))),
                random.nextBoolean(),
                random.nextBoolean(),
                random.nextInt(5) > 0));
      }
      final int cap = random.nextInt(5);
      final String channel = channelPool.get(random.nextInt(channelPool.size()));
      final List<String> leadCategories = List.of(categoryPool.get(random.nextInt(categoryPool.size())));

      final ItemSelection selection =
          matcher.select(catalog, channel, leadCategories, new ItemSelectionQuery(true, cap));

      final List<ScoredItem> selected = selection.selected();
      assertThat(selected).hasSizeLessThanOrEqualTo(cap);
      assertThat(selected).allMatch(scored -> scored.item().active());
      assertThat(new HashSet<>(selection.selectedIds())).hasSameSizeAs(selected);
      final Map<String, Integer> perCategory = new HashMap<>();
      selected.forEach(scored -> perCategory.merge(scored.item().primaryCategory(), 1, Integer::sum));
      assertThat(perCategory.values()).allMatch(count -> count <= 2);
      assertRankedOrder(selected);
    }
  }

  @Test
  void emptyCatalogSelectsNothing() {
    final ItemSelection selection =
        matcher.select(List.of(), "retail", List.of("home"), new ItemSelectionQuery(true, 3));

    assertThat(selection.selected()).isEmpty();
    assertThat(selection.candidatesFound()).isZero();
  }

  // 優先商品は (score, discount) の降順で先に並び、補充分は割引率の降順で続く
  private static void assertRankedOrder(List<ScoredItem> selected) {
    boolean seenTopUp = false;
    for (int i = 0; i < selected.size(); i++) {
      final ScoredItem current = selected.get(i);
      if (!current.item().priority()) {
        seenTopUp = true;
      } else {
        assertThat(seenTopUp).as("priority item after top-up").isFalse();
      }
      if (i == 0) {
        continue;
      }
      final ScoredItem previous = selected.get(i - 1);
      if (previous.item().priority() == current.item().priority()) {
        assertThat(previous.score()).isGreaterThanOrEqualTo(current.score());
        if (previous.score() == current.score()) {
          assertThat(previous.item().discountPct())
              .isGreaterThanOrEqualTo(current.item().discountPct());
        }
      }
    }
  }
}
