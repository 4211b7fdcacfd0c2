package com.example.leadengine.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class CatalogItemTest {

  @Test
  void nullCategoryAndChannelEntriesAreDropped() {
    final CatalogItem item =
        new CatalogItem(
            1L,
            "Northwind Kitchen",
            Arrays.asList(null, "Home", null),
            40,
            Arrays.asList("retail", null),
            true,
            true,
            true);

    assertThat(item.categories()).containsExactly("Home");
    assertThat(item.channelFit()).containsExactly("retail");
    assertThat(item.primaryCategory()).isEqualTo("home");
  }

  @Test
  void missingListsBecomeEmptyAndPrimaryCategoryDefaults() {
    final CatalogItem item = new CatalogItem(2L, "Alder", null, 10, null, false, false, true);

    assertThat(item.categories()).isEmpty();
    assertThat(item.channelFit()).isEmpty();
    assertThat(item.primaryCategory()).isEqualTo("general");
  }
}
