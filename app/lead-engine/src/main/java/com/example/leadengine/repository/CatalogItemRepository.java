/*
 * どこで: Lead Engine データアクセス
 * 何を: catalog_items の読み出しと参照データ投入を担う
 * なぜ: マッチング実行時に有効商品を 1 回で取得するため
 */
package com.example.leadengine.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.leadengine.model.CatalogItem;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CatalogItemRepository {

  private static final String COLUMNS =
      """
      item_id, name, categories::text AS categories_text, discount_pct,
      channel_fit::text AS channel_fit_text, replenishable, priority, active
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumns jsonColumns;

  public List<CatalogItem> findActive() {
    final String sql = "SELECT " + COLUMNS + " FROM catalog_items WHERE active = TRUE ORDER BY item_id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<CatalogItem> findByIds(Collection<Long> itemIds) {
    if (itemIds.isEmpty()) {
      return List.of();
    }
    final String sql = "SELECT " + COLUMNS + " FROM catalog_items WHERE item_id IN (:itemIds)";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("itemIds", itemIds), this::mapRow);
  }

  /** name が既存なら 0 を返す。priority は投入時に割引率から決めた値を保存する。 */
  public int insertIfAbsent(CatalogItem item, Instant now) {
    final String sql =
        """
        INSERT INTO catalog_items (
          name, categories, discount_pct, channel_fit, replenishable, priority, active, created_at
        ) VALUES (
          :name, :categories::jsonb, :discountPct, :channelFit::jsonb, :replenishable, :priority,
          :active, :createdAt
        )
        ON CONFLICT (name) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", item.name())
            .addValue("categories", jsonColumns.write(item.categories()))
            .addValue("discountPct", item.discountPct())
            .addValue("channelFit", jsonColumns.write(item.channelFit()))
            .addValue("replenishable", item.replenishable())
            .addValue("priority", item.priority())
            .addValue("active", item.active())
            .addValue("createdAt", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int count() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM catalog_items", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private CatalogItem mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CatalogItem(
        rs.getLong("item_id"),
        rs.getString("name"),
        jsonColumns.readStrings(rs.getString("categories_text")),
        rs.getDouble("discount_pct"),
        jsonColumns.readStrings(rs.getString("channel_fit_text")),
        rs.getBoolean("replenishable"),
        rs.getBoolean("priority"),
        rs.getBoolean("active"));
  }
}
