package com.example.leadengine.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.leadengine.AbstractPostgresContainerTest;
import com.example.leadengine.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SuppressionRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private SuppressionRepository suppressionRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    truncateAll(jdbcTemplate);
  }

  @Test
  void addressIsStoredOnce() {
    assertThat(suppressionRepository.insertAddress("buyer@shop.com", "shop.com", "bounce", null, Fixtures.NOW))
        .isEqualTo(1);
    assertThat(suppressionRepository.insertAddress("buyer@shop.com", "shop.com", "manual", null, Fixtures.NOW))
        .isZero();

    assertThat(suppressionRepository.isSuppressed("buyer@shop.com", "shop.com")).isTrue();
    assertThat(suppressionRepository.isSuppressed("other@shop.com", "shop.com")).isFalse();
    assertThat(suppressionRepository.findRecent(10)).hasSize(1);
  }

  @Test
  void domainEntryCoversEveryAddressInDomain() {
    assertThat(suppressionRepository.insertDomain("shop.com", "manual", null, Fixtures.NOW)).isEqualTo(1);
    assertThat(suppressionRepository.insertDomain("shop.com", "manual", null, Fixtures.NOW)).isZero();

    assertThat(suppressionRepository.isSuppressed("anyone@shop.com", "shop.com")).isTrue();
    assertThat(suppressionRepository.isSuppressed("anyone@other.com", "other.com")).isFalse();
  }
}
