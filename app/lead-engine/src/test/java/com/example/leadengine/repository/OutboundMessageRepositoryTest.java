/*
 * どこで: Lead Engine リポジトリテスト
 * 何を: 送信メッセージの claim/lease と一時停止の対象範囲を検証する
 * なぜ: UPDATE ... RETURNING と SKIP LOCKED の挙動を Postgres 上で確かめるため
 */
package com.example.leadengine.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.leadengine.AbstractPostgresContainerTest;
import com.example.leadengine.Fixtures;
import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeadStatus;
import com.example.leadengine.model.OutboundMessage;
import com.example.leadengine.model.OutboundMessageKind;
import com.example.leadengine.model.OutboundMessageStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class OutboundMessageRepositoryTest extends AbstractPostgresContainerTest {

  private static final Duration LEASE = Duration.ofMinutes(2);

  @Autowired private OutboundMessageRepository outboundMessageRepository;
  @Autowired private LeadRepository leadRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private Lead lead;
  private final UUID sequenceId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    truncateAll(jdbcTemplate);
    lead = Fixtures.lead(UUID.randomUUID(), "https://acme.example", "buyer@shop.com", "retail", LeadStatus.CONTACTED);
    leadRepository.insertIfAbsent(lead);
  }

  @Test
  void claimDueTakesOnlyDueRenderedMessages() {
    final OutboundMessage due = insert(0, OutboundMessageKind.SEQUENCE, OutboundMessageStatus.RENDERED, Fixtures.NOW);
    insert(1, OutboundMessageKind.SEQUENCE, OutboundMessageStatus.RENDERED, Fixtures.NOW.plus(Duration.ofHours(24)));
    insert(2, OutboundMessageKind.SEQUENCE, OutboundMessageStatus.FAILED, Fixtures.NOW);

    final List<OutboundMessage> claimed =
        outboundMessageRepository.claimDue(10, Fixtures.NOW, Fixtures.NOW.plus(LEASE), "worker-1");

    assertThat(claimed).extracting(OutboundMessage::messageId).containsExactly(due.messageId());
    assertThat(claimed.get(0).status()).isEqualTo(OutboundMessageStatus.SENDING);
    assertThat(claimed.get(0).lockedBy()).isEqualTo("worker-1");
    assertThat(outboundMessageRepository.claimDue(10, Fixtures.NOW, Fixtures.NOW.plus(LEASE), "worker-2"))
        .isEmpty();
  }

  @Test
  void expiredLeaseIsReclaimed() {
    insert(0, OutboundMessageKind.SEQUENCE, OutboundMessageStatus.RENDERED, Fixtures.NOW);
    outboundMessageRepository.claimDue(10, Fixtures.NOW, Fixtures.NOW.plus(LEASE), "worker-1");

    final Instant later = Fixtures.NOW.plus(LEASE).plusSeconds(1);
    final List<OutboundMessage> reclaimed =
        outboundMessageRepository.claimDue(10, later, later.plus(LEASE), "worker-2");

    assertThat(reclaimed).hasSize(1);
    assertThat(reclaimed.get(0).lockedBy()).isEqualTo("worker-2");
  }

  @Test
  void markSentRequiresCurrentLease() {
    final OutboundMessage message =
        insert(0, OutboundMessageKind.SEQUENCE, OutboundMessageStatus.RENDERED, Fixtures.NOW);
    outboundMessageRepository.claimDue(10, Fixtures.NOW, Fixtures.NOW.plus(LEASE), "worker-1");

    assertThat(
            outboundMessageRepository.markSent(
                message.messageId(), "local", "c-1", "prov-1", Fixtures.NOW, "worker-2"))
        .isZero();
    assertThat(
            outboundMessageRepository.markSent(
                message.messageId(), "local", "c-1", "prov-1", Fixtures.NOW, "worker-1"))
        .isEqualTo(1);
    assertThat(outboundMessageRepository.findByProviderMessageId("prov-1"))
        .get()
        .extracting(OutboundMessage::status)
        .isEqualTo(OutboundMessageStatus.SENT);
  }

  @Test
  void pauseLeavesSentAndReplyMessagesAlone() {
    final OutboundMessage rendered =
        insert(1, OutboundMessageKind.SEQUENCE, OutboundMessageStatus.RENDERED, Fixtures.NOW);
    final OutboundMessage sent =
        insert(0, OutboundMessageKind.SEQUENCE, OutboundMessageStatus.SENT, Fixtures.NOW);
    final OutboundMessage reply =
        insert(0, OutboundMessageKind.REPLY_RESPONSE, OutboundMessageStatus.RENDERED, Fixtures.NOW);

    final int paused = outboundMessageRepository.pauseActiveSequence(List.of(lead.leadId()), Fixtures.NOW);

    assertThat(paused).isEqualTo(1);
    assertThat(statusOf(rendered)).isEqualTo(OutboundMessageStatus.PAUSED);
    assertThat(statusOf(sent)).isEqualTo(OutboundMessageStatus.SENT);
    assertThat(statusOf(reply)).isEqualTo(OutboundMessageStatus.RENDERED);
  }

  @Test
  void pauseStopsExpiredLeaseButNotLiveLease() {
    final OutboundMessage message =
        insert(0, OutboundMessageKind.SEQUENCE, OutboundMessageStatus.RENDERED, Fixtures.NOW);
    outboundMessageRepository.claimDue(10, Fixtures.NOW, Fixtures.NOW.plus(LEASE), "worker-1");

    assertThat(outboundMessageRepository.pauseActiveSequence(List.of(lead.leadId()), Fixtures.NOW))
        .isZero();
    assertThat(statusOf(message)).isEqualTo(OutboundMessageStatus.SENDING);

    final Instant later = Fixtures.NOW.plus(LEASE).plusSeconds(1);
    assertThat(outboundMessageRepository.pauseActiveSequence(List.of(lead.leadId()), later))
        .isEqualTo(1);
    assertThat(statusOf(message)).isEqualTo(OutboundMessageStatus.PAUSED);
    assertThat(outboundMessageRepository.claimDue(10, later, later.plus(LEASE), "worker-2"))
        .isEmpty();
  }

  private OutboundMessageStatus statusOf(OutboundMessage message) {
    return outboundMessageRepository.findByLeadId(lead.leadId()).stream()
        .filter(m -> m.messageId().equals(message.messageId()))
        .findFirst()
        .orElseThrow()
        .status();
  }

  private OutboundMessage insert(
      int touchIndex, OutboundMessageKind kind, OutboundMessageStatus status, Instant scheduledAt) {
    final OutboundMessage message =
        new OutboundMessage(
            UUID.randomUUID(),
            lead.leadId(),
            kind == OutboundMessageKind.SEQUENCE ? sequenceId : null,
            touchIndex,
            kind,
            null,
            lead.contactEmail(),
            "subject " + touchIndex,
            "body",
            status,
            scheduledAt,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            Fixtures.NOW);
    outboundMessageRepository.insert(message, Fixtures.NOW);
    return message;
  }
}
