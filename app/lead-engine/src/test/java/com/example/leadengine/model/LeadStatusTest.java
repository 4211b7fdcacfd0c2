package com.example.leadengine.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LeadStatusTest {

  @Test
  void forwardTransitionsFollowPipeline() {
    assertThat(LeadStatus.RESEARCHED.canTransitionFrom(LeadStatus.NEW)).isTrue();
    assertThat(LeadStatus.QUALIFIED.canTransitionFrom(LeadStatus.RESEARCHED)).isTrue();
    assertThat(LeadStatus.CONTACTED.canTransitionFrom(LeadStatus.QUALIFIED)).isTrue();
    assertThat(LeadStatus.INTERESTED.canTransitionFrom(LeadStatus.OBJECTION)).isTrue();
  }

  @Test
  void backwardAndSkippingTransitionsAreRejected() {
    assertThat(LeadStatus.RESEARCHED.canTransitionFrom(LeadStatus.QUALIFIED)).isFalse();
    assertThat(LeadStatus.CONTACTED.canTransitionFrom(LeadStatus.NEW)).isFalse();
    assertThat(LeadStatus.OBJECTION.canTransitionFrom(LeadStatus.INTERESTED)).isFalse();
  }

  @Test
  void deadIsReachableFromEveryOtherStateButNotItself() {
    for (LeadStatus status : LeadStatus.values()) {
      assertThat(LeadStatus.DEAD.canTransitionFrom(status)).isEqualTo(status != LeadStatus.DEAD);
    }
  }

  @Test
  void terminalStatesCannotAdvance() {
    assertThat(LeadStatus.BOOKED.canTransitionFrom(LeadStatus.DISQUALIFIED)).isFalse();
    assertThat(LeadStatus.INTERESTED.canTransitionFrom(LeadStatus.BOOKED)).isFalse();
    assertThat(LeadStatus.DISQUALIFIED.isTerminal()).isTrue();
    assertThat(LeadStatus.CONTACTED.isTerminal()).isFalse();
  }

  @Test
  void auditEventAcceptsLegacyItemMatchedName() {
    assertThat(AuditEvent.fromValue("brand_matched")).isEqualTo(AuditEvent.ITEM_MATCHED);
    assertThat(AuditEvent.fromValue("JOB_STARTED")).isEqualTo(AuditEvent.JOB_STARTED);
  }
}
