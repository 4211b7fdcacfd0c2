/*
 * どこで: Lead Engine キューワーカー
 * 何を: スケジュールで調査ジョブの消化を起動する
 * なぜ: 取り込まれたリードを一定間隔でパイプラインに流すため
 */
package com.example.leadengine.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "leadengine.queue.enabled", havingValue = "true", matchIfMissing = true)
public class LeadQueueWorker {

  private final LeadQueueDrainService drainService;

  @Scheduled(fixedDelayString = "${leadengine.queue.poll-interval}")
  public void run() {
    drainService.drain();
  }
}
