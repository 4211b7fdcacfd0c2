package com.example.leadengine.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "leadengine.dispatch.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class OutboundDispatchWorker {

  private final OutboundDispatchService dispatchService;
  private final WorkerShutdownFlag shutdownFlag;

  @Scheduled(fixedDelayString = "${leadengine.dispatch.poll-interval}")
  public void run() {
    if (shutdownFlag.isStopping()) {
      return;
    }
    dispatchService.dispatchDue();
  }
}
