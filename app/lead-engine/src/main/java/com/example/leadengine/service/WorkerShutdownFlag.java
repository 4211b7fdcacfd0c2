/*
 * どこで: Lead Engine サービス層
 * 何を: アプリ停止の開始をワーカーへ知らせるフラグ
 * なぜ: 停止中は新しいジョブを claim せず、処理中のリードだけを完了させるため
 */
package com.example.leadengine.service;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
public class WorkerShutdownFlag implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(WorkerShutdownFlag.class);

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean stopping = new AtomicBoolean(false);

  @Override
  public void start() {
    stopping.set(false);
    running.set(true);
  }

  @Override
  public void stop() {
    stopping.set(true);
    running.set(false);
    logger.info("worker shutdown requested; no new jobs will be claimed");
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  public boolean isStopping() {
    return stopping.get();
  }
}
