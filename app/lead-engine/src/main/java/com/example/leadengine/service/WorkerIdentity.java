/*
 * どこで: Lead Engine サービス層
 * 何を: claim 時に locked_by へ記録するワーカー名を解決する
 * なぜ: どのプロセスがジョブや送信を握っているかを DB から追えるようにするため
 */
package com.example.leadengine.service;

import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class WorkerIdentity {

  private static final Logger logger = LoggerFactory.getLogger(WorkerIdentity.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final String lockedBy;

  public WorkerIdentity() {
    this.lockedBy = resolve(System.getenv(HOSTNAME_ENV));
  }

  public String lockedBy() {
    return lockedBy;
  }

  @VisibleForTesting
  static String resolve(String env) {
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
