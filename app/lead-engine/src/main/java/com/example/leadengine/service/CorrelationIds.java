package com.example.leadengine.service;

import com.example.common.TraceIds;
import com.example.leadengine.config.RequestMdcInterceptor;
import org.slf4j.MDC;

/** MDC に載っている相関 ID を監査ログ用に取り出す。無ければ新規採番する。 */
public final class CorrelationIds {

  private CorrelationIds() {}

  public static String current() {
    return TraceIds.orNew(MDC.get(RequestMdcInterceptor.MDC_CORRELATION_ID));
  }
}
