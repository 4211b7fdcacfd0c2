package com.example.leadengine.api.response;

import java.time.Instant;

final class ApiTimes {

  private ApiTimes() {}

  static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
