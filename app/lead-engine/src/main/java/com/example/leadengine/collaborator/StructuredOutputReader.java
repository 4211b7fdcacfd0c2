/*
 * どこで: 外部コラボレータ境界
 * 何を: 生成テキストから厳密な JSON を読み取り、失敗時は 1 回だけ修正を依頼する
 * なぜ: 不正な出力でパイプラインを止めず、保守的な既定値に倒すため
 */
package com.example.leadengine.collaborator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.util.UUID;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StructuredOutputReader {

  private static final Logger logger = LoggerFactory.getLogger(StructuredOutputReader.class);
  static final String NO_API_KEY_CALL_ID = "no-api-key";
  private static final String CODE_FENCE = "```";

  private final GenerativeTextClient client;
  private final ObjectMapper objectMapper;

  public StructuredOutputReader(GenerativeTextClient client, ObjectMapper objectMapper) {
    this.client = client;
    this.objectMapper = objectMapper;
  }

  /**
   * 役割: prompt を送り type として読み取る。
   * 動作: 解析か検証に失敗したら修正プロンプトで 1 回だけ再依頼し、それでも失敗なら fallback を返す。
   * 前提: 呼び出し自体の失敗 (接続/HTTP) は修正せず即 fallback とする。
   */
  public <T> StructuredOutput<T> read(
      String prompt, String repairExample, Class<T> type, Predicate<T> valid, T fallback) {
    if (!client.enabled()) {
      return new StructuredOutput<>(fallback, NO_API_KEY_CALL_ID, 0, true);
    }
    final String callId = newCallId();
    final String raw;
    try {
      raw = client.complete(prompt);
    } catch (GenerativeClientException ex) {
      logger.warn("generative call failed; using default callId={} type={}", callId, type.getSimpleName(), ex);
      return new StructuredOutput<>(fallback, callId, 1, true);
    }
    final T parsed = parse(raw, type, valid);
    if (parsed != null) {
      return new StructuredOutput<>(parsed, callId, 1, false);
    }
    logger.info("generative output invalid; requesting repair callId={} type={}", callId, type.getSimpleName());
    final String repairPrompt =
        "Your previous output was not valid JSON:\n"
            + raw
            + "\n\nReturn ONLY valid JSON in this shape: "
            + repairExample;
    try {
      final T repaired = parse(client.complete(repairPrompt), type, valid);
      if (repaired != null) {
        return new StructuredOutput<>(repaired, callId, 2, false);
      }
    } catch (GenerativeClientException ex) {
      logger.warn("generative repair call failed callId={}", callId, ex);
    }
    logger.warn("generative output still invalid after repair; using default callId={}", callId);
    return new StructuredOutput<>(fallback, callId, 2, true);
  }

  @VisibleForTesting
  <T> T parse(String raw, Class<T> type, Predicate<T> valid) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    final String json = extractJson(raw.trim());
    try {
      final T value = objectMapper.readValue(json, type);
      return value != null && valid.test(value) ? value : null;
    } catch (JsonProcessingException ex) {
      logger.debug("structured output parse failed type={} message={}", type.getSimpleName(), ex.getOriginalMessage());
      return null;
    }
  }

  // コードフェンスや前後の説明文を取り除き、最初の { から最後の } までを JSON とみなす
  @VisibleForTesting
  static String extractJson(String text) {
    String candidate = text;
    if (candidate.contains(CODE_FENCE)) {
      for (String part : candidate.split(CODE_FENCE)) {
        final String stripped = part.startsWith("json") ? part.substring(4).trim() : part.trim();
        if (stripped.startsWith("{")) {
          candidate = stripped;
          break;
        }
      }
    }
    final int start = candidate.indexOf('{');
    final int end = candidate.lastIndexOf('}');
    if (start >= 0 && end > start) {
      return candidate.substring(start, end + 1);
    }
    return candidate;
  }

  private static String newCallId() {
    return "llm-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }
}
