package com.example.leadengine.collaborator;

/** 構造化出力の読み取り結果。usedDefault が true なら value は既定値。 */
public record StructuredOutput<T>(T value, String callId, int attempts, boolean usedDefault) {}
