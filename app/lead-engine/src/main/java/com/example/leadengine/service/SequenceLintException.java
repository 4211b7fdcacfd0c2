package com.example.leadengine.service;

/** 変数セットのリント違反でシーケンスを作らなかった。ジョブはこのメッセージで失敗する。 */
public class SequenceLintException extends RuntimeException {

  public SequenceLintException(String message) {
    super(message);
  }
}
