/*
 * どこで: 外部コラボレータ境界
 * 何を: 生成テキストサービスへの 1 往復の呼び出しを抽象化する
 * なぜ: 分類/文面生成から接続方式を切り離し、資格情報なしでも動かせるようにするため
 */
package com.example.leadengine.collaborator;

public interface GenerativeTextClient {

  boolean enabled();

  String complete(String prompt);
}
