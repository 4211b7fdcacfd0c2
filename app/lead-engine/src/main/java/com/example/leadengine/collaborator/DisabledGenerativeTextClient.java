/*
 * どこで: 外部コラボレータ境界
 * 何を: API キー未設定時に使う無効化クライアント
 * なぜ: 起動を止めずに既定出力へ縮退させるため
 */
package com.example.leadengine.collaborator;

public class DisabledGenerativeTextClient implements GenerativeTextClient {

  @Override
  public boolean enabled() {
    return false;
  }

  @Override
  public String complete(String prompt) {
    throw new GenerativeClientException("generative text client is disabled");
  }
}
