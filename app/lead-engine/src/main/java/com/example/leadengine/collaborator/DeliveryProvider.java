/*
 * どこで: 外部コラボレータ境界
 * 何を: 送信プロバイダへの引き渡しを抽象化する
 * なぜ: プロバイダの違いを起動時の選択だけに閉じ込めるため
 */
package com.example.leadengine.collaborator;

public interface DeliveryProvider {

  /** provider 列に記録する識別子。 */
  String name();

  /** プロバイダ側の相関 ID を返す。失敗時は DeliveryException。 */
  String deliver(DeliveryRequest request);
}
