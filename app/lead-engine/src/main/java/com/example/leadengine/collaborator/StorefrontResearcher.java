/*
 * どこで: 外部コラボレータ境界
 * 何を: リードの Web サイトを調査してシグナルを返すインターフェース
 * なぜ: スクレイピングの実装をオーケストレータから切り離すため
 */
package com.example.leadengine.collaborator;

public interface StorefrontResearcher {

  /** 失敗は例外ではなく success=false の結果で返してよい。 */
  ResearchResult research(ResearchRequest request);
}
