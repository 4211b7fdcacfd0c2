/*
 * どこで: 外部コラボレータ境界
 * 何を: 調査コラボレータ未設定時の既定実装
 * なぜ: 外部接続なしでもパイプラインが既定シグナルで進むようにするため
 */
package com.example.leadengine.collaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class UnconfiguredStorefrontResearcher implements StorefrontResearcher {

  private static final Logger logger = LoggerFactory.getLogger(UnconfiguredStorefrontResearcher.class);

  @Override
  public ResearchResult research(ResearchRequest request) {
    logger.info("research skipped; no researcher configured leadId={} url={}", request.leadId(), request.url());
    return ResearchResult.failed("storefront researcher is not configured");
  }
}
