package com.example.leadengine.collaborator;

/**
 * 調査シグナルを正規化する分類器。失敗時も例外ではなく既定値を返す。
 */
public interface LeadClassifier {

  ClassificationOutcome classify(ClassificationInput input, String companyName, String niche);
}
