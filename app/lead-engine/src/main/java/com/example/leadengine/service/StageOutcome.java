package com.example.leadengine.service;

/** パイプライン各段の結果。STOPPED は後続段を打ち切りジョブを成功で閉じる。 */
public enum StageOutcome {
  CONTINUE,
  STOPPED
}
