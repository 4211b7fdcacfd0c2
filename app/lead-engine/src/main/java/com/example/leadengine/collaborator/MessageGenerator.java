package com.example.leadengine.collaborator;

/** 1 タッチ分の件名と本文を作る。文面の妥当性はリンタ側で判定する。 */
public interface MessageGenerator {

  MessageDraft generate(MessageRequest request);
}
