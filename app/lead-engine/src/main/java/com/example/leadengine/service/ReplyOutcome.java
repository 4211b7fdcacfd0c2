package com.example.leadengine.service;

import com.example.leadengine.model.ApprovalState;
import com.example.leadengine.model.ReplyAction;
import com.example.leadengine.model.ReplyClassification;
import java.util.UUID;

/** approval は下書きが無い場合 null。 */
public record ReplyOutcome(
    UUID replyId,
    UUID leadId,
    ReplyClassification classification,
    ReplyAction action,
    ApprovalState approval,
    boolean statusChanged,
    boolean responseQueued) {}
