package com.example.leadengine.service;

import com.example.leadengine.model.Lead;
import com.example.leadengine.model.LeverageAssignment;
import com.example.leadengine.model.OutboundMessage;
import com.example.leadengine.model.Reply;
import com.example.leadengine.model.SignalSet;
import java.util.List;

/** signals と leverage はパイプライン未到達なら null。 */
public record LeadDetail(
    Lead lead,
    SignalSet signals,
    LeverageAssignment leverage,
    List<String> selectedItemNames,
    List<OutboundMessage> messages,
    List<Reply> replies) {}
