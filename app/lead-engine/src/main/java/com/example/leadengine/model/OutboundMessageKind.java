package com.example.leadengine.model;

public enum OutboundMessageKind {
  SEQUENCE,
  REPLY_RESPONSE
}
