package com.example.leadengine.model;

public enum ApprovalState {
  PENDING,
  APPROVED,
  REJECTED
}
