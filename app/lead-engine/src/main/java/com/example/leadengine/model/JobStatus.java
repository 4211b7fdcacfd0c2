package com.example.leadengine.model;

public enum JobStatus {
  QUEUED,
  RUNNING,
  SUCCESS,
  FAILED
}
