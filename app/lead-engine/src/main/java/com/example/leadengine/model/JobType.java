package com.example.leadengine.model;

public enum JobType {
  RESEARCH
}
