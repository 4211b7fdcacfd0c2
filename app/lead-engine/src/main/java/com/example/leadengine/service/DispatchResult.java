package com.example.leadengine.service;

public record DispatchResult(int claimed, int sent, int paused, int failed) {}
