package com.example.leadengine.service;

public record DrainResult(int processed, int skipped, int failed) {}
