package com.example.leadengine.model;

public record ObjectionTemplate(
    String objectionType, String templateSubject, String templateBody, boolean active) {}
