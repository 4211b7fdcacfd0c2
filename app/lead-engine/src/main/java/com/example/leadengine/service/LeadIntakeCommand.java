package com.example.leadengine.service;

/** 取り込み 1 件分の入力。contactEmail 以外の任意項目は null を許す。 */
public record LeadIntakeCommand(
    String companyName,
    String websiteUrl,
    String contactEmail,
    String channel,
    String niche,
    String location,
    String notes) {}
