package com.example.leadengine.service;

public record DeliveryEvent(
    DeliveryEventType type, String address, String providerMessageId, String replyText) {}
