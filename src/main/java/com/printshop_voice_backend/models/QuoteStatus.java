package com.printshop_voice_backend.models;

public enum QuoteStatus {
    DRAFT,
    SENT,
    APPROVED,
    REJECTED,
    EXPIRED,
    CONVERTED
}
