package com.nyota.purchase.domain;

public enum GatewayOutcome {
    SUCCESS,
    FAILED
}
