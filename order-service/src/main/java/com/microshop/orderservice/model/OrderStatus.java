package com.microshop.orderservice.model;

// Orders are only ever created; no transition out of PENDING exists yet.
public enum OrderStatus {
    PENDING
}
