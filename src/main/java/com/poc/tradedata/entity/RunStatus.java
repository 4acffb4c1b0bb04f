package com.poc.tradedata.entity;

public enum RunStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED
}
