package com.safepocket.forecast.model;

public enum LinkType {
    PLANNED_OPERATION,
    BUDGET
}
