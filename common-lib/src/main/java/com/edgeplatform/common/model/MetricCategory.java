package com.edgeplatform.common.model;

public enum MetricCategory {
    PITCHING, OFFENSE, DEFENSE, BULLPEN, CONTEXT, HEAD_TO_HEAD
}
