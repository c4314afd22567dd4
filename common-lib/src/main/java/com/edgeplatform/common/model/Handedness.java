package com.edgeplatform.common.model;

public enum Handedness {
    L, R
}
