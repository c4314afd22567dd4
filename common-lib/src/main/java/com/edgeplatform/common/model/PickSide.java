package com.edgeplatform.common.model;

public enum PickSide {
    HOME, AWAY, OVER, UNDER
}
