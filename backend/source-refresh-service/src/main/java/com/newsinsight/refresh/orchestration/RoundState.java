package com.newsinsight.refresh.orchestration;

public enum RoundState {
    IDLE,
    RUNNING
}
