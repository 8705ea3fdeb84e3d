package com.kotsin.portfolio.scheduler;

public enum SchedulerState {
    IDLE,
    WAITING_FOR_WAKE,
    FETCHING,
    COOLDOWN,   // momentary: failure recorded, next wake being computed
    PAUSED,     // portfolio missing upstream; waits for reconfiguration or a manual refresh
    STOPPED
}
