package com.scholary.radio.recorder.recovery;

/** Counts from one startup recovery pass. */
public record RecoveryReport(
    int recurringArmed,
    int recurringSkipped,
    int oneTimeArmed,
    int oneTimeDiscarded,
    int interruptedExecutions) {}
