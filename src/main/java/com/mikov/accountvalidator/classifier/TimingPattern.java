package com.mikov.accountvalidator.classifier;

public enum TimingPattern {
    RAPID,
    DELAYED,
    INSUFFICIENT_DATA
}
