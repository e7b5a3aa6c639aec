package com.mikov.accountvalidator.probe;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ProbeType {
    STATUS("status", 1),
    PROFILE_PICTURE("profile_picture", 2),
    BUSINESS_PROFILE("business_profile", 3),
    PRESENCE("presence", 4);

    private final String probeName;
    private final int priority;
}
