package com.mikov.accountvalidator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BanInfo {
    private boolean banned;
    private BanType type = BanType.NONE;
    private List<String> detectionMethods = new ArrayList<>();
    private Double mlConfidence;

    public void addDetectionMethod(final String method) {
        detectionMethods.add(method);
    }

    BanInfo copy() {
        final var copy = new BanInfo();
        copy.banned = banned;
        copy.type = type;
        copy.detectionMethods = new ArrayList<>(detectionMethods);
        copy.mlConfidence = mlConfidence;
        return copy;
    }
}
