package com.mikov.accountvalidator.model;

import lombok.Data;

@Data
public class ReviewInfo {
    private boolean available;
    private ReviewType type = ReviewType.NONE;
    private String estimatedTime;

    ReviewInfo copy() {
        final var copy = new ReviewInfo();
        copy.available = available;
        copy.type = type;
        copy.estimatedTime = estimatedTime;
        return copy;
    }
}
