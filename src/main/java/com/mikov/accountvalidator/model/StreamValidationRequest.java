package com.mikov.accountvalidator.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * STOMP request: the numbers to validate and the client session whose topics
 * receive progress and results.
 */
@Getter
@Setter
@NoArgsConstructor
public class StreamValidationRequest {
    private String sessionId;
    private List<String> numbers;
}
