package com.mikov.accountvalidator.events;

import com.mikov.accountvalidator.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationEventPublisherTest {

    @Test
    void failingListenerDoesNotStopOthers() {
        final var received = new ArrayList<String>();
        final ValidationListener failing = new ValidationListener() {
            @Override
            public void onValidationStart(final String number) {
                throw new IllegalStateException("boom");
            }
        };
        final ValidationListener recording = new ValidationListener() {
            @Override
            public void onValidationStart(final String number) {
                received.add(number);
            }
        };
        final var publisher = new ValidationEventPublisher(List.of(failing, recording));

        publisher.validationStarted("123");

        assertThat(received).containsExactly("123");
    }

    @Test
    void includedListenerIsNotRegistered() {
        final var received = new ArrayList<String>();
        final var publisher = new ValidationEventPublisher(List.of());
        final ValidationListener extra = new ValidationListener() {
            @Override
            public void onBatchStart(final int total) {
                received.add("batch:" + total);
            }
        };

        publisher.including(extra).batchStarted(3);
        publisher.batchStarted(4);

        assertThat(received).containsExactly("batch:3");
    }

    @Test
    void removedListenerStopsReceiving() {
        final var received = new ArrayList<String>();
        final ValidationListener listener = new ValidationListener() {
            @Override
            public void onCacheHit(final String number, final ValidationResult result) {
                received.add(number);
            }
        };
        final var publisher = new ValidationEventPublisher(List.of());
        publisher.addListener(listener);
        publisher.cacheHit("1", ValidationResult.create("1", "1@s.whatsapp.net", 0));

        publisher.removeListener(listener);
        publisher.cacheHit("2", ValidationResult.create("2", "2@s.whatsapp.net", 0));

        assertThat(received).containsExactly("1");
    }
}
