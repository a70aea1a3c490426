/*
 * どこで: Notification 設定のバリデーションテスト
 * 何を: NotificationAllocationProperties の Bean Validation を検証する
 * なぜ: 起動時に不正なリトライ/バックオフ設定を検出できるようにするため
 */
package com.inboxseq.notification.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationAllocationPropertiesValidationTest {

    private static final Duration BASE = Duration.ofMillis(5);
    private static final Duration MAX = Duration.ofMillis(200);

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void validationPassesWhenAllFieldsValid() {
        NotificationAllocationProperties properties =
                new NotificationAllocationProperties(16, BASE, MAX, 2.0d, 0.5d, 1.5d);

        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    void validationPassesWithZeroBackoff() {
        NotificationAllocationProperties properties =
                new NotificationAllocationProperties(1, Duration.ZERO, Duration.ZERO, 1.0d, 1.0d, 1.0d);

        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenMaxAttemptsIsZero() {
        NotificationAllocationProperties properties =
                new NotificationAllocationProperties(0, BASE, MAX, 2.0d, 0.5d, 1.5d);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenBackoffMaxBelowBase() {
        NotificationAllocationProperties properties =
                new NotificationAllocationProperties(16, MAX, BASE, 2.0d, 0.5d, 1.5d);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenJitterRangeInverted() {
        NotificationAllocationProperties properties =
                new NotificationAllocationProperties(16, BASE, MAX, 2.0d, 1.5d, 0.5d);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenExponentBelowOne() {
        NotificationAllocationProperties properties =
                new NotificationAllocationProperties(16, BASE, MAX, 0.5d, 0.5d, 1.5d);

        assertFalse(validator.validate(properties).isEmpty());
    }
}
