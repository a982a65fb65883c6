package com.ivamare.ordersession.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Nested
    @DisplayName("factories")
    class FactoryTests {

        @Test
        @DisplayName("should create default command policy")
        void shouldCreateDefaultPolicy() {
            RetryPolicy policy = RetryPolicy.defaultPolicy();

            assertEquals(5, policy.maxAttempts());
            assertEquals(List.of(10L, 25L, 50L, 100L), policy.backoffScheduleMs());
            assertEquals(0.5, policy.jitter());
        }

        @Test
        @DisplayName("should create policy with a single attempt")
        void shouldCreateNoRetryPolicy() {
            RetryPolicy policy = RetryPolicy.noRetry();

            assertEquals(1, policy.maxAttempts());
            assertFalse(policy.shouldRetry(1));
            assertEquals(0, policy.getBackoff(1));
        }

        @Test
        @DisplayName("should copy the backoff schedule")
        void shouldCopySchedule() {
            List<Long> schedule = new ArrayList<>(List.of(10L, 20L));
            RetryPolicy policy = new RetryPolicy(3, schedule, 0);

            schedule.add(30L);

            assertEquals(List.of(10L, 20L), policy.backoffScheduleMs());
            assertThrows(UnsupportedOperationException.class, () -> policy.backoffScheduleMs().add(1L));
        }

        @Test
        @DisplayName("should treat a null schedule as empty")
        void shouldAcceptNullSchedule() {
            RetryPolicy policy = new RetryPolicy(2, null, 0);

            assertTrue(policy.backoffScheduleMs().isEmpty());
        }

        @Test
        @DisplayName("should reject invalid arguments")
        void shouldRejectInvalidArguments() {
            assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, List.of(), 0));
            assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, List.of(), -0.1));
            assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, List.of(), 1.5));
        }
    }

    @Nested
    @DisplayName("backoff")
    class BackoffTests {

        private final RetryPolicy policy = new RetryPolicy(5, List.of(10L, 25L, 50L), 0);

        @Test
        @DisplayName("should follow the schedule attempt by attempt")
        void shouldFollowSchedule() {
            assertEquals(10, policy.getBackoff(1));
            assertEquals(25, policy.getBackoff(2));
            assertEquals(50, policy.getBackoff(3));
        }

        @Test
        @DisplayName("should repeat the last delay past the end of the schedule")
        void shouldRepeatLastDelay() {
            assertEquals(50, policy.getBackoff(4));
        }

        @Test
        @DisplayName("should return zero once attempts are exhausted")
        void shouldReturnZeroWhenExhausted() {
            assertEquals(0, policy.getBackoff(5));
            assertEquals(0, policy.getBackoff(6));
        }

        @Test
        @DisplayName("should fall back to a default delay when the schedule is empty")
        void shouldUseDefaultForEmptySchedule() {
            RetryPolicy empty = new RetryPolicy(3, List.of(), 0);

            assertEquals(50, empty.getBackoff(1));
        }

        @Test
        @DisplayName("should not jitter when jitter is zero")
        void shouldNotJitterWithoutJitter() {
            assertEquals(25, policy.getJitteredBackoff(2));
        }

        @Test
        @DisplayName("should keep jittered delays within the spread")
        void shouldKeepJitterWithinBounds() {
            RetryPolicy jittered = new RetryPolicy(5, List.of(100L), 0.5);

            for (int i = 0; i < 200; i++) {
                long delay = jittered.getJitteredBackoff(1);
                assertTrue(delay >= 50 && delay <= 150, "delay out of range: " + delay);
            }
            assertEquals(0, jittered.getJitteredBackoff(5));
        }
    }

    @Test
    @DisplayName("should allow retries until the last attempt")
    void shouldRetryUntilLastAttempt() {
        RetryPolicy policy = new RetryPolicy(3, List.of(10L), 0);

        assertTrue(policy.shouldRetry(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }
}
