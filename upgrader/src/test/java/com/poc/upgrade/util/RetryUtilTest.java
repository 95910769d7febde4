package com.poc.upgrade.util;

import com.poc.upgrade.exception.MigrationFailedException;
import com.poc.upgrade.exception.VersionConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryUtil")
class RetryUtilTest {

    @Test
    @DisplayName("returns the first successful result")
    void returnsAfterRetry() {
        AtomicInteger calls = new AtomicInteger();

        String result = RetryUtil.executeWithRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new VersionConflictException(44, 45);
            }
            return "done";
        }, VersionConflictException.class, 3, 0, "test");

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("rethrows the last retryable failure when attempts run out")
    void exhaustsAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            throw new VersionConflictException(44, 40 + calls.incrementAndGet());
        }, VersionConflictException.class, 2, 0, "test"))
            .isInstanceOfSatisfying(VersionConflictException.class,
                e -> assertThat(e.getActualVersion()).isEqualTo(42));
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("does not retry other failures")
    void propagatesOtherFailures() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new MigrationFailedException(44, new IllegalStateException("bad"));
        }, VersionConflictException.class, 5, 0, "test"))
            .isInstanceOf(MigrationFailedException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("requires at least one attempt")
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> "x", VersionConflictException.class, 0, 0, "test"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
