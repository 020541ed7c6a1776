package uk.gegc.planconfigurator.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FutureUtils")
class FutureUtilsTest {

    @Test
    @DisplayName("join rethrows the original runtime exception")
    void joinUnwraps() {
        CompletableFuture<String> failed = CompletableFuture.failedFuture(new IllegalArgumentException("bad"));

        assertThatThrownBy(() -> FutureUtils.join(failed))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad");
    }

    @Test
    @DisplayName("bounded join returns the value of a completed future")
    void boundedJoinReturnsValue() {
        assertThat(FutureUtils.join(CompletableFuture.completedFuture("done"), Duration.ofSeconds(1))).isEqualTo("done");
    }

    @Test
    @DisplayName("bounded join rethrows the original failure")
    void boundedJoinUnwraps() {
        CompletableFuture<String> failed = CompletableFuture.failedFuture(new IllegalArgumentException("bad"));

        assertThatThrownBy(() -> FutureUtils.join(failed, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad");
    }

    @Test
    @DisplayName("bounded join gives up on a future that never completes")
    void boundedJoinTimesOut() {
        CompletableFuture<String> pending = new CompletableFuture<>();

        assertThatThrownBy(() -> FutureUtils.join(pending, Duration.ofMillis(50)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("did not complete");
    }
}
