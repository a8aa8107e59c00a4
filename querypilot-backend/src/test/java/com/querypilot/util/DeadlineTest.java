package com.querypilot.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.querypilot.error.ErrorKind;
import com.querypilot.error.QueryPilotException;

class DeadlineTest {

    private final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

    DeadlineTest() {
        executor.setCorePoolSize(2);
        executor.initialize();
    }

    @AfterEach
    void shutdown() {
        executor.shutdown();
    }

    @Test
    void slowCallIsCancelledWithTimeout() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        Deadline deadline = Deadline.after(Duration.ofMillis(100));

        assertThatThrownBy(() -> deadline.call("embedding", executor, () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return "late";
        }))
                .isInstanceOfSatisfying(QueryPilotException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT);
                    assertThat(e.getMessage()).startsWith("embedding");
                });
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void perCallLimitIsCappedByRemainingBudget() {
        Deadline deadline = Deadline.after(Duration.ofMillis(50));

        assertThat(deadline.capped(Duration.ofMinutes(1))).isLessThanOrEqualTo(Duration.ofMillis(50));
        assertThat(deadline.capped(Duration.ofMillis(1))).isEqualTo(Duration.ofMillis(1));
    }

    @Test
    void expiredDeadlineNeverStartsTheCall() {
        Deadline deadline = Deadline.after(Duration.ZERO);
        AtomicBoolean started = new AtomicBoolean();

        assertThatThrownBy(() -> deadline.call("execution", new TaskExecutorAdapter(Runnable::run), () -> {
            started.set(true);
            return 1;
        })).isInstanceOf(QueryPilotException.class);
        assertThat(started).isFalse();
        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remaining()).isZero();
    }

    @Test
    void failuresInsideTheCallPropagate() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(5));

        assertThatThrownBy(() -> deadline.call("retrieval", new TaskExecutorAdapter(Runnable::run), () -> {
            throw new IllegalStateException("store offline");
        })).isInstanceOf(IllegalStateException.class).hasMessage("store offline");
        assertThat(deadline.call("retrieval", new TaskExecutorAdapter(Runnable::run), () -> 42)).isEqualTo(42);
    }
}
