package com.driftsentinel.core.monitor;

import com.driftsentinel.core.config.OverflowPolicy;
import com.driftsentinel.core.model.ChangeEvent;
import com.driftsentinel.core.model.ChangeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChangeQueue}.
 */
class ChangeQueueTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("Should merge repeated changes to the same path into one batch entry")
    void shouldMergeDuplicatePaths() {
        ChangeQueue queue = new ChangeQueue(10, OverflowPolicy.BLOCK, Duration.ZERO);
        queue.offer(ChangeEvent.modified("src/a.py", NOW));
        queue.offer(ChangeEvent.modified("src/b.py", NOW));
        queue.offer(new ChangeEvent("src/a.py", ChangeKind.DELETED, NOW.plusSeconds(1)));

        List<ChangeEvent> batch = queue.drain(10);

        assertThat(batch).extracting(ChangeEvent::getPath).containsExactly("src/a.py", "src/b.py");
        assertThat(batch.get(0).getKind()).isEqualTo(ChangeKind.DELETED);
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("Should stop draining at the batch limit of distinct paths")
    void shouldRespectBatchLimit() {
        ChangeQueue queue = new ChangeQueue(10, OverflowPolicy.BLOCK, Duration.ZERO);
        for (String path : List.of("a", "b", "a", "c", "d")) {
            queue.offer(ChangeEvent.modified(path, NOW));
        }

        assertThat(queue.drain(2)).extracting(ChangeEvent::getPath).containsExactly("a", "b");
        assertThat(queue.drain(2)).extracting(ChangeEvent::getPath).containsExactly("c", "d");
    }

    @Test
    @DisplayName("Should evict the oldest change when full under DROP_OLDEST")
    void shouldDropOldestWhenFull() {
        ChangeQueue queue = new ChangeQueue(2, OverflowPolicy.DROP_OLDEST, Duration.ZERO);

        assertThat(queue.offer(ChangeEvent.modified("a", NOW))).isTrue();
        assertThat(queue.offer(ChangeEvent.modified("b", NOW))).isTrue();
        assertThat(queue.offer(ChangeEvent.modified("c", NOW))).isTrue();

        assertThat(queue.droppedCount()).isEqualTo(1);
        assertThat(queue.drain(10)).extracting(ChangeEvent::getPath).containsExactly("b", "c");
    }

    @Test
    @DisplayName("Should reject a change after the offer timeout under BLOCK")
    void shouldRejectWhenBlockedTooLong() {
        ChangeQueue queue = new ChangeQueue(1, OverflowPolicy.BLOCK, Duration.ofMillis(50));
        queue.offer(ChangeEvent.modified("a", NOW));

        assertThat(queue.offer(ChangeEvent.modified("b", NOW))).isFalse();
        assertThat(queue.droppedCount()).isEqualTo(1);
        assertThat(queue.drain(10)).extracting(ChangeEvent::getPath).containsExactly("a");
    }

    @Test
    @DisplayName("Should report a full batch without waiting")
    void shouldReturnImmediatelyForFullBatch() throws InterruptedException {
        ChangeQueue queue = new ChangeQueue(10, OverflowPolicy.BLOCK, Duration.ZERO);
        queue.offer(ChangeEvent.modified("a", NOW));
        queue.offer(ChangeEvent.modified("b", NOW));

        assertThat(queue.awaitBatch(2, Duration.ofMinutes(5))).isTrue();
    }

    @Test
    @DisplayName("Should release a waiting consumer on wake-up")
    void shouldWakeUpWaitingConsumer() throws InterruptedException {
        ChangeQueue queue = new ChangeQueue(10, OverflowPolicy.BLOCK, Duration.ZERO);
        queue.wakeUp();

        long start = System.nanoTime();
        assertThat(queue.awaitBatch(5, Duration.ofMinutes(5))).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should keep a requeued retry behind newer changes")
    void shouldRequeueRetries() {
        ChangeQueue queue = new ChangeQueue(10, OverflowPolicy.BLOCK, Duration.ZERO);
        ChangeEvent failed = ChangeEvent.modified("a", NOW);
        queue.offer(ChangeEvent.modified("b", NOW));

        queue.requeue(failed.nextAttempt());

        List<ChangeEvent> batch = queue.drain(10);
        assertThat(batch).extracting(ChangeEvent::getPath).containsExactly("b", "a");
        assertThat(batch.get(1).getAttempt()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep a fresh change over a retry requeued after it")
    void shouldPreferFreshChangeOverLaterRetry() {
        ChangeQueue queue = new ChangeQueue(10, OverflowPolicy.BLOCK, Duration.ZERO);
        ChangeEvent retry = ChangeEvent.modified("a", NOW).nextAttempt().nextAttempt();
        queue.offer(new ChangeEvent("a", ChangeKind.DELETED, NOW.plusSeconds(5)));

        queue.requeue(retry);

        List<ChangeEvent> batch = queue.drain(10);
        assertThat(batch).hasSize(1);
        assertThat(batch.get(0).getKind()).isEqualTo(ChangeKind.DELETED);
        assertThat(batch.get(0).getAttempt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should let a fresh change replace an earlier retry of the same path")
    void shouldReplaceEarlierRetryWithFreshChange() {
        ChangeQueue queue = new ChangeQueue(10, OverflowPolicy.BLOCK, Duration.ZERO);
        queue.requeue(ChangeEvent.modified("a", NOW).nextAttempt());
        queue.offer(new ChangeEvent("a", ChangeKind.CREATED, NOW.plusSeconds(5)));

        List<ChangeEvent> batch = queue.drain(10);
        assertThat(batch).extracting(ChangeEvent::getKind).containsExactly(ChangeKind.CREATED);
        assertThat(batch.get(0).getAttempt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep resting through new changes until woken up")
    void shouldIgnoreNewChangesWhileResting() throws InterruptedException {
        ChangeQueue queue = new ChangeQueue(10, OverflowPolicy.BLOCK, Duration.ZERO);
        queue.offer(ChangeEvent.modified("a", NOW));
        queue.offer(ChangeEvent.modified("b", NOW));

        long start = System.nanoTime();
        queue.awaitWakeUp(Duration.ofMillis(200));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(150));
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new ChangeQueue(0, OverflowPolicy.BLOCK, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
