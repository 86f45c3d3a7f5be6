package com.driftsentinel.daemon;

import com.driftsentinel.core.model.ChangeEvent;
import com.driftsentinel.core.model.ChangeKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

/**
 * Unit tests for {@link WatchServiceChangeSource}.
 */
class WatchServiceChangeSourceTest {

    @TempDir
    Path projectDir;

    private final List<ChangeEvent> events = new CopyOnWriteArrayList<>();
    private WatchServiceChangeSource source;

    @AfterEach
    void tearDown() {
        if (source != null) {
            source.close();
        }
    }

    @Test
    @DisplayName("Should report existing files as modified on the initial scan")
    void shouldEmitExistingFiles() throws IOException {
        Files.createDirectories(projectDir.resolve("src"));
        Files.writeString(projectDir.resolve("src/calc.py"), "def calc(a, b): pass\n");

        source = new WatchServiceChangeSource(projectDir, Clock.systemUTC(), true);
        source.start(events::add);

        awaitCondition(() -> events.stream().anyMatch(e -> e.getPath().equals("src/calc.py")));
        assertThat(events.get(0).getKind()).isEqualTo(ChangeKind.MODIFIED);
    }

    @Test
    @DisplayName("Should report files created in directories that appear after start")
    void shouldWatchNewDirectories() throws IOException {
        source = new WatchServiceChangeSource(projectDir, Clock.systemUTC(), false);
        source.start(events::add);

        Path pkg = Files.createDirectories(projectDir.resolve("pkg"));
        Files.writeString(pkg.resolve("api.py"), "def charge(account, amount): pass\n");

        awaitCondition(() -> events.stream().anyMatch(e -> e.getPath().equals("pkg/api.py")));
        assertThat(events).noneMatch(e -> e.getPath().equals("pkg"));
    }

    @Test
    @DisplayName("Should refuse to start twice")
    void shouldRejectSecondStart() {
        source = new WatchServiceChangeSource(projectDir, Clock.systemUTC(), false);
        source.start(events::add);

        assertThatThrownBy(() -> source.start(events::add)).isInstanceOf(IllegalStateException.class);
    }

    // ---- Helpers

    private static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 10 seconds");
            }
            sleep(25);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
