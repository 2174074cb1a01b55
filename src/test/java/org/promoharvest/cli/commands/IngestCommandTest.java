package org.promoharvest.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.promoharvest.cli.RunLock;
import org.promoharvest.junit.extensions.logging.ExpectLog;
import org.promoharvest.junit.extensions.logging.LogLevel;
import org.promoharvest.junit.extensions.logging.LogWatchExtension;
import org.promoharvest.pipeline.api.services.IService;
import org.promoharvest.pipeline.services.FetchOrchestrator;
import org.promoharvest.pipeline.services.RunStatus;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class IngestCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void exitCode_mapsRunStatus() {
        assertThat(IngestCommand.exitCode(RunStatus.COMPLETED)).isZero();
        assertThat(IngestCommand.exitCode(RunStatus.COMPLETED_WITH_ERRORS)).isZero();
        assertThat(IngestCommand.exitCode(RunStatus.STOPPED)).isEqualTo(2);
        assertThat(IngestCommand.exitCode(RunStatus.FAILED)).isEqualTo(1);
        assertThat(IngestCommand.exitCode(null)).isEqualTo(1);
    }

    @Test
    void shutdownHook_returnsOnlyAfterRunLockIsReleased() throws Exception {
        // Given: a running orchestrator holding the run lock
        Path recordLog = tempDir.resolve("records.jsonl");
        FetchOrchestrator orchestrator = mock(FetchOrchestrator.class);
        when(orchestrator.getCurrentState()).thenReturn(IService.State.RUNNING);
        when(orchestrator.getRecordLog()).thenReturn(recordLog);
        RunLock lock = RunLock.acquire(recordLog, false);
        IngestCommand.GracefulShutdown shutdown = new IngestCommand.GracefulShutdown(orchestrator, Duration.ofSeconds(30));

        // When: the JVM runs the hook
        Thread hook = new Thread(shutdown, "test-shutdown-hook");
        hook.start();

        // Then: the orchestrator is stopped but the hook keeps the JVM alive while the lock is held
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(orchestrator).stop());
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(hook::isAlive);
        assertThat(lock.file()).exists();

        // When: the main thread leaves the locked section
        lock.close();
        shutdown.released();

        // Then
        hook.join(5000);
        assertThat(hook.isAlive()).isFalse();
        assertThat(lock.file()).doesNotExist();
    }

    @Test
    void shutdownHook_skipsStopWhenRunAlreadyFinished() throws Exception {
        FetchOrchestrator orchestrator = mock(FetchOrchestrator.class);
        when(orchestrator.getCurrentState()).thenReturn(IService.State.STOPPED);
        IngestCommand.GracefulShutdown shutdown = new IngestCommand.GracefulShutdown(orchestrator, Duration.ofSeconds(30));
        shutdown.released();

        shutdown.run();

        verify(orchestrator, never()).stop();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Run lock of .* not released within 100 ms")
    void shutdownHook_givesUpAfterReleaseTimeout() {
        // Given: a main thread that never reports back
        FetchOrchestrator orchestrator = mock(FetchOrchestrator.class);
        when(orchestrator.getCurrentState()).thenReturn(IService.State.STOPPED);
        when(orchestrator.getRecordLog()).thenReturn(tempDir.resolve("records.jsonl"));
        IngestCommand.GracefulShutdown shutdown = new IngestCommand.GracefulShutdown(orchestrator, Duration.ofMillis(100));

        // When
        long started = System.nanoTime();
        shutdown.run();

        // Then
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(100));
    }
}
