package com.example.notemake_backend.util;

import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.service.TimeLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final ProcessRunner runner = new ProcessRunner();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void collectsOutputAndExitCode() throws Exception {
        ProcessRunner.Result result = runner.run(List.of("sh", "-c", "echo hello; echo oops >&2; exit 3"), 10, TimeUnit.SECONDS);

        assertThat(result.code()).isEqualTo(3);
        assertThat(result.stdout()).isEqualTo("hello");
        assertThat(result.stderr()).isEqualTo("oops");
        assertThat(result.ok()).isFalse();
    }

    @Test
    void ownTimeoutKillsProcess() throws Exception {
        ProcessRunner.Result result = runner.run(List.of("sh", "-c", "exec sleep 30"), 200, TimeUnit.MILLISECONDS);

        assertThat(result.timedOut()).isTrue();
        assertThat(result.ok()).isFalse();
    }

    @Test
    void callerTimeoutKillsProcess(@TempDir Path dir) throws Exception {
        Path pidFile = dir.resolve("pid");
        TimeLimiter limiter = new TimeLimiter(executor);

        assertThatThrownBy(() -> limiter.call("sleep", Duration.ofMillis(500), () ->
                runner.run(List.of("sh", "-c", "echo $$ > " + pidFile + "; exec sleep 30"), 60, TimeUnit.SECONDS)))
                .isInstanceOfSatisfying(PipelineException.class, ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.TIMEOUT));

        long pid = readPid(pidFile);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (isAlive(pid) && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertThat(isAlive(pid)).isFalse();
    }

    private static long readPid(Path pidFile) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (Files.exists(pidFile)) {
                String text = Files.readString(pidFile).trim();
                if (!text.isEmpty()) {
                    return Long.parseLong(text);
                }
            }
            Thread.sleep(20);
        }
        throw new AssertionError("process never wrote " + pidFile);
    }

    private static boolean isAlive(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        return handle.isPresent() && handle.get().isAlive();
    }
}
