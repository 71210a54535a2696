package com.example.notemake_backend.util;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Runs external binaries (yt-dlp, ffmpeg, whisper) with a hard timeout. Stdout and stderr are drained on
 * separate threads so a chatty process never blocks on a full pipe. The process tree is killed when the timeout
 * passes or the calling thread is interrupted.
 */
@Component
public class ProcessRunner {

    public Result run(List<String> cmd, long timeout, TimeUnit unit) throws IOException, InterruptedException {
        return run(cmd, null, timeout, unit);
    }

    public Result run(List<String> cmd, Path workDir, long timeout, TimeUnit unit) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(cmd);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        Process p = pb.start();
        StringJoiner out = new StringJoiner(System.lineSeparator());
        StringJoiner err = new StringJoiner(System.lineSeparator());
        Thread outReader = drain(p.getInputStream(), out, "proc-out");
        Thread errReader = drain(p.getErrorStream(), err, "proc-err");

        boolean finished;
        try {
            finished = p.waitFor(timeout, unit);
        } catch (InterruptedException e) {
            // the caller gave up (timeout or cancellation); the child must not outlive it
            kill(p);
            Thread.currentThread().interrupt();
            throw e;
        }
        if (!finished) {
            kill(p);
            p.waitFor(5, TimeUnit.SECONDS);
        }
        outReader.join();
        errReader.join();
        int code = finished ? p.exitValue() : -1;
        return new Result(code, out.toString(), err.toString(), !finished);
    }

    private static void kill(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
    }

    private Thread drain(InputStream in, StringJoiner sink, String name) {
        Thread t = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.add(line);
                    }
                }
            } catch (IOException ignored) {
                // exit code and timeout decide the result; partial output is enough
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    public record Result(int code, String stdout, String stderr, boolean timedOut) {

        public boolean ok() {
            return !timedOut && code == 0;
        }

        public String combined() {
            if (stderr == null || stderr.isBlank()) return stdout;
            if (stdout == null || stdout.isBlank()) return stderr;
            return stdout + System.lineSeparator() + stderr;
        }
    }
}
