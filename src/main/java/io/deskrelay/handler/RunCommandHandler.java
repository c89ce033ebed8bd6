package io.deskrelay.handler;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

public final class RunCommandHandler implements Handler {
    public static final String TYPE = "run_command";
    public static final PayloadShape SHAPE = PayloadShape.builder()
            .optional("input", ParamKind.STRING)
            .build();

    private static final int MAX_ERROR_CHARS = 512;
    private static final long OUTPUT_DRAIN_WAIT_MS = 5_000L;

    private final List<String> command;
    private final long timeoutMs;

    public RunCommandHandler(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("run_command requires a non-empty command");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    @Override
    public HandlerResult execute(HandlerContext context) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return HandlerResult.fail("command spawn failed: " + e.getMessage());
        }

        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        AtomicReference<IOException> readFailure = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try (InputStream in = process.getInputStream()) {
                in.transferTo(captured);
            } catch (IOException e) {
                readFailure.set(e);
            }
        }, "deskrelay-run-command-output");
        reader.setDaemon(true);
        reader.start();

        try {
            String input = context.string("input");
            byte[] bytes = input == null ? new byte[0] : input.getBytes(StandardCharsets.UTF_8);
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(bytes);
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return HandlerResult.fail("command timeout after " + Duration.ofMillis(timeoutMs));
            }
            reader.join(OUTPUT_DRAIN_WAIT_MS);
            if (readFailure.get() != null) {
                return HandlerResult.fail("command output read failed: " + readFailure.get().getMessage());
            }

            String combined = captured.toString(StandardCharsets.UTF_8);
            if (process.exitValue() == 0) {
                return HandlerResult.ok(combined.strip());
            }
            return HandlerResult.fail("command exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (IOException e) {
            process.destroyForcibly();
            return HandlerResult.fail("command io failed: " + e.getMessage());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    private String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
