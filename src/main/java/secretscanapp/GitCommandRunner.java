package secretscanapp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs git commands with a deadline.
 * Output streams are drained on background threads so large outputs never block the process.
 */
public class GitCommandRunner {
    private static final Logger logger = LoggerFactory.getLogger(GitCommandRunner.class);

    private static final long POLL_INTERVAL_MILLIS = 1000;

    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "git-output-reader");
        thread.setDaemon(true);
        return thread;
    });

    private final Runnable keepAlive;

    public GitCommandRunner() {
        this(() -> { });
    }

    /**
     * @param keepAlive invoked about once a second while a command runs (activity heartbeats)
     */
    public GitCommandRunner(Runnable keepAlive) {
        this.keepAlive = keepAlive;
    }

    /**
     * Result of a finished git command
     */
    public static final class Result {
        private final int exitCode;
        private final byte[] stdout;
        private final String stderr;

        Result(int exitCode, byte[] stdout, String stderr) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
        }

        public int getExitCode() {
            return exitCode;
        }

        public byte[] getStdout() {
            return stdout;
        }

        public String getStdoutText() {
            return new String(stdout, StandardCharsets.UTF_8);
        }

        public String getStderr() {
            return stderr;
        }

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }

    /**
     * Run {@code git <args>} in a directory.
     *
     * @throws InterruptedIOException if the deadline passes; the process is killed
     * @throws ScanCancelledException if the token is cancelled while the command runs
     */
    public Result run(File directory, List<String> args, Duration timeout, CancellationToken token)
            throws IOException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.add("-c");
        command.add("core.quotepath=off");
        command.addAll(args);

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        if (directory != null) {
            processBuilder.directory(directory);
        }
        processBuilder.environment().put("GIT_TERMINAL_PROMPT", "0");

        Process process = processBuilder.start();
        process.getOutputStream().close();
        CompletableFuture<byte[]> stdout = drain(process.getInputStream());
        CompletableFuture<byte[]> stderr = drain(process.getErrorStream());

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (!process.waitFor(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
                token.throwIfCancelled();
                if (System.nanoTime() > deadline) {
                    process.destroyForcibly();
                    throw new InterruptedIOException(
                        "git " + args.get(0) + " timed out after " + timeout.getSeconds() + "s");
                }
                keepAlive.run();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("git " + args.get(0) + " interrupted");
        } catch (RuntimeException e) {
            // Cancellation, or a failed heartbeat of a cancelled activity
            process.destroyForcibly();
            throw e;
        }

        Result result = new Result(process.exitValue(), join(stdout),
            new String(join(stderr), StandardCharsets.UTF_8).trim());
        if (!result.isSuccess()) {
            logger.debug("git {} exited with {}: {}", args.get(0), result.getExitCode(), result.getStderr());
        }
        return result;
    }

    /**
     * Run a command and fail unless it exits with 0
     */
    public Result runChecked(File directory, List<String> args, Duration timeout, CancellationToken token)
            throws IOException {
        Result result = run(directory, args, timeout, token);
        if (!result.isSuccess()) {
            throw new IOException("git " + args.get(0) + " failed with exit code "
                + result.getExitCode() + ": " + result.getStderr());
        }
        return result;
    }

    private static CompletableFuture<byte[]> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return in.readAllBytes();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, STREAM_READERS);
    }

    private static byte[] join(CompletableFuture<byte[]> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while reading git output");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            throw new IOException("Failed to read git output", cause);
        }
    }
}
