package com.pipeline.cli.ui;

import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Shows a spinner with a label and the elapsed seconds while a pipeline runs.
 */
@Component
public class Spinner {

    private static final char[] FRAMES = {'|', '/', '-', '\\'};

    private final Terminal terminal;

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    /**
     * Runs the task on a helper thread and animates the spinner until it finishes.
     *
     * @param label text shown next to the spinner
     * @param task  the work to run
     * @return the task's result
     * @throws RuntimeException the task's own exception, unwrapped
     */
    public <T> T spin(String label, Supplier<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<T> future = executor.submit(task::get);
        PrintWriter writer = terminal.writer();
        long started = System.nanoTime();
        int frame = 0;
        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clear(writer, label);
                    return result;
                } catch (TimeoutException e) {
                    long seconds = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started);
                    writer.print("\r\u001B[33m" + label + " " + FRAMES[frame++ % FRAMES.length] + " " + seconds + "s\u001B[0m");
                    writer.flush();
                }
            }
        } catch (ExecutionException e) {
            clear(writer, label);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            clear(writer, label);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + label, e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void clear(PrintWriter writer, String label) {
        writer.print("\r" + " ".repeat(label.length() + 12) + "\r");
        writer.flush();
    }
}
