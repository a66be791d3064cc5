package com.gateway.cli.ui;

import java.io.PrintWriter;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;

/**
 * A UI component that displays a spinning cursor in the console while a call or a
 * registration is running.
 */
@Component
public class Spinner {

    private static final char[] FRAMES = {'|', '/', '-', '\\'};

    private final Terminal terminal;

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    /**
     * Runs the task on a worker thread and animates the spinner until it completes.
     *
     * @param label The text shown next to the spinner.
     * @param task  The task to execute.
     * @param <T>   The type of the result.
     * @return The result of the task.
     * @throws RuntimeException the task's own exception, unwrapped.
     */
    public <T> T spin(String label, Supplier<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<T> future = executor.submit(task::get);
        PrintWriter writer = terminal.writer();
        int frame = 0;

        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clearLine(writer, label);
                    return result;
                } catch (TimeoutException e) {
                    writer.print("\r\u001B[33m" + label + " " + FRAMES[frame++ % FRAMES.length] + "\u001B[0m");
                    writer.flush();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            clearLine(writer, label);
            throw new IllegalStateException("Interrupted while waiting for: " + label, e);
        } catch (Exception e) {
            clearLine(writer, label);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private void clearLine(PrintWriter writer, String label) {
        writer.print("\r" + " ".repeat(label.length() + 4) + "\r");
        writer.flush();
    }
}
