package com.askdb.notify;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Dispatches {@link QueryCompletion}s to listeners asynchronously.
 *
 * <p>A failing listener never affects the question's outcome or the other listeners.
 */
@Slf4j
public class CompletionNotifier {

    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final List<QueryCompletionListener> listeners;
    private final ExecutorService executor;

    public CompletionNotifier(List<QueryCompletionListener> listeners) {
        this(listeners, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "askdb-completion");
            t.setDaemon(true);
            return t;
        }));
    }

    public CompletionNotifier(List<QueryCompletionListener> listeners, ExecutorService executor) {
        this.listeners = List.copyOf(listeners);
        this.executor = executor;
    }

    /**
     * Hand a completion to every listener. Returns immediately.
     *
     * @param completion completion
     */
    public void publish(QueryCompletion completion) {
        for (QueryCompletionListener listener : listeners) {
            try {
                executor.execute(() -> deliver(listener, completion));
            } catch (RejectedExecutionException e) {
                log.warn("Dropping completion notification for tenant {}: notifier is shut down",
                        completion.tenantId());
                return;
            }
        }
    }

    /**
     * Stop accepting notifications and wait briefly for queued ones.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Completion notifier did not finish within {}s; dropping queued notifications",
                        SHUTDOWN_WAIT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void deliver(QueryCompletionListener listener, QueryCompletion completion) {
        try {
            listener.onCompletion(completion);
        } catch (RuntimeException e) {
            log.warn("Completion listener {} failed for tenant {}: {}",
                    listener.getClass().getSimpleName(), completion.tenantId(), e.getMessage());
        }
    }
}
