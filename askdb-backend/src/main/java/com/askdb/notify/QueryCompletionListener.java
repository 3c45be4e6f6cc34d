package com.askdb.notify;

/**
 * Best-effort side effect of a finished question (history, last-used time). Runs off the
 * request thread; failures are logged and ignored.
 */
@FunctionalInterface
public interface QueryCompletionListener {

    void onCompletion(QueryCompletion completion);
}
