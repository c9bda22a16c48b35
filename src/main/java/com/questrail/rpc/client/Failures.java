package com.questrail.rpc.client;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class Failures
{
    private Failures() {}

    /**
     * Strips the wrappers {@code CompletableFuture} adds around a failure.
     */
    static Throwable unwrap(Throwable failure)
    {
        Throwable t = failure;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
