package io.mcpdeck.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

public final class McpFunctions {
    private McpFunctions() {
    }

    /**
     * Adapts a blocking function: each call runs on {@code executor}. A full executor fails the
     * call instead of blocking the caller.
     */
    public static McpFunction sync(SyncFunction function, Executor executor) {
        return arguments -> {
            try {
                return CompletableFuture.supplyAsync(() -> {
                    try {
                        return function.apply(arguments);
                    } catch (RuntimeException e) {
                        throw e;
                    } catch (Exception e) {
                        throw new CompletionException(e);
                    }
                }, executor);
            } catch (RejectedExecutionException e) {
                return CompletableFuture.<JsonNode>failedFuture(
                        new RejectedExecutionException("worker pool saturated", e));
            }
        };
    }

    public static McpFunction completed(JsonNode value) {
        return arguments -> CompletableFuture.completedFuture(value);
    }
}
