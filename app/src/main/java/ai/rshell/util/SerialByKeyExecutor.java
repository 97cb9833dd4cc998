package ai.rshell.util;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs tasks on a shared executor so that tasks with the same key run one at a time, in submission order, while
 * tasks with different keys run in parallel. A task that fails does not hold up the tasks queued behind it.
 */
public final class SerialByKeyExecutor {
    private static final Logger logger = LogManager.getLogger(SerialByKeyExecutor.class);

    private final Executor executor;

    // key -> completion of the most recently queued task for that key
    private final ConcurrentHashMap<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    public SerialByKeyExecutor(Executor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    public <T> CompletableFuture<T> submit(String key, Callable<T> task) {
        @SuppressWarnings("unchecked")
        var result = (CompletableFuture<T>) tails.compute(key, (String k, @Nullable CompletableFuture<?> previous) -> {
            var done = new CompletableFuture<T>();
            Runnable start = () -> CompletableFuture.supplyAsync(() -> call(k, task), executor)
                    .whenCompleteAsync(
                            (T value, @Nullable Throwable err) -> {
                                // drop the key before callers can observe completion
                                tails.remove(k, done);
                                if (err != null) {
                                    done.completeExceptionally(unwrap(err));
                                } else {
                                    done.complete(value);
                                }
                            },
                            executor);
            if (previous == null) {
                start.run();
            } else {
                previous.whenCompleteAsync((r, e) -> start.run(), executor);
            }
            return done;
        });
        return result;
    }

    public CompletableFuture<Void> submit(String key, Runnable task) {
        return submit(key, () -> {
            task.run();
            return null;
        });
    }

    /** Number of keys that have queued or running tasks. */
    public int getActiveKeyCount() {
        return tails.size();
    }

    private static <T> T call(String key, Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            logger.error("Task for key '{}' failed", key, e);
            throw e;
        } catch (Exception e) {
            logger.error("Task for key '{}' failed", key, e);
            throw new CompletionException(e);
        }
    }

    private static Throwable unwrap(Throwable err) {
        return err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
    }
}
