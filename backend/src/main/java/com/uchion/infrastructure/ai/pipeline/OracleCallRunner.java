package com.uchion.infrastructure.ai.pipeline;

import com.uchion.domain.validation.model.IssueCode;
import com.uchion.domain.validation.model.JudgeResult;
import com.uchion.infrastructure.config.ValidationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.*;

/**
 * Runs oracle-bound work on the judge pool. Every call gets an interruptible future that is
 * registered with the run's {@link CancellationToken} and awaited against a deadline of
 * {@code validation.judge-timeout-seconds}. A call that misses its deadline is cancelled
 * with interruption.
 */
@Slf4j
@Component
public class OracleCallRunner {

    private final AsyncTaskExecutor executor;
    private final ValidationProperties properties;

    public OracleCallRunner(@Qualifier("judgeExecutor") AsyncTaskExecutor executor,
                            ValidationProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    public long timeoutSeconds() {
        return properties.getJudgeTimeoutSeconds();
    }

    /**
     * Deadline in {@link System#nanoTime()} terms, one timeout from now.
     */
    public long deadline() {
        return System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds());
    }

    /**
     * Submits the task and registers it with the token. A saturated pool yields an already
     * failed future instead of running the task outside the deadline.
     */
    public <T> Future<T> submit(Callable<T> task, CancellationToken token) {
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            log.warn("[OracleCallRunner] Judge pool saturated, call rejected");
            future = CompletableFuture.failedFuture(e);
        }
        token.register(future);
        return future;
    }

    /**
     * Waits for the future until the deadline. On timeout or interrupt the task is cancelled
     * and its thread interrupted before the exception is rethrown.
     */
    public <T> T await(Future<T> future, long deadline)
            throws TimeoutException, ExecutionException, InterruptedException {
        try {
            return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    public <T> T call(Callable<T> task, CancellationToken token)
            throws TimeoutException, ExecutionException, InterruptedException {
        return await(submit(task, token), deadline());
    }

    /**
     * Awaits a judge future and degrades every failure mode to an {@code AGENT_ERROR} result.
     */
    public JudgeResult awaitJudge(String judgeName, Future<JudgeResult> future, long deadline) {
        try {
            JudgeResult result = await(future, deadline);
            if (result == null) {
                return JudgeResult.unavailable(judgeName, IssueCode.AGENT_ERROR);
            }
            return result;
        } catch (TimeoutException e) {
            log.warn("[OracleCallRunner] Judge {} timed out after {}s", judgeName, timeoutSeconds());
            return JudgeResult.unavailable(judgeName, IssueCode.AGENT_ERROR,
                    "Judge timed out after " + timeoutSeconds() + "s");
        } catch (CancellationException e) {
            log.info("[OracleCallRunner] Judge {} cancelled", judgeName);
            return JudgeResult.unavailable(judgeName, IssueCode.AGENT_ERROR, "Judge call cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[OracleCallRunner] Judge {} failed unexpectedly", judgeName, cause);
            return JudgeResult.unavailable(judgeName, IssueCode.AGENT_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[OracleCallRunner] Interrupted while waiting for judge {}", judgeName);
            return JudgeResult.unavailable(judgeName, IssueCode.AGENT_ERROR, "Judge call interrupted");
        }
    }
}
