package com.insightreport.generator.workflow;

import com.insightreport.generator.exception.ActivityFailedException;
import com.insightreport.generator.exception.ActivityTimeoutException;
import com.insightreport.generator.exception.ReportPipelineException;
import com.insightreport.generator.exception.TransientActivityException;
import com.insightreport.generator.exception.WorkflowInterruptedException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * 액티비티 실행기
 *
 * 각 시도를 액티비티 풀에서 실행하고, 호출 스레드는 결과를 기다리며
 * start-to-close 타임아웃과 하트비트 타임아웃을 감시한다.
 * 재시도 가능한 실패는 지수 백오프 후 다시 시도하고, 재시도 불가 오류나
 * 마지막 시도의 실패는 {@link ActivityFailedException} 으로 전달된다.
 */
@Component
@Slf4j
public class ActivityExecutor {

    private static final long WATCHDOG_POLL_MILLIS = 200;

    /**
     * 백오프 대기. 테스트에서 대체 가능.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final AsyncTaskExecutor activityExecutor;
    private final MeterRegistry meterRegistry;
    private final Sleeper sleeper;

    @Autowired
    public ActivityExecutor(@Qualifier("activityExecutor") AsyncTaskExecutor activityExecutor,
                            MeterRegistry meterRegistry) {
        this(activityExecutor, meterRegistry, Thread::sleep);
    }

    public ActivityExecutor(AsyncTaskExecutor activityExecutor, MeterRegistry meterRegistry, Sleeper sleeper) {
        this.activityExecutor = activityExecutor;
        this.meterRegistry = meterRegistry;
        this.sleeper = sleeper;
    }

    public <T> T execute(String activityName, ActivityOptions options, Function<ActivityContext, T> body) {
        for (int attempt = 1; ; attempt++) {
            try {
                return runAttempt(activityName, attempt, options, body);
            } catch (WorkflowInterruptedException e) {
                throw e;
            } catch (RuntimeException e) {
                boolean nonRetryable = e instanceof ReportPipelineException pe && pe.isNonRetryable();
                if (nonRetryable || attempt >= options.getMaximumAttempts()) {
                    log.error("Activity failed: activity={}, attempts={}, nonRetryable={}, error={}",
                            activityName, attempt, nonRetryable, e.getMessage());
                    throw new ActivityFailedException(activityName, attempt, e);
                }

                long backoff = options.backoffMillis(attempt);
                log.warn("Activity attempt failed, retrying: activity={}, attempt={}/{}, backoffMs={}, error={}",
                        activityName, attempt, options.getMaximumAttempts(), backoff, e.getMessage());
                meterRegistry.counter("report.activity.retries", "activity", activityName).increment();
                sleep(activityName, backoff);
            }
        }
    }

    private <T> T runAttempt(String activityName, int attempt, ActivityOptions options,
                             Function<ActivityContext, T> body) {
        ActivityContext context = new ActivityContext(activityName, attempt);
        Future<T> future;
        try {
            future = activityExecutor.submit((Callable<T>) () -> body.apply(context));
        } catch (TaskRejectedException e) {
            throw new TransientActivityException("Activity " + activityName + " rejected: " + e.getMessage(), e);
        }

        long startNanos = System.nanoTime();
        long startToCloseNanos = options.getStartToCloseTimeout().toNanos();
        Duration heartbeatTimeout = options.getHeartbeatTimeout();
        long pollMillis = Math.max(1, Math.min(WATCHDOG_POLL_MILLIS, options.getStartToCloseTimeout().toMillis()));

        while (true) {
            try {
                return future.get(pollMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (System.nanoTime() - startNanos > startToCloseNanos) {
                    future.cancel(true);
                    throw ActivityTimeoutException.startToClose(activityName, options.getStartToCloseTimeout());
                }
                if (heartbeatTimeout != null && context.nanosSinceLastHeartbeat() > heartbeatTimeout.toNanos()) {
                    future.cancel(true);
                    throw ActivityTimeoutException.heartbeat(activityName, heartbeatTimeout);
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new TransientActivityException(cause.getMessage(), cause);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new WorkflowInterruptedException("Interrupted while waiting for " + activityName, e);
            }
        }
    }

    private void sleep(String activityName, long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowInterruptedException("Interrupted during backoff of " + activityName, e);
        }
    }
}
