package com.gdin.inspection.originality.collaborator;

import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.exception.MalformedResponseException;
import com.gdin.inspection.originality.exception.SubsystemUnavailableException;
import com.gdin.inspection.originality.exception.SubsystemUnavailableException.Reason;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 所有外部调用的统一出口：单次调用超时 + 至多一次指数退避重试。
 * 鉴权失败、输出格式错误不重试。
 */
@Slf4j
public class CollaboratorCalls {

    private final ExecutorService callExecutor;
    private final Duration callTimeout;
    private final TimeLimiter timeLimiter;
    private final Retry retry;

    public CollaboratorCalls(ExecutorService callExecutor, OriginalityProperties.Resilience resilience) {
        this.callExecutor = callExecutor;
        this.callTimeout = resilience.getCallTimeout();
        this.timeLimiter = TimeLimiter.of("originality-collaborator", TimeLimiterConfig.custom()
                .timeoutDuration(callTimeout)
                .cancelRunningFuture(true)
                .build());
        this.retry = Retry.of("originality-collaborator", RetryConfig.custom()
                .maxAttempts(Math.max(1, resilience.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        resilience.getInitialBackoff(), resilience.getBackoffMultiplier()))
                .retryOnException(CollaboratorCalls::isRetryable)
                .build());
        this.retry.getEventPublisher().onRetry(event -> log.warn("外部调用失败，第 {} 次重试: {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
    }

    /**
     * @throws SubsystemUnavailableException 超时、不可达、鉴权失败等，重试后仍失败
     * @throws MalformedResponseException    supplier 自己判定输出不可用
     */
    public <T> T call(String operation, Supplier<T> supplier) {
        Callable<T> attempt = () -> attemptOnce(operation, supplier);
        try {
            return Retry.decorateCallable(retry, attempt).call();
        } catch (SubsystemUnavailableException | MalformedResponseException e) {
            throw e;
        } catch (Exception e) {
            throw translate(operation, e);
        }
    }

    private <T> T attemptOnce(String operation, Supplier<T> supplier) {
        // FutureTask 超时取消时会中断执行线程，挂起的调用不会一直占着线程池
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> callExecutor.submit(supplier::get));
        try {
            return timed.call();
        } catch (TimeoutException e) {
            throw new SubsystemUnavailableException(Reason.TIMEOUT,
                    operation + " timed out after " + callTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SubsystemUnavailableException(Reason.INTERRUPTED, operation + " interrupted", e);
        } catch (ExecutionException e) {
            throw translate(operation, e.getCause() == null ? e : e.getCause());
        } catch (Exception e) {
            throw translate(operation, e);
        }
    }

    static boolean isRetryable(Throwable t) {
        return t instanceof SubsystemUnavailableException s && s.isRetryable();
    }

    /**
     * 把各 SDK 的异常归到统一的不可用原因
     */
    static RuntimeException translate(String operation, Throwable t) {
        if (t instanceof SubsystemUnavailableException s) return s;
        if (t instanceof MalformedResponseException m) return m;
        if (t instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new SubsystemUnavailableException(Reason.INTERRUPTED, operation + " interrupted", t);
        }
        String type = t.getClass().getSimpleName().toLowerCase(Locale.ROOT);
        String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
        Reason reason;
        if (type.contains("authentication") || message.contains("401") || message.contains("403")
                || message.contains("unauthorized") || message.contains("invalid api")
                || message.contains("apikey") || message.contains("api key")) {
            reason = Reason.AUTHENTICATION;
        } else if (type.contains("ratelimit") || message.contains("429") || message.contains("rate limit")
                || message.contains("throttl")) {
            reason = Reason.RATE_LIMITED;
        } else if (type.contains("timeout") || message.contains("timed out") || message.contains("timeout")) {
            reason = Reason.TIMEOUT;
        } else {
            reason = Reason.UNREACHABLE;
        }
        return new SubsystemUnavailableException(reason, operation + " failed: " + t.getMessage(), t);
    }
}
