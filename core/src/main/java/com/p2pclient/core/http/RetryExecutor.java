package com.p2pclient.core.http;

import com.p2pclient.core.error.ErrorClassifier;
import com.p2pclient.core.error.P2PException;
import com.p2pclient.core.model.RequestSpec;
import com.p2pclient.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * retryable 오류(FORBIDDEN/TIMEOUT)에 한해 전송 단계를 다시 호출한다.
 * 비재시도 종류는 즉시, 예산 소진 시 마지막 오류를 종류 그대로 전파한다.
 * Retry-After(초, 상한 30s)가 있으면 계산된 백오프 대신 사용.
 */
public final class RetryExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

    /** 한 번의 전송+분류 시도 */
    @FunctionalInterface
    public interface Attempt<T> {
        T call(int attempt);
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final ErrorClassifier classifier;

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper, ErrorClassifier classifier) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public <T> T run(RequestSpec spec, Attempt<T> attempt) {
        int n = 1;
        while (true) {
            try {
                return attempt.call(n);
            } catch (P2PException e) {
                // 취소(인터럽트)된 스레드는 더 시도하지 않는다
                boolean interrupted = Thread.currentThread().isInterrupted();
                if (interrupted || n >= policy.maxAttempts() || !policy.shouldRetry(e, n)) {
                    if (e.isRetryable()) {
                        LOG.warn("Giving up on {} after {} attempt(s): {}", spec.describe(), n, e.getKind());
                    }
                    throw e;
                }
                Duration delay = (e.getRetryAfter() != null) ? e.getRetryAfter() : policy.nextDelay(n);
                LOG.info("Retrying {} (attempt {}/{}) in {} ms after {}",
                        spec.describe(), n + 1, policy.maxAttempts(), delay.toMillis(), e.getKind());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    P2PException cancelled = classifier.cancelled(spec, ie);
                    cancelled.addSuppressed(e);
                    throw cancelled;
                }
                n++;
            }
        }
    }
}
