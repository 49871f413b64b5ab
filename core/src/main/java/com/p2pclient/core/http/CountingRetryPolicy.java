package com.p2pclient.core.http;

import com.p2pclient.core.error.ErrorKind;
import com.p2pclient.core.error.P2PException;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 재시도 결정을 세는 데코레이터. 전체 횟수와 종류별(FORBIDDEN/TIMEOUT) 횟수를 따로 센다.
 * 여러 스레드가 같은 인스턴스를 써도 안전하다.
 */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private final AtomicInteger retries = new AtomicInteger();
    private final Map<ErrorKind, AtomicInteger> byKind = new EnumMap<>(ErrorKind.class);

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        for (ErrorKind k : ErrorKind.values()) {
            if (k.isRetryable()) byKind.put(k, new AtomicInteger());
        }
    }

    @Override
    public boolean shouldRetry(P2PException failure, int attempt) {
        boolean ok = delegate.shouldRetry(failure, attempt);
        if (ok) {
            retries.incrementAndGet();
            AtomicInteger c = byKind.get(failure.getKind());
            if (c != null) c.incrementAndGet();
        }
        return ok;
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delegate.nextDelay(attempt);
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    /** 승인된 재시도 총 횟수 */
    public int getRetryCount() {
        return retries.get();
    }

    public int getRetryCount(ErrorKind kind) {
        AtomicInteger c = byKind.get(kind);
        return (c == null) ? 0 : c.get();
    }

    public void reset() {
        retries.set(0);
        byKind.values().forEach(c -> c.set(0));
    }
}
