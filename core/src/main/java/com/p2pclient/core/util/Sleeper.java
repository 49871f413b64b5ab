package com.p2pclient.core.util;

import java.time.Duration;

/** 재시도 대기 훅. 테스트에선 기록만 하는 구현을 주입한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
