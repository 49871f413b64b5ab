package com.p2pclient.core.cache;

/** 캐시 시각 소스. 테스트에서는 고정 시계를 주입한다. */
@FunctionalInterface
public interface CacheClock {
    CacheClock SYSTEM = System::currentTimeMillis;

    long nowMillis();
}
