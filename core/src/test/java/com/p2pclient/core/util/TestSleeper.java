package com.p2pclient.core.util;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** 테스트용 Sleeper: sleep(Duration) 호출 기록만 한다 */
public final class TestSleeper implements Sleeper {
    public final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    @Override public void sleep(Duration d) { sleeps.add(d); }
}
