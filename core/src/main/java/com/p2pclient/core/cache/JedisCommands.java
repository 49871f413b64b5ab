package com.p2pclient.core.cache;

import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Jedis 풀 위의 RedisCache.Commands. 첫 명령 때 풀을 만든다(설정 로드 시 접속하지 않음). */
final class JedisCommands implements RedisCache.Commands {

    private static final int SCAN_COUNT = 500;

    private final String host;
    private final int port;
    private volatile JedisPooled jedis;

    JedisCommands(String host, int port) {
        this.host = Objects.requireNonNull(host, "host");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("invalid redis port: " + port);
        this.port = port;
    }

    private JedisPooled jedis() {
        JedisPooled j = jedis;
        if (j == null) {
            synchronized (this) {
                j = jedis;
                if (j == null) {
                    j = new JedisPooled(host, port);
                    jedis = j;
                }
            }
        }
        return j;
    }

    @Override
    public String get(String key) {
        return jedis().get(key);
    }

    @Override
    public void set(String key, String value, long seconds) {
        if (seconds > 0) jedis().setex(key, seconds, value);
        else jedis().set(key, value);
    }

    @Override
    public void del(List<String> keys) {
        if (keys.isEmpty()) return;
        jedis().del(keys.toArray(new String[0]));
    }

    @Override
    public List<String> keys(String pattern) {
        ScanParams params = new ScanParams().match(pattern).count(SCAN_COUNT);
        List<String> out = new ArrayList<>();
        String cursor = ScanParams.SCAN_POINTER_START;
        do {
            ScanResult<String> page = jedis().scan(cursor, params);
            out.addAll(page.getResult());
            cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        return out;
    }

    @Override
    public synchronized void close() {
        if (jedis != null) {
            jedis.close();
            jedis = null;
        }
    }

    @Override
    public String toString() { return "redis://" + host + ":" + port; }
}
