package com.p2pclient.core.util;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거(java.util.logging 위에 얹음).
 * 디스패처의 시도 단위 이벤트(p2p.attempt 등)를 한 줄 JSON 으로 남긴다.
 * 필드 조립은 Jackson ObjectNode 로 하므로 이스케이프는 신경 쓰지 않아도 된다.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    /** debug 플래그에 따라 INFO/FINE 중 하나로 기록 */
    public void event(boolean loud, String event, Object... kvs) {
        log(loud ? Level.INFO : Level.FINE, event, kvs);
    }

    public boolean isLoggable(boolean loud) {
        return jul.isLoggable(loud ? Level.INFO : Level.FINE);
    }

    private void log(Level lvl, String event, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        jul.log(lvl, toJson(lvl, event, kvs));
    }

    String toJson(Level lvl, String event, Object... kvs) {
        ObjectNode n = JsonSupport.object();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                n.set(String.valueOf(kvs[i]), JsonSupport.toTree(scalarOrString(kvs[i + 1])));
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        return JsonSupport.write(n);
    }

    private static Object scalarOrString(Object v) {
        if (v == null || v instanceof Number || v instanceof Boolean) return v;
        return String.valueOf(v);
    }
}
