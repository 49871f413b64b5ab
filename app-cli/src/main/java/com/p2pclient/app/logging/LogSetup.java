package com.p2pclient.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * CLI 용 java.util.logging 전역 설정(SLF4J 는 slf4j-jdk14 로 여기에 붙는다).
 * - init(): 콘솔(stderr) 핸들러, -Dp2p.log.dir 이 있으면 사이즈 롤링 파일(기본 2MB x 5)도 추가
 * - setLevel(Level): 루트/핸들러 레벨 즉시 변경
 *
 * System props:
 *  -Dp2p.log.level=FINE|INFO|WARNING|SEVERE (기본 WARNING)
 *  -Dp2p.log.dir=logs
 *  -Dp2p.log.sizeMb=2
 *  -Dp2p.log.files=5
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter(); // 단일 인스턴스

    public static synchronized void init() {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("p2p.log.level", "WARNING"));

        // 루트 로거 초기화
        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler(); // stderr: stdout 은 명령 출력 전용
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);
        root.setLevel(level);

        String dir = System.getProperty("p2p.log.dir");
        if (dir != null && !dir.isBlank()) {
            Path logDir = Path.of(dir.trim());
            try {
                Files.createDirectories(logDir);
                int sizeMb  = parseInt(System.getProperty("p2p.log.sizeMb"), 2);
                int fileCnt = parseInt(System.getProperty("p2p.log.files"), 5);
                String pattern = logDir.resolve("p2pci-%g.log").toString();
                FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 없이 콘솔만으로 진행
                Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
            }
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. level=" + level.getName() + (dir == null ? "" : ", dir=" + dir));
    }

    /** 런타임에 로그 레벨 변경(모든 핸들러) */
    public static void setLevel(Level level) {
        if (level == null) level = Level.INFO;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
