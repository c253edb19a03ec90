package com.cypherscan.app.logging;

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
 * CLI 용 java.util.logging 전역 설정. slf4j 는 slf4j-jdk14 바인딩으로 여기로 흘러온다.
 * System props:
 *   -Dcs.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 *   -Dcs.log.sizeMb=2, -Dcs.log.files=5
 *   -Dcs.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;

    /** logDir/cypherscan-%g.log 로 롤링. 두 번째 호출부터는 무시. */
    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("cs.log.level", "INFO"));
        int sizeMb = parseInt(System.getProperty("cs.log.sizeMb"), 2);
        int files = parseInt(System.getProperty("cs.log.files"), 5);
        boolean console = !"false".equalsIgnoreCase(System.getProperty("cs.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        Formatter fmt = new LineFormatter();

        if (console) {
            ConsoleHandler ch = new ConsoleHandler();
            ch.setFormatter(fmt);
            root.addHandler(ch);
        }
        try {
            Files.createDirectories(logDir);
            FileHandler fh = new FileHandler(logDir.resolve("cypherscan-%g.log").toString(),
                    sizeMb * 1024 * 1024, Math.max(1, files), true);
            fh.setFormatter(fmt);
            root.addHandler(fh);
        } catch (IOException e) {
            // 파일 핸들러 없이 콘솔만으로 계속
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING,
                    "File logging disabled, cannot open " + logDir.toAbsolutePath() + ": " + e.getMessage(), e);
        }
        setLevel(level);
    }

    /** 루트 + 모든 핸들러 레벨 변경 */
    public static void setLevel(Level level) {
        Level lv = (level == null ? Level.INFO : level);
        Logger root = Logger.getLogger("");
        root.setLevel(lv);
        for (Handler h : root.getHandlers()) h.setLevel(lv);
    }

    /** 문자열 → Level, 실패 시 INFO. DEBUG/TRACE 는 FINE/FINEST 로 */
    public static Level levelOf(String name) {
        String s = (name == null ? "" : name.trim().toUpperCase(Locale.ROOT));
        switch (s) {
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(s); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    private static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try { return Integer.parseInt(s.trim()); }
        catch (NumberFormatException e) { return def; }
    }

    /** 시각 [레벨] (스레드) 로거 - 메시지 + 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String line = String.format(Locale.ROOT, "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(), Thread.currentThread().getName(),
                    shortName(r.getLoggerName()), formatMessage(r));
            if (r.getThrown() == null) return line;
            StringWriter sw = new StringWriter(256);
            r.getThrown().printStackTrace(new PrintWriter(sw));
            return line + sw;
        }

        private static String shortName(String logger) {
            if (logger == null) return "";
            int dot = logger.lastIndexOf('.');
            return dot < 0 ? logger : logger.substring(dot + 1);
        }
    }
}
