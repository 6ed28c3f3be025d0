package com.webshepherd.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * JUL 루트 핸들러 1회 구성(콘솔 + 롤링 파일). SLF4J 는 slf4j-jdk14 로 여기로 흘러온다.
 * 콘솔은 stderr 로 나가므로 CLI 요약 출력(stdout)과 섞이지 않는다.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) {
            root.removeHandler(h);
            h.close();
        }

        Formatter lineOnly = new Formatter() {
            @Override public String format(LogRecord r) {
                String msg = formatMessage(r);
                return (r.getThrown() == null ? msg : msg + " | " + r.getThrown()) + System.lineSeparator();
            }
        };

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(lineOnly);
        root.addHandler(console);

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                FileHandler file = new FileHandler(logDir.resolve("webshepherd-%g.log").toString(),
                        maxBytes, fileCount, true);
                file.setLevel(rootLevel);
                file.setFormatter(lineOnly);
                root.addHandler(file);
            } catch (IOException e) {
                root.warning("File logging disabled (" + logDir + "): " + e.getMessage());
            }
        }

        root.setLevel(rootLevel);
    }

    /** 콘솔만 */
    public static void init(Level rootLevel) {
        init(null, rootLevel, 0, 1);
    }
}
