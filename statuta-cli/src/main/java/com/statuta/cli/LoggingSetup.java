package com.statuta.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * 命令行的日志配置
 *
 * <p>先读取类路径上的 logging.properties（输出格式与默认级别），再让根 logger
 * 只保留一个输出到 stderr 的 handler，不干扰标准输出上的报告。</p>
 */
final class LoggingSetup {

    static final String CONFIG_RESOURCE = "/logging.properties";

    private LoggingSetup() {}

    static Handler install(boolean verbose) {
        return install(System.err, verbose);
    }

    static Handler install(OutputStream out, boolean verbose) {
        IOException configFailure = null;
        try (InputStream in = LoggingSetup.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            configFailure = e;
        }

        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(out, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        Level level = verbose ? Level.FINE : Level.INFO;
        stderrHandler.setLevel(level);
        rootLogger.setLevel(level);
        Logger.getLogger("com.statuta").setLevel(level);
        rootLogger.addHandler(stderrHandler);

        if (configFailure != null) {
            rootLogger.log(Level.WARNING, "Cannot read " + CONFIG_RESOURCE + ", using defaults", configFailure);
        }
        return stderrHandler;
    }
}
