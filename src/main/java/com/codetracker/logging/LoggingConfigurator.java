package com.codetracker.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import com.codetracker.config.LoggingConfig;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Applies {@link LoggingConfig} to the running Logback context: the level of the application
 * loggers and a size-rolled log file. Safe to call again after a configuration reload.
 */
public final class LoggingConfigurator {

    static final String FILE_APPENDER_NAME = "TRACKER_FILE";
    static final String APPLICATION_LOGGER = "com.codetracker";
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";

    private LoggingConfigurator() {
    }

    public static void apply(LoggingConfig config) throws IOException {
        Objects.requireNonNull(config, "config");
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        synchronized (context) {
            context.getLogger(APPLICATION_LOGGER).setLevel(Level.toLevel(config.level(), Level.INFO));
            replaceFileAppender(context, config);
        }
    }

    public static void detachFileAppender() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        synchronized (context) {
            stopFileAppender(context.getLogger(Logger.ROOT_LOGGER_NAME));
        }
    }

    private static void replaceFileAppender(LoggerContext context, LoggingConfig config) throws IOException {
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        stopFileAppender(root);

        Path logPath = Path.of(config.file()).toAbsolutePath();
        if (logPath.getParent() != null) {
            Files.createDirectories(logPath.getParent());
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setName(FILE_APPENDER_NAME);
        appender.setContext(context);
        appender.setFile(logPath.toString());
        appender.setEncoder(encoder);

        int rotationCount = config.rotationCount() == null ? 3 : config.rotationCount();
        int maxSizeMb = config.maxSizeMB() == null ? 10 : config.maxSizeMB();

        FixedWindowRollingPolicy rollingPolicy = new FixedWindowRollingPolicy();
        rollingPolicy.setContext(context);
        rollingPolicy.setParent(appender);
        rollingPolicy.setFileNamePattern(logPath + ".%i");
        rollingPolicy.setMinIndex(1);
        rollingPolicy.setMaxIndex(Math.max(1, rotationCount));
        rollingPolicy.start();

        SizeBasedTriggeringPolicy<ILoggingEvent> triggeringPolicy = new SizeBasedTriggeringPolicy<>();
        triggeringPolicy.setContext(context);
        triggeringPolicy.setMaxFileSize(FileSize.valueOf(maxSizeMb + "MB"));
        triggeringPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        appender.setTriggeringPolicy(triggeringPolicy);
        appender.start();

        root.addAppender(appender);
    }

    private static void stopFileAppender(Logger root) {
        Appender<ILoggingEvent> previous = root.getAppender(FILE_APPENDER_NAME);
        if (previous != null) {
            root.detachAppender(previous);
            previous.stop();
        }
    }
}
