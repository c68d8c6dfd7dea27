package com.progmail.util;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Locale;
import java.util.logging.*;

/**
 * Centralized logging for the mail assembler.
 * Thin wrapper around java.util.logging with a simpler interface.
 */
public class LoggingUtil {

    private static final Logger logger = Logger.getLogger("com.progmail");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;

    // Flushes after every record so console output interleaves with stderr
    private static class FlushingHandler extends StreamHandler {
        FlushingHandler(OutputStream out, Level level) {
            super(out, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Initialize the logging system. Only the first call takes effect.
     *
     * @param levelStr       TRACE, DEBUG, INFO, WARNING or SEVERE
     * @param consoleEnabled write to stdout, with SEVERE going to stderr
     * @param fileName       log file, or null/empty for none
     */
    public static synchronized void initialize(String levelStr, boolean consoleEnabled, String fileName) {
        if (initialized) {
            return;
        }

        currentLevel = parseLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            FlushingHandler out = new FlushingHandler(System.out, currentLevel);
            out.setFilter(record -> record.getLevel().intValue() < Level.SEVERE.intValue());
            logger.addHandler(out);
            logger.addHandler(new FlushingHandler(System.err, Level.SEVERE));
        }

        String logFileName = null;
        if (fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                logFileName = fileName;
            } catch (IOException e) {
                // initialized is not set yet, so log through the logger directly
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        debug("Logging initialized: level=" + currentLevel +
                ", console=" + consoleEnabled +
                ", file=" + (logFileName != null ? logFileName : "disabled"));
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) {
            return Level.INFO;
        }
        switch (levelStr.trim().toUpperCase(Locale.ROOT)) {
            case "SEVERE": case "ERROR": return Level.SEVERE;
            case "WARNING": case "WARN": return Level.WARNING;
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            default: return Level.INFO;
        }
    }

    private static void clearHandlers() {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
        }
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, null);
        }
    }
}
