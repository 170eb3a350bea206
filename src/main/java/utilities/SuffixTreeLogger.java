package utilities;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class SuffixTreeLogger {

    public static final String LOG_FILE_PROPERTY = "suffixtree.log.file";
    public static final String LOG_LEVEL_PROPERTY = "suffixtree.log.level";

    private static Logger logger;

    static {
        // Create or get the logger
        logger = Logger.getLogger(SuffixTreeLogger.class.getName());
        logger.setUseParentHandlers(false); // Disable default console handler

        Level level = parseLevel(System.getProperty(LOG_LEVEL_PROPERTY));

        // Console handler
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(level.intValue() < Level.INFO.intValue() ? Level.INFO : level);
        logger.addHandler(consoleHandler);

        String logFile = System.getProperty(LOG_FILE_PROPERTY);
        if (logFile != null && !logFile.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(logFile, true); // true = append mode
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            } catch (Exception e) {
                System.err.println("Failed to open log file " + logFile + ": " + e.getMessage());
            }
        }

        logger.setLevel(level);
    }

    static Level parseLevel(String name) {
        if (name == null || name.isBlank()) {
            return Level.INFO;
        }
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "ERROR":
                return Level.SEVERE;
            case "DEBUG":
                return Level.FINE;
            case "TRACE":
                return Level.FINEST;
            default:
                try {
                    return Level.parse(name.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    System.err.println("Unknown log level " + name + ", using INFO");
                    return Level.INFO;
                }
        }
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

}
