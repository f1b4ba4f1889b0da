package davshelf.server.util;

import java.io.*;
import java.nio.file.Path;
import java.util.logging.*;

public class Logging {
    private static final Logger LOG = Logger.getLogger("davshelf");

    private static boolean isInitialised = false;
    public static Logger LOG() {
        return LOG;
    }

    /**
     * Initialise logging to a file in DAVSHELF_PATH
     * @param a
     */
    public static synchronized void init(Args a) {
        Path logPath = a.fromDavshelfDir("log-name", "davshelf.%g.log");
        int logLimit = a.getInt("log-limit", 1024 * 1024);
        int logCount = a.getInt("log-count", 10);
        boolean logAppend = a.getBoolean("log-append", true);
        boolean logToConsole = a.getBoolean("log-to-console", true);
        boolean logToFile = a.getBoolean("log-to-file", false);
        String level = a.getArg("log-level", "INFO");

        init(logPath, logLimit, logCount, logAppend, logToConsole, logToFile, Level.parse(level));
    }

    public static synchronized void init(Path logPath,
                                         int logLimit,
                                         int logCount,
                                         boolean logAppend,
                                         boolean logToConsole,
                                         boolean logToFile,
                                         Level level) {

        if (isInitialised)
            return;

        try {
            LOG().setLevel(level);
            // also logging to stdout?
            if (! logToConsole)
                LOG().setUseParentHandlers(false);

            Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
                long id = thread.getId();
                String name = thread.getName();
                String msg = "Uncaught Exception in thread " + id + ":" + name;
                LOG().log(Level.SEVERE, msg, throwable);
            });

            if (! logToFile)
                return;

            File parent = logPath.toFile().getParentFile();
            if (parent != null)
                parent.mkdirs();
            String logPathS = logPath.toString();
            FileHandler fileHandler = new FileHandler(logPathS, logLimit, logCount, logAppend);
            fileHandler.setFormatter(new SimpleFormatter());
            fileHandler.setLevel(level);

            // tell console where we're logging to
            LOG().info("Logging to "+ logPathS.replace("%g", "0"));

            LOG().addHandler(fileHandler);
        } catch (IOException ioe) {
            throw new IllegalStateException(ioe.getMessage(), ioe);
        } finally {
            isInitialised = true;
        }
    }
}
