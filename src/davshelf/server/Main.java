package davshelf.server;

import davshelf.server.util.Args;
import davshelf.server.util.Logging;
import davshelf.server.webdav.WebdavConfig;
import davshelf.server.webdav.WebdavServer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.logging.Level;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class Main {

    public static final String DAVSHELF_PATH = "DAVSHELF_PATH";
    public static final Path DEFAULT_DAVSHELF_DIR_PATH =
            Paths.get(System.getProperty("user.home"), ".davshelf");

    public static final Command<WebdavServer> SERVE = new Command<>("serve",
            "Share a local directory over WebDAV\n" +
                    "            The password can be set via an environment variable.",
            Main::serve,
            Stream.of(
                    new Command.Arg("webdav.root", "The directory to share", true),
                    new Command.Arg("webdav.port", "The listen port for the webdav endpoint", false, "8090"),
                    new Command.Arg("webdav.host", "The interface to listen on, all if unset", false),
                    new Command.Arg("webdav.allowed-extensions", "Comma separated file extensions that may be served, all if unset", false),
                    new Command.Arg("webdav.allow-hidden", "Serve files and directories whose name starts with a period", false, "false"),
                    new Command.Arg("webdav.lock.sweep-seconds", "Interval between removals of expired locks, 0 to only expire them on access",
                            false, Integer.toString(WebdavConfig.DEFAULT_LOCK_SWEEP_SECONDS)),
                    new Command.Arg("webdav.username", "Webdav username, no authentication if unset", false),
                    new Command.Arg("WEBDAV_PASSWORD", "Webdav password, required with webdav.username", false),
                    new Command.Arg("webdav.authorization.scheme", "The auth scheme used in the HTTP Authorization request header. Options are: basic or digest", false, "digest"),
                    new Command.Arg("log-level", "The java.util.logging level", false, "INFO"),
                    new Command.Arg("log-to-file", "Also log to davshelf.%g.log in " + DAVSHELF_PATH, false, "false")
            ).collect(Collectors.toList())
    );

    public static final Command<Void> MAIN = new Command<>("davshelf",
            "A WebDAV file server",
            args -> {
                System.out.println("Run with -help to show options");
                return null;
            },
            Collections.emptyList(),
            Collections.singletonList(SERVE)
    );

    public static WebdavServer serve(Args args) {
        try {
            WebdavServer server = WebdavServer.start(args);
            server.join();
            return server;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static void main(String[] args) {
        try {
            MAIN.main(Args.parse(args));
        } catch (Throwable e) {
            e.printStackTrace();
            Logging.LOG().log(Level.SEVERE, e, () -> e.getMessage());
            System.exit(-1);
        }
    }
}
