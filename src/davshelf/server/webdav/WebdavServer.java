package davshelf.server.webdav;

import davshelf.server.util.Args;
import davshelf.server.util.Logging;
import org.eclipse.jetty.security.ConstraintMapping;
import org.eclipse.jetty.security.ConstraintSecurityHandler;
import org.eclipse.jetty.security.HashLoginService;
import org.eclipse.jetty.security.UserStore;
import org.eclipse.jetty.security.authentication.BasicAuthenticator;
import org.eclipse.jetty.security.authentication.DigestAuthenticator;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.util.security.Constraint;
import org.eclipse.jetty.util.security.Password;

import java.util.Collections;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

public class WebdavServer {

    public static final String VERSION = "0.1";
    private static final Logger logger = Logging.LOG();

    private final Server server;
    private final ServerConnector connector;
    private final WebdavServlet servlet;

    private WebdavServer(Server server, ServerConnector connector, WebdavServlet servlet) {
        this.server = server;
        this.connector = connector;
        this.servlet = servlet;
    }

    public static WebdavServer start(Args args) throws Exception {
        return start(args, WebdavConfig.fromArgs(args), WebdavDelegate.ALLOW_ALL);
    }

    /**
     * Starts serving config's upload directory. Port 0 picks a free port, see {@link #getPort()}.
     */
    public static WebdavServer start(Args args, WebdavConfig config, WebdavDelegate delegate) throws Exception {
        Optional<String> webdavUser = args.getOptionalArg("webdav.username");
        Optional<String> webdavPassword = args.getOptionalArg("WEBDAV_PASSWORD");
        // a user without a password must not fall back to an open share
        if (webdavUser.isPresent() && webdavPassword.isEmpty())
            throw new IllegalArgumentException("webdav.username is set but WEBDAV_PASSWORD is missing");

        int port = args.getInt("webdav.port", 8090);
        logger.info("Starting WEBDAV server version: " + VERSION + " on port: " + port);
        Server server = new Server();
        ServerConnector connector = new ServerConnector(server);
        connector.setHost(args.getArg("webdav.host", null));
        connector.setPort(port);
        server.setConnectors(new Connector[] {connector});

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");

        if (webdavUser.isPresent()) {
            server.setHandler(securityHandler(server, webdavUser.get(), webdavPassword.get(),
                    args.getOptionalArg("webdav.authorization.scheme"), context));
        } else {
            logger.warning("No webdav.username set, serving without authentication");
            server.setHandler(context);
        }

        WebdavServlet servlet = new WebdavServlet(config, delegate);
        ServletHolder holderDef = new ServletHolder("default", servlet);
        context.addServlet(holderDef, "/*");

        server.start();
        WebdavServer started = new WebdavServer(server, connector, servlet);
        logger.info("Webdav server started and ready to use at localhost:" + started.getPort());
        return started;
    }

    //info from:
    //https://stackoverflow.com/questions/44263651/hashloginservice-and-jetty9
    private static ConstraintSecurityHandler securityHandler(Server server,
                                                             String webdavUser,
                                                             String webdavPassword,
                                                             Optional<String> authorization,
                                                             ServletContextHandler context) {
        HashLoginService loginService = new HashLoginService("davshelf");
        UserStore userStore = new UserStore();
        userStore.addUser(webdavUser, new Password(webdavPassword), new String[] { "user"});
        loginService.setUserStore(userStore);
        server.addBean(loginService);

        ConstraintSecurityHandler security = new ConstraintSecurityHandler();

        Constraint constraint = new Constraint();
        constraint.setName("auth");
        constraint.setAuthenticate(true);
        constraint.setRoles(new String[] { "user"});

        ConstraintMapping mapping = new ConstraintMapping();
        mapping.setPathSpec("/*");
        mapping.setConstraint(constraint);

        security.setConstraintMappings(Collections.singletonList(mapping));
        String scheme = authorization.orElse("digest").toLowerCase(Locale.ROOT);
        if (scheme.equals("digest")) {
            logger.info("Using DIGEST authorization");
            security.setAuthenticator(new DigestAuthenticator());
        } else if (scheme.equals("basic")) {
            logger.info("Using BASIC authorization");
            security.setAuthenticator(new BasicAuthenticator());
        } else {
            throw new IllegalArgumentException("Unknown authorization scheme:" + scheme);
        }
        security.setLoginService(loginService);
        security.setHandler(context);
        return security;
    }

    /**
     * @return the port actually listened on
     */
    public int getPort() {
        return connector.getLocalPort();
    }

    public WebdavServlet getServlet() {
        return servlet;
    }

    public void join() throws InterruptedException {
        server.join();
    }

    public void stop() throws Exception {
        server.stop();
    }
}
