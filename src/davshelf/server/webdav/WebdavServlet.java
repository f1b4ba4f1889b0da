/*
 * Copyright 1999,2004 The Apache Software Foundation.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package davshelf.server.webdav;

import davshelf.server.util.Logging;
import davshelf.server.webdav.exceptions.StorageException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.locking.LockManager;
import davshelf.server.webdav.methods.*;
import davshelf.server.webdav.store.IWebdavStore;
import davshelf.server.webdav.store.LocalFileSystemStore;
import davshelf.server.webdav.xml.XMLWriter;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Servlet serving one upload directory over WebDAV class 1, with the advisory locks of class 2. The original class
 * is org.apache.catalina.servlets.WebdavServlet by Remy Maucherat, which was heavily changed.
 *
 * Methods without a handler here fall through to {@link HttpServlet}.
 *
 * @author Remy Maucherat
 */
public class WebdavServlet extends HttpServlet {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = Logging.LOG();

    private final WebdavConfig config;
    private final IWebdavStore store;
    private final SecurityGate gate;
    private final LockManager locks;
    private final DelegateNotifier notifier;
    private final Map<String, IMethodExecutor> methodMap = new HashMap<>();
    private ScheduledExecutorService lockSweeper;

    public WebdavServlet( WebdavConfig config,
                          WebdavDelegate delegate ) {
        this(config, delegate, new LocalFileSystemStore(), new LockManager());
    }

    public WebdavServlet( WebdavConfig config,
                          WebdavDelegate delegate,
                          IWebdavStore store,
                          LockManager locks ) {
        this.config = config;
        this.store = store;
        this.gate = new SecurityGate(config);
        this.locks = locks;
        this.notifier = new DelegateNotifier(delegate);

        register("OPTIONS", new DoOptions());
        register("GET", new DoGet(store, gate, notifier));
        register("HEAD", new DoHead(store, gate, notifier));
        register("PUT", new DoPut(store, gate, notifier));
        register("DELETE", new DoDelete(store, gate, notifier));
        register("MKCOL", new DoMkcol(store, gate, notifier));
        register("COPY", new DoCopy(store, gate, notifier));
        register("MOVE", new DoMove(store, gate, notifier));
        register("PROPFIND", new DoPropfind(store, gate, locks));
        register("LOCK", new DoLock(store, gate, locks));
        register("UNLOCK", new DoUnlock(gate, locks));
    }

    protected IMethodExecutor register( String methodName,
                                        IMethodExecutor method ) {
        methodMap.put(methodName, method);
        return method;
    }

    @Override
    public void init() throws ServletException {
        LOG.info("Serving " + config);
        int sweepSeconds = config.getLockSweepSeconds();
        if (sweepSeconds > 0) {
            lockSweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "webdav-lock-sweeper");
                t.setDaemon(true);
                return t;
            });
            lockSweeper.scheduleWithFixedDelay(locks::sweepExpired, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);
        }
    }

    @Override
    public void destroy() {
        if (lockSweeper != null) {
            lockSweeper.shutdownNow();
        }
        notifier.shutdown();
        super.destroy();
    }

    public LockManager getLockManager() {
        return locks;
    }

    public SecurityGate getSecurityGate() {
        return gate;
    }

    /**
     * Blocks until every delegate notification of a completed request has been delivered.
     */
    public void flushNotifications() {
        notifier.flush();
    }

    /**
     * Handles the special WebDAV methods.
     */
    @Override
    protected void service( HttpServletRequest req,
                            HttpServletResponse resp ) throws ServletException, IOException {

        String methodName = req.getMethod();
        debugRequest(methodName, req);

        IMethodExecutor methodExecutor = methodMap.get(methodName);
        if (methodExecutor == null) {
            super.service(req, resp);
            return;
        }

        try {
            methodExecutor.execute(req, resp);
        } catch (StorageException e) {
            LOG.log(Level.WARNING, e, () -> methodName + " " + req.getRequestURI() + " failed");
            sendError(resp, e);
        } catch (WebdavException e) {
            LOG.fine(methodName + " " + req.getRequestURI() + ": " + e.getStatusLine() + " " + e.getMessage());
            sendError(resp, e);
        } catch (IOException e) {
            LOG.log(Level.WARNING, e, () -> methodName + " " + req.getRequestURI() + " failed");
            sendError(resp, new StorageException("I/O failure", e));
        }
    }

    /**
     * Answers with the exception's status and, when it names a precondition, a DAV:error body. Never lets the
     * container render its own error page, which would echo paths back to the client.
     */
    private void sendError( HttpServletResponse resp,
                            WebdavException e ) throws IOException {
        if (resp.isCommitted()) {
            LOG.fine("Response already committed, cannot report " + e.getStatusLine());
            return;
        }
        resp.reset();
        resp.setStatus(e.getStatus());
        if (e.getCondition() == null) {
            resp.setContentLength(0);
            return;
        }
        String body = "<?xml version=\"1.0\" encoding=\"utf-8\" ?>\n"
                + "<D:error xmlns:D=\"DAV:\"><D:" + XMLWriter.escape(e.getCondition()) + "/></D:error>\n";
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        resp.setContentType("application/xml; charset=utf-8");
        resp.setContentLength(bytes.length);
        resp.getOutputStream().write(bytes);
    }

    private void debugRequest( String methodName,
                               HttpServletRequest req ) {
        if (! LOG.isLoggable(Level.FINE))
            return;
        LOG.fine("WebdavServlet request: " + methodName + " " + req.getRequestURI());
        Enumeration<String> e = req.getHeaderNames();
        while (e.hasMoreElements()) {
            String s = e.nextElement();
            // credentials stay out of the log
            if (s.equalsIgnoreCase("Authorization"))
                continue;
            LOG.fine("header: " + s + " " + req.getHeader(s));
        }
    }
}
