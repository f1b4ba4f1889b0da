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

package davshelf.server.webdav.methods;

import davshelf.server.webdav.AuthorizedPath;
import davshelf.server.webdav.ClientQuirk;
import davshelf.server.webdav.SecurityGate;
import davshelf.server.webdav.WebdavStatus;
import davshelf.server.webdav.exceptions.ObjectNotFoundException;
import davshelf.server.webdav.exceptions.UnsupportedRequestException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.locking.LockManager;
import davshelf.server.webdav.propfind.Depth;
import davshelf.server.webdav.propfind.PropertyResponseBuilder;
import davshelf.server.webdav.propfind.PropertySet;
import davshelf.server.webdav.propfind.PropfindWalker;
import davshelf.server.webdav.store.IWebdavStore;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

public class DoPropfind extends AbstractMethod {

    private final IWebdavStore store;
    private final SecurityGate gate;
    private final LockManager locks;

    public DoPropfind( IWebdavStore store,
                       SecurityGate gate,
                       LockManager locks ) {
        this.store = store;
        this.gate = gate;
        this.locks = locks;
    }

    @Override
    public void execute( HttpServletRequest req,
                         HttpServletResponse resp ) throws IOException, WebdavException {
        logger.fine("-- " + this.getClass().getName());

        String requested = getRelativePath(req);
        ClientQuirk quirk = getClientQuirk(req);
        if (quirk.ignoresPropfindOf(requested.substring(requested.lastIndexOf('/') + 1)))
            throw new ObjectNotFoundException(requested);

        AuthorizedPath path = gate.authorize(requested);
        Depth depth = getDepth(req);
        if (depth == Depth.INFINITY)
            throw UnsupportedRequestException.forbidden("Infinite depth PROPFIND of " + path);
        PropertySet properties = PropertySet.parse(readBody(req));
        logger.fine("PROPFIND " + path + " depth " + depth.headerValue() + " " + properties);

        PropertyResponseBuilder builder = new PropertyResponseBuilder(req.getContextPath() + req.getServletPath(), locks);
        String multistatus = new PropfindWalker(store, gate, builder).walk(path, depth, properties);
        sendXml(resp, WebdavStatus.SC_MULTI_STATUS, multistatus);
    }
}
