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
import davshelf.server.webdav.DelegateNotifier;
import davshelf.server.webdav.SecurityGate;
import davshelf.server.webdav.WebdavStatus;
import davshelf.server.webdav.exceptions.AccessDeniedException;
import davshelf.server.webdav.exceptions.MethodNotAllowedException;
import davshelf.server.webdav.exceptions.UnsupportedRequestException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.store.IWebdavStore;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

public class DoMkcol extends AbstractStoreMethod {

    public DoMkcol( IWebdavStore store,
                    SecurityGate gate,
                    DelegateNotifier notifier ) {
        super(store, gate, notifier);
    }

    @Override
    public void execute( HttpServletRequest req,
                         HttpServletResponse resp ) throws IOException, WebdavException {
        logger.fine("-- " + this.getClass().getName());

        if (hasBody(req))
            throw UnsupportedRequestException.unsupportedMediaType("MKCOL with a request body");

        AuthorizedPath path = gate.authorize(getRelativePath(req));
        if (path.isRoot() || store.getResource(path).isPresent())
            throw new MethodNotAllowedException("Already exists: " + path);
        requireParentCollection(path);

        if (! notifier.hooks().shouldCreateDirectoryAtPath(path.file()))
            throw new AccessDeniedException("Directory creation refused for " + path);
        store.createFolder(path);

        logger.fine("Created collection " + path);
        notifier.notify(d -> d.didCreateDirectoryAtPath(path.file()));
        sendStatus(resp, WebdavStatus.SC_CREATED);
    }
}
