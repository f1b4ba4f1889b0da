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
import davshelf.server.webdav.exceptions.BadRequestException;
import davshelf.server.webdav.exceptions.ObjectNotFoundException;
import davshelf.server.webdav.exceptions.PathRejectedException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.store.IWebdavStore;
import davshelf.server.webdav.store.Resource;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

public class DoDelete extends AbstractStoreMethod {

    public DoDelete( IWebdavStore store,
                     SecurityGate gate,
                     DelegateNotifier notifier ) {
        super(store, gate, notifier);
    }

    @Override
    public void execute( HttpServletRequest req,
                         HttpServletResponse resp ) throws IOException, WebdavException {
        logger.fine("-- " + this.getClass().getName());

        String depth = req.getHeader("Depth");
        if (depth != null && ! depth.trim().equalsIgnoreCase("infinity"))
            throw new BadRequestException("DELETE requires Depth: infinity, got " + depth);

        AuthorizedPath path = gate.authorize(getRelativePath(req));
        if (path.isRoot())
            throw new PathRejectedException("Cannot delete the upload directory");
        Resource resource = store.getResource(path)
                .orElseThrow(() -> new ObjectNotFoundException(path.path()));
        gate.checkExtension(path, resource.isCollection());

        if (! notifier.hooks().shouldDeleteItemAtPath(path.file()))
            throw new AccessDeniedException("Delete refused for " + path);
        store.removeObject(path);

        logger.fine("Deleted " + path);
        notifier.notify(d -> d.didDeleteItemAtPath(path.file()));
        sendStatus(resp, WebdavStatus.SC_NO_CONTENT);
    }
}
