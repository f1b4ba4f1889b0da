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
import davshelf.server.webdav.exceptions.ObjectNotFoundException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.propfind.PropertyResponseBuilder;
import davshelf.server.webdav.store.IWebdavStore;
import davshelf.server.webdav.store.Resource;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * HEAD, and the header half of GET. Bodies are left to {@link DoGet}.
 */
public class DoHead extends AbstractStoreMethod {

    public DoHead( IWebdavStore store,
                   SecurityGate gate,
                   DelegateNotifier notifier ) {
        super(store, gate, notifier);
    }

    @Override
    public void execute( HttpServletRequest req,
                         HttpServletResponse resp ) throws IOException, WebdavException {
        logger.fine("-- " + this.getClass().getName());

        AuthorizedPath path = gate.authorize(getRelativePath(req));
        Resource resource = store.getResource(path)
                .orElseThrow(() -> new ObjectNotFoundException(path.path()));
        gate.checkExtension(path, resource.isCollection());

        if (resource.isCollection()) {
            resp.setStatus(WebdavStatus.SC_OK);
            folderBody(path, req, resp);
            return;
        }

        String eTag = resource.getETag();
        String eTagMatch = req.getHeader("If-None-Match");
        if (eTagMatch != null && eTagMatch.equals(eTag)) {
            resp.setStatus(WebdavStatus.SC_NOT_MODIFIED);
            return;
        }

        resp.setStatus(WebdavStatus.SC_OK);
        resp.setHeader("Last-Modified", PropertyResponseBuilder.lastModifiedDateFormat(resource.getLastModified()));
        resp.setHeader("ETag", eTag);
        resp.setContentType(resource.getMimeType());
        resp.setContentLengthLong(resource.getSize());
        doBody(path, resp);
    }

    protected void folderBody( AuthorizedPath path,
                               HttpServletRequest req,
                               HttpServletResponse resp ) throws IOException, WebdavException {
        // no body for HEAD
        resp.setContentType("text/html; charset=utf-8");
    }

    protected void doBody( AuthorizedPath path,
                           HttpServletResponse resp ) throws IOException, WebdavException {
        // no body for HEAD
    }
}
