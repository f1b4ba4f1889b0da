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
import davshelf.server.webdav.exceptions.MethodNotAllowedException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.store.IWebdavStore;
import davshelf.server.webdav.store.Resource;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores a request body as a file. The body is spooled next to its destination and renamed over it once the
 * upload hook approved it, so readers never see a partial file.
 */
public class DoPut extends AbstractStoreMethod {

    public DoPut( IWebdavStore store,
                  SecurityGate gate,
                  DelegateNotifier notifier ) {
        super(store, gate, notifier);
    }

    @Override
    public void execute( HttpServletRequest req,
                         HttpServletResponse resp ) throws IOException, WebdavException {
        logger.fine("-- " + this.getClass().getName());

        if (req.getHeader("Content-Range") != null)
            throw new BadRequestException("Partial PUT is not supported");

        AuthorizedPath path = gate.authorizeFile(getRelativePath(req));
        requireParentCollection(path);
        Optional<Resource> existing = store.getResource(path);
        if (existing.isPresent() && existing.get().isCollection())
            throw new MethodNotAllowedException("PUT onto collection " + path);

        Path upload = store.createUploadFile(path);
        boolean committed = false;
        try {
            try (InputStream in = req.getInputStream()) {
                Files.copy(in, upload, StandardCopyOption.REPLACE_EXISTING);
            }
            if (! notifier.hooks().shouldUploadFileAtPath(path.file(), upload))
                throw new AccessDeniedException("Upload refused for " + path);
            store.commitUpload(upload, path);
            committed = true;
        } finally {
            if (! committed)
                store.discardUpload(upload);
        }

        logger.fine("Stored " + path);
        notifier.notify(d -> d.didUploadFileAtPath(path.file()));
        sendStatus(resp, existing.isPresent() ? WebdavStatus.SC_NO_CONTENT : WebdavStatus.SC_CREATED);
    }
}
