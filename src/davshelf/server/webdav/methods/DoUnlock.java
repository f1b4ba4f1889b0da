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
import davshelf.server.webdav.SecurityGate;
import davshelf.server.webdav.WebdavStatus;
import davshelf.server.webdav.exceptions.BadRequestException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.locking.LockManager;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

public class DoUnlock extends AbstractMethod {

    private final SecurityGate gate;
    private final LockManager locks;

    public DoUnlock( SecurityGate gate,
                     LockManager locks ) {
        this.gate = gate;
        this.locks = locks;
    }

    @Override
    public void execute( HttpServletRequest req,
                         HttpServletResponse resp ) throws WebdavException {
        logger.fine("-- " + this.getClass().getName());

        AuthorizedPath path = gate.authorize(getRelativePath(req));
        String lockId = getLockIdFromLockTokenHeader(req);
        if (lockId == null)
            throw new BadRequestException("Missing Lock-Token header");

        locks.unlock(path.path(), lockId);
        sendStatus(resp, WebdavStatus.SC_NO_CONTENT);
    }
}
