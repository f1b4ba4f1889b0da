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

import davshelf.server.webdav.ClientQuirk;
import davshelf.server.webdav.WebdavStatus;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

public class DoOptions extends AbstractMethod {

    public static final String ALLOWED_METHODS = "OPTIONS, GET, HEAD, PUT, DELETE, MKCOL, COPY, MOVE, PROPFIND, LOCK, UNLOCK";

    @Override
    public void execute( HttpServletRequest req,
                         HttpServletResponse resp ) {
        logger.fine("-- " + this.getClass().getName());

        ClientQuirk quirk = getClientQuirk(req);
        resp.addHeader("DAV", quirk.davCompliance());
        resp.addHeader("Allow", ALLOWED_METHODS);
        resp.addHeader("MS-Author-Via", "DAV");
        sendStatus(resp, WebdavStatus.SC_OK);
    }
}
