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

import davshelf.server.webdav.exceptions.WebdavException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Handles one HTTP method. Failures that map to a status code are thrown as {@link WebdavException} and turned
 * into a response by the {@link WebdavServlet}.
 */
public interface IMethodExecutor {

    void execute( HttpServletRequest req,
                  HttpServletResponse resp ) throws IOException, WebdavException;
}
