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
import davshelf.server.webdav.exceptions.PathRejectedException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.store.IWebdavStore;
import davshelf.server.webdav.store.Resource;
import davshelf.server.webdav.xml.URLEncoder;
import davshelf.server.webdav.xml.XMLWriter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class DoGet extends DoHead {

    private static final URLEncoder URL_ENCODER = URLEncoder.forPaths();

    public DoGet( IWebdavStore store,
                  SecurityGate gate,
                  DelegateNotifier notifier ) {
        super(store, gate, notifier);
    }

    @Override
    protected void doBody( AuthorizedPath path,
                           HttpServletResponse resp ) throws IOException, WebdavException {
        OutputStream out = resp.getOutputStream();
        try (InputStream in = store.getResourceContent(path)) {
            byte[] copyBuffer = new byte[BUF_SIZE];
            int read;
            while ((read = in.read(copyBuffer)) != -1) {
                out.write(copyBuffer, 0, read);
            }
        }
        out.flush();
        notifier.notify(d -> d.didDownloadFileAtPath(path.file()));
    }

    /**
     * A minimal listing for browsers; DAV clients use PROPFIND.
     */
    @Override
    protected void folderBody( AuthorizedPath path,
                               HttpServletRequest req,
                               HttpServletResponse resp ) throws IOException, WebdavException {
        List<String> names = new ArrayList<>(store.getChildrenNames(path));
        Collections.sort(names);
        String base = req.getContextPath() + req.getServletPath() + (path.isRoot() ? "/" : path.path() + "/");

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html><head><meta charset=\"utf-8\"><title>")
                .append(XMLWriter.escape(path.path()))
                .append("</title></head><body>\n<h1>")
                .append(XMLWriter.escape(path.path()))
                .append("</h1>\n<ul>\n");
        for (String name : names) {
            if (! gate.isHiddenAllowed(name))
                continue;
            Optional<Resource> child;
            try {
                child = store.getResource(gate.authorize((path.isRoot() ? "" : path.path()) + "/" + name));
            } catch (PathRejectedException e) {
                continue;
            }
            if (child.isEmpty() || ! gate.isVisible(name, child.get().isCollection()))
                continue;
            String displayed = child.get().isCollection() ? name + "/" : name;
            html.append("<li><a href=\"")
                    .append(XMLWriter.escape(URL_ENCODER.encode(base + displayed)))
                    .append("\">")
                    .append(XMLWriter.escape(displayed))
                    .append("</a></li>\n");
        }
        html.append("</ul>\n</body></html>\n");

        byte[] body = html.toString().getBytes(StandardCharsets.UTF_8);
        resp.setContentType("text/html; charset=utf-8");
        resp.setContentLength(body.length);
        resp.getOutputStream().write(body);
    }
}
