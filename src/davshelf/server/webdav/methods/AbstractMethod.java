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

import davshelf.server.util.Logging;
import davshelf.server.webdav.ClientQuirk;
import davshelf.server.webdav.IMethodExecutor;
import davshelf.server.webdav.WebdavStatus;
import davshelf.server.webdav.exceptions.BadRequestException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.propfind.Depth;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public abstract class AbstractMethod implements IMethodExecutor {

    private static final Pattern MULTI_LOCK_PATTERN = Pattern.compile("(.*<.*locktoken\\:.+\\>.*).*(<.*locktoken\\:.+\\>.*)");
    private static final Pattern SINGLE_LOCK_PATTERN = Pattern.compile("(.*<.*locktoken\\:.+\\>.*)");
    private static final Pattern LOCK_TOKEN_PATTERN = Pattern.compile("(.*<??.*locktoken:)([a-zA-Z0-9\\-]+)(>??.*)");

    /**
     * size of the io-buffer
     */
    protected static final int BUF_SIZE = 65536;

    /**
     * Largest XML body read for PROPFIND and LOCK.
     */
    protected static final int MAX_XML_BODY = 1024 * 1024;

    protected static final String XML_CONTENT_TYPE = "application/xml; charset=utf-8";

    protected final Logger logger;

    protected AbstractMethod() {
        logger = Logging.LOG();
    }

    /**
     * Return the relative path associated with this servlet.
     *
     * @param request The servlet request we are processing
     * @return the relative path
     */
    protected String getRelativePath( HttpServletRequest request ) {
        String result = request.getPathInfo();
        if ((result == null) || (result.equals(""))) {
            result = "/";
        }
        return getCleanPath(result);
    }

    /**
     * removes a / at the end of the path string, if present
     *
     * @param path the path
     * @return the path without trailing /
     */
    protected String getCleanPath( String path ) {
        if (path.endsWith("/") && path.length() > 1) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    /**
     * reads the depth header from the request, absent meaning infinity
     */
    protected Depth getDepth( HttpServletRequest req ) throws BadRequestException {
        return Depth.parse(req.getHeader("Depth"));
    }

    protected ClientQuirk getClientQuirk( HttpServletRequest req ) {
        return ClientQuirk.detect(req::getHeader);
    }

    /**
     * Reads a small request body fully.
     *
     * @return the body, empty if there is none
     */
    protected byte[] readBody( HttpServletRequest req ) throws IOException, WebdavException {
        long declared = req.getContentLengthLong();
        if (declared > MAX_XML_BODY)
            throw new WebdavException(WebdavStatus.SC_REQUEST_TOO_LONG, "Request body of " + declared + " bytes");
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        try (InputStream in = req.getInputStream()) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                body.write(buffer, 0, read);
                if (body.size() > MAX_XML_BODY)
                    throw new WebdavException(WebdavStatus.SC_REQUEST_TOO_LONG, "Request body too large");
            }
        }
        return body.toByteArray();
    }

    /**
     * @return true if the request carries at least one body byte
     */
    protected boolean hasBody( HttpServletRequest req ) throws IOException {
        if (req.getContentLengthLong() > 0)
            return true;
        return req.getInputStream().read() != -1;
    }

    protected String[] getLockIdFromIfHeader( HttpServletRequest req ) {
        String id = req.getHeader("If");
        if (id == null) {
            return null;
        }
        id = id.trim();
        if (id.length() == 0) {
            return null;
        }
        return lockTokensFrom(id);
    }

    protected String[] lockTokensFrom( String id ) {
        Matcher matcher = MULTI_LOCK_PATTERN.matcher(id);
        if (matcher.matches()) {
            return new String[] {lockIDFromToken(matcher.group(1)), lockIDFromToken(matcher.group(2))};
        }
        matcher = SINGLE_LOCK_PATTERN.matcher(id);
        if (matcher.matches()) {
            return new String[] {lockIDFromToken(matcher.group(1))};
        }
        return null;
    }

    protected String lockIDFromToken( String token ) {
        Matcher matcher = LOCK_TOKEN_PATTERN.matcher(token);
        return matcher.matches() ? matcher.group(2) : token.trim();
    }

    protected String getLockIdFromLockTokenHeader( HttpServletRequest req ) {
        String id = req.getHeader("Lock-Token");
        if (id == null || id.trim().length() == 0) {
            return null;
        }
        return lockIDFromToken(id);
    }

    protected static void sendXml( HttpServletResponse resp,
                                   int status,
                                   String xml ) throws IOException {
        byte[] body = xml.getBytes(StandardCharsets.UTF_8);
        resp.setStatus(status);
        resp.setContentType(XML_CONTENT_TYPE);
        resp.setContentLength(body.length);
        resp.getOutputStream().write(body);
    }

    protected static void sendStatus( HttpServletResponse resp,
                                      int status ) {
        resp.setStatus(status);
        resp.setContentLength(0);
    }
}
