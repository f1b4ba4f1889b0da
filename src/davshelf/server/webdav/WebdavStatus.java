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

import jakarta.servlet.http.HttpServletResponse;

import java.util.HashMap;
import java.util.Map;

/**
 * HTTP and WebDAV status codes answered by the server, with their reason phrases for multistatus bodies.
 */
public class WebdavStatus {

    private static final Map<Integer, String> mapStatusCodes = new HashMap<>();

    public static final int SC_OK = HttpServletResponse.SC_OK;

    public static final int SC_CREATED = HttpServletResponse.SC_CREATED;

    public static final int SC_NO_CONTENT = HttpServletResponse.SC_NO_CONTENT;

    /**
     * Status code (304) indicating that a conditional GET operation found that the resource was available and not modified.
     */
    public static final int SC_NOT_MODIFIED = HttpServletResponse.SC_NOT_MODIFIED;

    public static final int SC_BAD_REQUEST = HttpServletResponse.SC_BAD_REQUEST;

    public static final int SC_FORBIDDEN = HttpServletResponse.SC_FORBIDDEN;

    public static final int SC_NOT_FOUND = HttpServletResponse.SC_NOT_FOUND;

    public static final int SC_INTERNAL_SERVER_ERROR = HttpServletResponse.SC_INTERNAL_SERVER_ERROR;

    /**
     * Status code (405) indicating the method specified is not allowed for the resource.
     */
    public static final int SC_METHOD_NOT_ALLOWED = 405;

    /**
     * Status code (409) indicating that the request could not be completed due to a conflict with the current state of the
     * resource.
     */
    public static final int SC_CONFLICT = 409;

    /**
     * Status code (412) indicating the precondition given in one or more of the request-header fields evaluated to false when it
     * was tested on the server.
     */
    public static final int SC_PRECONDITION_FAILED = 412;

    /**
     * Status code (413) indicating the request body is larger than the server is willing to buffer.
     */
    public static final int SC_REQUEST_TOO_LONG = 413;

    /**
     * Status code (415) indicating the server is refusing to service the request because the entity of the request is in a format
     * not supported by the requested resource for the requested method.
     */
    public static final int SC_UNSUPPORTED_MEDIA_TYPE = 415;

    /**
     * Status code (207) indicating that the response requires providing status for multiple independent operations.
     */
    public static final int SC_MULTI_STATUS = 207;

    static {
        addStatusCodeMap(SC_OK, "OK");
        addStatusCodeMap(SC_CREATED, "Created");
        addStatusCodeMap(SC_NO_CONTENT, "No Content");
        addStatusCodeMap(SC_NOT_MODIFIED, "Not Modified");
        addStatusCodeMap(SC_BAD_REQUEST, "Bad Request");
        addStatusCodeMap(SC_FORBIDDEN, "Forbidden");
        addStatusCodeMap(SC_NOT_FOUND, "Not Found");
        addStatusCodeMap(SC_INTERNAL_SERVER_ERROR, "Internal Server Error");
        addStatusCodeMap(SC_METHOD_NOT_ALLOWED, "Method Not Allowed");
        addStatusCodeMap(SC_CONFLICT, "Conflict");
        addStatusCodeMap(SC_PRECONDITION_FAILED, "Precondition Failed");
        addStatusCodeMap(SC_REQUEST_TOO_LONG, "Request Too Long");
        addStatusCodeMap(SC_UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type");
        addStatusCodeMap(SC_MULTI_STATUS, "Multi-Status");
    }

    /**
     * Returns the HTTP status text for the HTTP or WebDav status code specified by looking it up in the static mapping.
     *
     * @param nHttpStatusCode HTTP or WebDAV status code
     * @return A short descriptive phrase for the HTTP status code (e.g., "OK"), or an empty string when unknown
     */
    public static String getStatusText( int nHttpStatusCode ) {
        return mapStatusCodes.getOrDefault(nHttpStatusCode, "");
    }

    /**
     * @return the status line used inside multistatus bodies, e.g. "HTTP/1.1 200 OK"
     */
    public static String statusLine( int status ) {
        return "HTTP/1.1 " + status + " " + getStatusText(status);
    }

    private static void addStatusCodeMap( int nKey,
                                          String strVal ) {
        mapStatusCodes.put(nKey, strVal);
    }
}
