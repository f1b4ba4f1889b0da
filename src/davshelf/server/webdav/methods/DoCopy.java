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
import davshelf.server.webdav.exceptions.PreconditionFailedException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.store.IWebdavStore;
import davshelf.server.webdav.store.Resource;
import org.eclipse.jetty.util.URIUtil;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;

/**
 * COPY, and through {@link DoMove} also MOVE: both take a Destination and an Overwrite header and answer 201 for
 * a new destination or 204 for a replaced one.
 */
public class DoCopy extends AbstractStoreMethod {

    private final boolean isMove;

    public DoCopy( IWebdavStore store,
                   SecurityGate gate,
                   DelegateNotifier notifier ) {
        this(store, gate, notifier, false);
    }

    protected DoCopy( IWebdavStore store,
                      SecurityGate gate,
                      DelegateNotifier notifier,
                      boolean isMove ) {
        super(store, gate, notifier);
        this.isMove = isMove;
    }

    @Override
    public void execute( HttpServletRequest req,
                         HttpServletResponse resp ) throws IOException, WebdavException {
        logger.fine("-- " + this.getClass().getName());

        boolean recursive = parseDepth(req.getHeader("Depth"));
        String destinationPath = parseDestinationHeader(req);
        boolean overwrite = shouldOverwrite(req);

        AuthorizedPath source = gate.authorize(getRelativePath(req));
        AuthorizedPath destination = gate.authorize(destinationPath);

        if (source.isRoot() || destination.isRoot())
            throw new PathRejectedException("Cannot " + methodName() + " the upload directory");
        if (source.equals(destination))
            throw new PathRejectedException("Source and destination are the same: " + source);
        if (destination.isDescendantOf(source))
            throw new PathRejectedException("Destination " + destination + " is inside " + source);
        // replacing an ancestor would delete the source before it is copied
        if (source.isDescendantOf(destination))
            throw new PathRejectedException("Destination " + destination + " contains " + source);

        Resource resource = store.getResource(source)
                .orElseThrow(() -> new ObjectNotFoundException(source.path()));
        gate.checkExtension(source, resource.isCollection());
        gate.checkExtension(destination, resource.isCollection());

        requireParentCollection(destination);
        Optional<Resource> existing = store.getResource(destination);
        if (existing.isPresent() && ! overwrite)
            throw new PreconditionFailedException("Destination exists: " + destination);

        if (isMove) {
            if (! notifier.hooks().shouldMoveItemFromPath(source.file(), destination.file()))
                throw new AccessDeniedException("Move refused for " + source);
            store.moveResource(source, destination);
            logger.fine("Moved " + source + " to " + destination);
            notifier.notify(d -> d.didMoveItemFromPath(source.file(), destination.file()));
        } else {
            if (! notifier.hooks().shouldCopyItemFromPath(source.file(), destination.file()))
                throw new AccessDeniedException("Copy refused for " + source);
            if (existing.isPresent())
                store.removeObject(destination);
            store.copyResource(source, destination, recursive);
            logger.fine("Copied " + source + " to " + destination);
            notifier.notify(d -> d.didCopyItemFromPath(source.file(), destination.file()));
        }

        sendStatus(resp, existing.isPresent() ? WebdavStatus.SC_NO_CONTENT : WebdavStatus.SC_CREATED);
    }

    private String methodName() {
        return isMove ? "move" : "copy";
    }

    /**
     * @return whether a collection is copied with its members
     */
    private boolean parseDepth( String depth ) throws BadRequestException {
        if (depth == null || depth.trim().equalsIgnoreCase("infinity"))
            return true;
        if (! isMove && depth.trim().equals("0"))
            return false;
        throw new BadRequestException("Invalid Depth for " + methodName() + ": " + depth);
    }

    /**
     * Overwrite is T unless the client sends F.
     */
    protected static boolean shouldOverwrite( HttpServletRequest req ) {
        String overwriteHeader = req.getHeader("Overwrite");
        return overwriteHeader == null || ! overwriteHeader.trim().equalsIgnoreCase("F");
    }

    /**
     * Turns the Destination header, an absolute URI or an absolute path, into a path relative to this servlet.
     *
     * @throws BadRequestException if the header is missing or cannot be decoded
     * @throws PathRejectedException if the destination climbs above the root
     */
    protected static String parseDestinationHeader( HttpServletRequest req ) throws WebdavException {
        String destinationPath = req.getHeader("Destination");

        if (destinationPath == null || destinationPath.trim().isEmpty()) {
            throw new BadRequestException("Missing Destination header");
        }
        destinationPath = destinationPath.trim();

        int protocolIndex = destinationPath.indexOf("://");
        if (protocolIndex >= 0) {
            // if the Destination URL contains the protocol, we can safely
            // trim everything upto the first "/" character after "://"
            int firstSeparator = destinationPath.indexOf("/", protocolIndex + 3);
            if (firstSeparator < 0) {
                destinationPath = "/";
            } else {
                destinationPath = destinationPath.substring(firstSeparator);
            }
        }

        int query = destinationPath.indexOf('?');
        if (query >= 0) {
            destinationPath = destinationPath.substring(0, query);
        }

        // Remove url encoding from destination
        try {
            destinationPath = URIUtil.decodePath(destinationPath);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Undecodable Destination " + destinationPath, e);
        }

        // Normalize destination path (remove '.' and' ..')
        destinationPath = normalize(destinationPath);
        if (destinationPath == null) {
            throw new PathRejectedException("Destination outside the upload directory");
        }

        String contextPath = req.getContextPath();
        if ((contextPath != null) && (destinationPath.startsWith(contextPath))) {
            destinationPath = destinationPath.substring(contextPath.length());
        }

        String servletPath = req.getServletPath();
        if ((servletPath != null) && (destinationPath.startsWith(servletPath))) {
            destinationPath = destinationPath.substring(servletPath.length());
        }

        return destinationPath.isEmpty() ? "/" : destinationPath;
    }

    /**
     * Return a context-relative path, beginning with a "/", that represents the canonical version of the specified path after
     * ".." and "." elements are resolved out. If the specified path attempts to go outside the boundaries of the current context
     * (i.e. too many ".." path elements are present), return <code>null</code> instead.
     *
     * @param path Path to be normalized
     * @return normalized path
     */
    protected static String normalize( String path ) {

        if (path == null) {
            return null;
        }

        // Create a place for the normalized path
        String normalized = path;

        // Normalize the slashes and add leading slash if necessary
        if (normalized.indexOf('\\') >= 0) {
            normalized = normalized.replace('\\', '/');
        }
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        if (normalized.endsWith("/.") || normalized.endsWith("/..")) {
            normalized = normalized + "/";
        }

        // Resolve occurrences of "//" in the normalized path
        while (true) {
            int index = normalized.indexOf("//");
            if (index < 0) {
                break;
            }
            normalized = normalized.substring(0, index) + normalized.substring(index + 1);
        }

        // Resolve occurrences of "/./" in the normalized path
        while (true) {
            int index = normalized.indexOf("/./");
            if (index < 0) {
                break;
            }
            normalized = normalized.substring(0, index) + normalized.substring(index + 2);
        }

        // Resolve occurrences of "/../" in the normalized path
        while (true) {
            int index = normalized.indexOf("/../");
            if (index < 0) {
                break;
            }
            if (index == 0) {
                return (null); // Trying to go outside our context
            }
            int index2 = normalized.lastIndexOf('/', index - 1);
            normalized = normalized.substring(0, index2) + normalized.substring(index + 3);
        }

        // Return the normalized path that we have completed
        return (normalized);
    }
}
