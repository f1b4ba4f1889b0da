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
import davshelf.server.webdav.locking.LockScope;
import davshelf.server.webdav.locking.LockToken;
import davshelf.server.webdav.propfind.Depth;
import davshelf.server.webdav.propfind.PropertyResponseBuilder;
import davshelf.server.webdav.store.IWebdavStore;
import davshelf.server.webdav.store.Resource;
import davshelf.server.webdav.xml.XMLHelper;
import davshelf.server.webdav.xml.XMLWriter;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Grants every LOCK. The token is recorded in the {@link LockManager} and echoed back, but no method checks it
 * before writing: this is what lets Finder and Office mount the share read-write, not a concurrency control.
 * The target need not exist and is not created.
 */
public class DoLock extends AbstractMethod {

    private final IWebdavStore store;
    private final SecurityGate gate;
    private final LockManager locks;

    public DoLock( IWebdavStore store,
                   SecurityGate gate,
                   LockManager locks ) {
        this.store = store;
        this.gate = gate;
        this.locks = locks;
    }

    @Override
    public void execute( HttpServletRequest req,
                         HttpServletResponse resp ) throws IOException, WebdavException {
        logger.fine("-- " + this.getClass().getName());

        AuthorizedPath path = gate.authorize(getRelativePath(req));
        Optional<Resource> resource = store.getResource(path);
        if (resource.isPresent())
            gate.checkExtension(path, resource.get().isCollection());
        else
            gate.checkExtension(path, false);

        Depth depth = getDepth(req);
        if (depth == Depth.ONE)
            throw new BadRequestException("LOCK with Depth: 1");

        LockInfo lockInfo = getLockInformation(readBody(req));
        int timeout = LockManager.parseTimeout(req.getHeader("Timeout"));
        String[] presented = getLockIdFromIfHeader(req);
        Optional<String> presentedToken = presented == null ? Optional.empty() : Optional.of(presented[0]);

        LockToken lock = locks.lock(path.path(), lockInfo.scope, lockInfo.owner,
                depth == Depth.ZERO ? 0 : LockToken.INFINITE_DEPTH, timeout, presentedToken);

        resp.addHeader("Lock-Token", lock.toHeaderValue());
        sendXml(resp, WebdavStatus.SC_OK, generateXMLReport(lock));
    }

    /**
     * Reads a lockinfo body. A missing body asks for an exclusive write lock without owner.
     */
    LockInfo getLockInformation( byte[] body ) throws BadRequestException {
        LockInfo info = new LockInfo();
        if (body.length == 0 || new String(body, StandardCharsets.UTF_8).trim().isEmpty())
            return info;

        Element lockInfoNode = XMLHelper.parse(body)
                .orElseThrow(() -> new BadRequestException("Malformed LOCK body"));
        if (! "lockinfo".equals(XMLHelper.localNameOf(lockInfoNode)))
            throw new BadRequestException("Expected lockinfo, got " + XMLHelper.localNameOf(lockInfoNode));

        Node scope = XMLHelper.firstSubElement(XMLHelper.findSubElement(lockInfoNode, "lockscope"));
        if (scope != null && LockScope.SHARED.elementName().equals(XMLHelper.localNameOf(scope)))
            info.scope = LockScope.SHARED;

        Node owner = XMLHelper.findSubElement(lockInfoNode, "owner");
        if (owner != null) {
            Node href = XMLHelper.findSubElement(owner, "href");
            String text = XMLHelper.textOf(href != null ? href : owner);
            info.owner = text == null || text.isEmpty() ? null : text;
        }
        return info;
    }

    private String generateXMLReport( LockToken lock ) {
        XMLWriter generatedXML = new XMLWriter(PropertyResponseBuilder.namespaces());
        generatedXML.writeXMLHeader();
        generatedXML.writeElement("DAV::prop", XMLWriter.OPENING);
        generatedXML.writeElement("DAV::lockdiscovery", XMLWriter.OPENING);
        PropertyResponseBuilder.writeActiveLock(generatedXML, lock);
        generatedXML.writeElement("DAV::lockdiscovery", XMLWriter.CLOSING);
        generatedXML.writeElement("DAV::prop", XMLWriter.CLOSING);
        return generatedXML.toString();
    }

    static final class LockInfo {
        LockScope scope = LockScope.EXCLUSIVE;
        String owner;
    }
}
