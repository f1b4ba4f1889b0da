package davshelf.server.webdav.propfind;

import davshelf.server.util.Logging;
import davshelf.server.webdav.AuthorizedPath;
import davshelf.server.webdav.SecurityGate;
import davshelf.server.webdav.exceptions.ObjectNotFoundException;
import davshelf.server.webdav.exceptions.PathRejectedException;
import davshelf.server.webdav.exceptions.UnsupportedRequestException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.store.IWebdavStore;
import davshelf.server.webdav.store.Resource;
import davshelf.server.webdav.xml.XMLWriter;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Builds the multistatus body of a PROPFIND: the target itself and, at depth 1, each visible direct child.
 * Infinite depth is refused so a single request can never walk a whole tree.
 */
public class PropfindWalker {

    private static final Logger LOG = Logging.LOG();

    private final IWebdavStore store;
    private final SecurityGate gate;
    private final PropertyResponseBuilder builder;

    public PropfindWalker(IWebdavStore store, SecurityGate gate, PropertyResponseBuilder builder) {
        this.store = store;
        this.gate = gate;
        this.builder = builder;
    }

    public String walk(AuthorizedPath root, Depth depth, PropertySet properties) throws WebdavException {
        if (depth == Depth.INFINITY)
            throw UnsupportedRequestException.forbidden("Infinite depth PROPFIND of " + root);

        Resource resource = store.getResource(root)
                .orElseThrow(() -> new ObjectNotFoundException(root.path()));
        gate.checkExtension(root, resource.isCollection());

        XMLWriter generatedXML = new XMLWriter(PropertyResponseBuilder.namespaces());
        generatedXML.writeXMLHeader();
        generatedXML.writeElement("DAV::multistatus", XMLWriter.OPENING);
        builder.writeResponse(generatedXML, resource, properties);

        if (depth == Depth.ONE && resource.isCollection()) {
            int listed = 0;
            for (String name : store.getChildrenNames(root)) {
                Optional<Resource> child = visibleChild(root, name);
                if (child.isPresent()) {
                    builder.writeResponse(generatedXML, child.get(), properties);
                    listed++;
                }
            }
            LOG.fine("PROPFIND " + root + " listed " + listed + " children");
        }

        generatedXML.writeElement("DAV::multistatus", XMLWriter.CLOSING);
        return generatedXML.toString();
    }

    private Optional<Resource> visibleChild(AuthorizedPath parent, String name) throws WebdavException {
        if (! gate.isHiddenAllowed(name))
            return Optional.empty();
        AuthorizedPath childPath;
        try {
            childPath = gate.authorize(parent.isRoot() ? "/" + name : parent.path() + "/" + name);
        } catch (PathRejectedException e) {
            // symbolic link leading out of the upload directory
            return Optional.empty();
        }
        // a child removed since the listing is simply left out
        Optional<Resource> child = store.getResource(childPath);
        if (child.isPresent() && ! gate.isVisible(name, child.get().isCollection()))
            return Optional.empty();
        return child;
    }
}
