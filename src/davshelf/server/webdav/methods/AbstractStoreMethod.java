package davshelf.server.webdav.methods;

import davshelf.server.webdav.AuthorizedPath;
import davshelf.server.webdav.DelegateNotifier;
import davshelf.server.webdav.SecurityGate;
import davshelf.server.webdav.exceptions.ConflictException;
import davshelf.server.webdav.exceptions.WebdavException;
import davshelf.server.webdav.store.IWebdavStore;
import davshelf.server.webdav.store.Resource;

import java.util.Optional;

/**
 * Base of the methods that read or change stored resources.
 */
public abstract class AbstractStoreMethod extends AbstractMethod {

    protected final IWebdavStore store;
    protected final SecurityGate gate;
    protected final DelegateNotifier notifier;

    protected AbstractStoreMethod( IWebdavStore store,
                                   SecurityGate gate,
                                   DelegateNotifier notifier ) {
        this.store = store;
        this.gate = gate;
        this.notifier = notifier;
    }

    /**
     * @throws ConflictException unless the parent of path is an existing collection
     */
    protected void requireParentCollection( AuthorizedPath path ) throws WebdavException {
        AuthorizedPath parent = gate.authorize(path.parentPath());
        Optional<Resource> parentResource = store.getResource(parent);
        if (parentResource.isEmpty() || ! parentResource.get().isCollection())
            throw new ConflictException("Missing parent collection of " + path);
    }
}
