package davshelf.server.webdav.exceptions;

import davshelf.server.webdav.WebdavStatus;

/** A filesystem operation failed for a reason no other exception describes. */
public class StorageException extends WebdavException {

    private static final long serialVersionUID = 1L;

    public StorageException(String message, Throwable cause) {
        super(WebdavStatus.SC_INTERNAL_SERVER_ERROR, message, cause);
    }
}
