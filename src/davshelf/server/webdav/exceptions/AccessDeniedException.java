package davshelf.server.webdav.exceptions;

import davshelf.server.webdav.WebdavStatus;

/** An authorization hook of the embedding application refused the operation. */
public class AccessDeniedException extends WebdavException {

    private static final long serialVersionUID = 1L;

    public AccessDeniedException(String message) {
        super(WebdavStatus.SC_FORBIDDEN, message);
    }
}
