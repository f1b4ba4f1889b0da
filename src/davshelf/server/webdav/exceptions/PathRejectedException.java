package davshelf.server.webdav.exceptions;

import davshelf.server.webdav.WebdavStatus;

/** The request path escapes the upload directory, names a hidden item or has a disallowed extension. */
public class PathRejectedException extends WebdavException {

    private static final long serialVersionUID = 1L;

    public PathRejectedException(String message) {
        super(WebdavStatus.SC_FORBIDDEN, message);
    }
}
