package davshelf.server.webdav.exceptions;

import davshelf.server.webdav.WebdavStatus;

public class MethodNotAllowedException extends WebdavException {

    private static final long serialVersionUID = 1L;

    public MethodNotAllowedException(String message) {
        super(WebdavStatus.SC_METHOD_NOT_ALLOWED, message);
    }
}
