package davshelf.server.webdav.exceptions;

import davshelf.server.webdav.WebdavStatus;

public class ObjectNotFoundException extends WebdavException {

    private static final long serialVersionUID = 1L;

    public ObjectNotFoundException(String message) {
        super(WebdavStatus.SC_NOT_FOUND, message);
    }
}
