package davshelf.server.webdav.exceptions;

import davshelf.server.webdav.WebdavStatus;

public class BadRequestException extends WebdavException {

    private static final long serialVersionUID = 1L;

    public BadRequestException(String message) {
        super(WebdavStatus.SC_BAD_REQUEST, message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(WebdavStatus.SC_BAD_REQUEST, message, cause);
    }
}
