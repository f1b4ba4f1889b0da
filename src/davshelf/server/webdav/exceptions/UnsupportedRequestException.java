package davshelf.server.webdav.exceptions;

import davshelf.server.webdav.WebdavStatus;

/**
 * A well formed request this server deliberately does not serve: infinite depth PROPFIND (403) or a MKCOL with a
 * body (415).
 */
public class UnsupportedRequestException extends WebdavException {

    private static final long serialVersionUID = 1L;

    private UnsupportedRequestException(int status, String message) {
        super(status, message);
    }

    public static UnsupportedRequestException forbidden(String message) {
        return new UnsupportedRequestException(WebdavStatus.SC_FORBIDDEN, message);
    }

    public static UnsupportedRequestException unsupportedMediaType(String message) {
        return new UnsupportedRequestException(WebdavStatus.SC_UNSUPPORTED_MEDIA_TYPE, message);
    }
}
