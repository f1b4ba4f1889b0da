package davshelf.server.webdav.exceptions;

import davshelf.server.webdav.WebdavStatus;

/**
 * Base of every failure a WebDAV method can report. Each subtype knows the HTTP status it is answered with, so
 * handlers throw and the dispatcher turns the exception into a response.
 */
public class WebdavException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int status;

    public WebdavException(int status, String message) {
        super(message);
        this.status = status;
    }

    public WebdavException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    /**
     * @return the local name of a DAV: precondition element to report in an error body, or null for an empty body
     */
    public String getCondition() {
        return null;
    }

    public String getStatusLine() {
        return status + " " + WebdavStatus.getStatusText(status);
    }
}
