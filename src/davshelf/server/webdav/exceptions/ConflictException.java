package davshelf.server.webdav.exceptions;

import davshelf.server.webdav.WebdavStatus;

/** A required parent collection is missing, or an UNLOCK names a path that holds no lock. */
public class ConflictException extends WebdavException {

    private static final long serialVersionUID = 1L;

    private final String condition;

    public ConflictException(String message) {
        this(message, null);
    }

    public ConflictException(String message, String condition) {
        super(WebdavStatus.SC_CONFLICT, message);
        this.condition = condition;
    }

    @Override
    public String getCondition() {
        return condition;
    }
}
