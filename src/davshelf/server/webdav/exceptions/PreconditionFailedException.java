package davshelf.server.webdav.exceptions;

import davshelf.server.webdav.WebdavStatus;

public class PreconditionFailedException extends WebdavException {

    private static final long serialVersionUID = 1L;

    private final String condition;

    public PreconditionFailedException(String message) {
        this(message, null);
    }

    public PreconditionFailedException(String message, String condition) {
        super(WebdavStatus.SC_PRECONDITION_FAILED, message);
        this.condition = condition;
    }

    @Override
    public String getCondition() {
        return condition;
    }
}
