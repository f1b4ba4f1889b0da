package davshelf.server.webdav.locking;

public enum LockScope {
    EXCLUSIVE("exclusive"),
    SHARED("shared");

    private final String elementName;

    LockScope(String elementName) {
        this.elementName = elementName;
    }

    /**
     * @return the local name of the DAV: element naming this scope in lockinfo and activelock
     */
    public String elementName() {
        return elementName;
    }
}
