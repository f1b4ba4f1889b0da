package davshelf.server.webdav.locking;

import java.time.Instant;
import java.util.Objects;

/**
 * A lock granted on one path. Immutable: a refresh replaces the entry in the {@link LockManager} with a copy
 * carrying the new expiry.
 */
public final class LockToken {

    public static final String SCHEME = "opaquelocktoken:";

    /** Depth value for locks that cover a whole collection tree. */
    public static final int INFINITE_DEPTH = -1;

    private final String id;
    private final String path;
    private final LockScope scope;
    private final String owner;
    private final int depth;
    private final int timeoutSeconds;
    private final Instant expiry;

    public LockToken(String id, String path, LockScope scope, String owner, int depth, int timeoutSeconds, Instant expiry) {
        this.id = id;
        this.path = path;
        this.scope = scope;
        this.owner = owner;
        this.depth = depth;
        this.timeoutSeconds = timeoutSeconds;
        this.expiry = expiry;
    }

    public String getId() {
        return id;
    }

    public String getPath() {
        return path;
    }

    public LockScope getScope() {
        return scope;
    }

    /**
     * @return the owner text supplied in lockinfo, or null
     */
    public String getOwner() {
        return owner;
    }

    public int getDepth() {
        return depth;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public Instant getExpiry() {
        return expiry;
    }

    public boolean isExpired(Instant now) {
        return ! now.isBefore(expiry);
    }

    /**
     * @return the token as it appears in lockdiscovery hrefs, "opaquelocktoken:ID"
     */
    public String getUri() {
        return SCHEME + id;
    }

    /**
     * @return the value of a Lock-Token response header, "&lt;opaquelocktoken:ID&gt;"
     */
    public String toHeaderValue() {
        return "<" + getUri() + ">";
    }

    LockToken refreshed(int timeoutSeconds, Instant expiry) {
        return new LockToken(id, path, scope, owner, depth, timeoutSeconds, expiry);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LockToken that = (LockToken) o;
        return id.equals(that.id) && path.equals(that.path) && expiry.equals(that.expiry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, path, expiry);
    }

    @Override
    public String toString() {
        return getUri() + " on " + path + " (" + scope + ", expires " + expiry + ")";
    }
}
