package davshelf.server.webdav.locking;

import davshelf.server.util.Logging;
import davshelf.server.webdav.exceptions.ConflictException;
import davshelf.server.webdav.exceptions.PreconditionFailedException;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.logging.Logger;

/**
 * Table of lock tokens, at most one live token per path.
 *
 * Locks are advisory: a LOCK is always granted and no other method consults this table, so they never keep one
 * client from writing over another. They exist for clients that will not mount a share read-write without them.
 * Expired entries are dropped whenever the table is touched and by {@link #sweepExpired()}.
 */
public class LockManager {

    private static final Logger LOG = Logging.LOG();

    /**
     * Default lock timeout value.
     */
    public static final int DEFAULT_TIMEOUT = 3600;

    /**
     * Maximum lock timeout.
     */
    public static final int MAX_TIMEOUT = 604800;

    private final Clock clock;
    private final Map<String, LockToken> locks = new HashMap<>();

    public LockManager() {
        this(Clock.systemUTC());
    }

    public LockManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Grants or refreshes the lock on a path.
     *
     * @param presentedToken the token id from the request's If header, if any
     * @return a new token if the path had no live lock, the refreshed token if presentedToken names the live lock,
     * and the live lock unchanged otherwise
     */
    public synchronized LockToken lock(String path,
                                       LockScope scope,
                                       String owner,
                                       int depth,
                                       int timeoutSeconds,
                                       Optional<String> presentedToken) {
        Instant now = clock.instant();
        int timeout = boundedTimeout(timeoutSeconds);
        LockToken current = liveLock(path, now);
        if (current == null) {
            LockToken created = new LockToken(UUID.randomUUID().toString(), path, scope, owner, depth,
                    timeout, now.plusSeconds(timeout));
            locks.put(path, created);
            LOG.fine("Locked " + created);
            return created;
        }
        if (presentedToken.isPresent() && presentedToken.get().equals(current.getId())) {
            LockToken refreshed = current.refreshed(timeout, now.plusSeconds(timeout));
            locks.put(path, refreshed);
            LOG.fine("Refreshed " + refreshed);
            return refreshed;
        }
        return current;
    }

    /**
     * Removes the lock on path if tokenId names it.
     *
     * @throws ConflictException if the path holds no live lock
     * @throws PreconditionFailedException if the path is locked under a different token
     */
    public synchronized void unlock(String path, String tokenId) throws ConflictException, PreconditionFailedException {
        LockToken current = liveLock(path, clock.instant());
        if (current == null)
            throw new ConflictException("No lock on " + path, "lock-token-matches-request-uri");
        if (! current.getId().equals(tokenId))
            throw new PreconditionFailedException("Lock token does not match lock on " + path, "lock-token-matches-request-uri");
        locks.remove(path);
        LOG.fine("Unlocked " + current);
    }

    public synchronized Optional<LockToken> getLock(String path) {
        return Optional.ofNullable(liveLock(path, clock.instant()));
    }

    /**
     * @return the number of expired entries removed
     */
    public synchronized int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Iterator<LockToken> it = locks.values().iterator(); it.hasNext();) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0)
            LOG.fine("Removed " + removed + " expired locks");
        return removed;
    }

    public synchronized int size() {
        return locks.size();
    }

    private LockToken liveLock(String path, Instant now) {
        LockToken current = locks.get(path);
        if (current != null && current.isExpired(now)) {
            locks.remove(path);
            return null;
        }
        return current;
    }

    public static int boundedTimeout(int timeoutSeconds) {
        if (timeoutSeconds <= 0)
            return DEFAULT_TIMEOUT;
        return Math.min(timeoutSeconds, MAX_TIMEOUT);
    }

    /**
     * Reads a Timeout header such as "Second-600", "Infinite" or "Second-600, Infinite". Only the first listed
     * value is used.
     */
    public static int parseTimeout(String header) {
        if (header == null || header.trim().isEmpty())
            return DEFAULT_TIMEOUT;
        String first = header;
        int commaPos = first.indexOf(',');
        if (commaPos != -1)
            first = first.substring(0, commaPos);
        first = first.trim();
        if (first.equalsIgnoreCase("infinite") || first.equalsIgnoreCase("infinity"))
            return MAX_TIMEOUT;
        if (first.regionMatches(true, 0, "Second-", 0, 7))
            first = first.substring(7);
        try {
            return boundedTimeout(Integer.parseInt(first));
        } catch (NumberFormatException e) {
            return DEFAULT_TIMEOUT;
        }
    }
}
