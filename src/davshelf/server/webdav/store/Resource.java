package davshelf.server.webdav.store;

import java.time.Instant;

/**
 * Metadata of one file or collection, read from storage for the current request only.
 */
public final class Resource {

    public enum Kind { FILE, COLLECTION }

    private final String path;
    private final Kind kind;
    private final long size;
    private final Instant lastModified;
    private final Instant creationTime;
    private final String mimeType;

    public Resource(String path, Kind kind, long size, Instant lastModified, Instant creationTime, String mimeType) {
        this.path = path;
        this.kind = kind;
        this.size = size;
        this.lastModified = lastModified;
        this.creationTime = creationTime;
        this.mimeType = mimeType;
    }

    /**
     * @return the client visible path, "/" for the root
     */
    public String getPath() {
        return path;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isCollection() {
        return kind == Kind.COLLECTION;
    }

    public boolean isFile() {
        return kind == Kind.FILE;
    }

    /**
     * @return the byte size of a file, 0 for collections
     */
    public long getSize() {
        return isCollection() ? 0 : size;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    /**
     * @return the creation time, or the last modification time where the filesystem does not record one
     */
    public Instant getCreationTime() {
        return creationTime != null ? creationTime : lastModified;
    }

    public String getMimeType() {
        return mimeType;
    }

    /**
     * @return the last path segment, empty for the root
     */
    public String getName() {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    public String getETag() {
        return "W/\"" + getSize() + "-" + lastModified.toEpochMilli() + "\"";
    }

    @Override
    public String toString() {
        return kind + " " + path + " (" + getSize() + " bytes)";
    }
}
