package davshelf.server.webdav;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A request path that passed the {@link SecurityGate}: the normalised path as seen by clients ("/" for the root,
 * "/a/b" otherwise) and the file it maps to inside the upload directory.
 */
public final class AuthorizedPath {

    private final String path;
    private final Path file;

    AuthorizedPath(String path, Path file) {
        this.path = path;
        this.file = file;
    }

    public String path() {
        return path;
    }

    public Path file() {
        return file;
    }

    public boolean isRoot() {
        return "/".equals(path);
    }

    /**
     * @return the last path segment, empty for the root
     */
    public String name() {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    public String parentPath() {
        int slash = path.lastIndexOf('/');
        return slash <= 0 ? "/" : path.substring(0, slash);
    }

    public boolean isDescendantOf(AuthorizedPath other) {
        return other.isRoot() ? ! isRoot() : path.startsWith(other.path + "/");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AuthorizedPath that = (AuthorizedPath) o;
        return path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path);
    }

    @Override
    public String toString() {
        return path;
    }
}
