package davshelf.server.webdav;

import java.nio.file.Path;

/**
 * Hooks for the application embedding the server. The should* methods are asked before a mutation, on the
 * request's worker thread, and refuse it by returning false. The did* methods are told after a mutation completed
 * and are delivered one at a time by {@link DelegateNotifier}.
 *
 * All paths are absolute paths inside the upload directory. Every method defaults to allowing or ignoring.
 */
public interface WebdavDelegate {

    WebdavDelegate ALLOW_ALL = new WebdavDelegate() {};

    /**
     * @param temporaryFile the fully received upload, which may be inspected but must not be moved
     */
    default boolean shouldUploadFileAtPath(Path path, Path temporaryFile) {
        return true;
    }

    default boolean shouldMoveItemFromPath(Path fromPath, Path toPath) {
        return true;
    }

    default boolean shouldCopyItemFromPath(Path fromPath, Path toPath) {
        return true;
    }

    default boolean shouldDeleteItemAtPath(Path path) {
        return true;
    }

    default boolean shouldCreateDirectoryAtPath(Path path) {
        return true;
    }

    default void didDownloadFileAtPath(Path path) {}

    default void didUploadFileAtPath(Path path) {}

    default void didMoveItemFromPath(Path fromPath, Path toPath) {}

    default void didCopyItemFromPath(Path fromPath, Path toPath) {}

    default void didDeleteItemAtPath(Path path) {}

    default void didCreateDirectoryAtPath(Path path) {}
}
