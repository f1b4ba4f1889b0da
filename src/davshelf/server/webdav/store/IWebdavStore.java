package davshelf.server.webdav.store;

import davshelf.server.webdav.AuthorizedPath;
import davshelf.server.webdav.exceptions.StorageException;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The filesystem operations the WebDAV methods need. Paths have already passed the security gate. All calls are
 * synchronous and may block the calling worker.
 */
public interface IWebdavStore {

    Optional<Resource> getResource(AuthorizedPath path) throws StorageException;

    /**
     * @return the names of the direct children of a collection, in the filesystem's enumeration order, leaving out
     * uploads still in progress
     */
    List<String> getChildrenNames(AuthorizedPath collection) throws StorageException;

    InputStream getResourceContent(AuthorizedPath file) throws StorageException;

    /**
     * Creates an empty hidden file next to the destination, on the same volume, to receive an upload.
     */
    Path createUploadFile(AuthorizedPath destination) throws StorageException;

    /**
     * Atomically renames a received upload onto its destination, replacing an existing file. On failure the
     * destination is left untouched.
     */
    void commitUpload(Path uploadFile, AuthorizedPath destination) throws StorageException;

    void discardUpload(Path uploadFile);

    void createFolder(AuthorizedPath path) throws StorageException;

    /**
     * Removes a file, or a collection with everything below it.
     */
    void removeObject(AuthorizedPath path) throws StorageException;

    /**
     * @param recursive false copies a collection without its members
     */
    void copyResource(AuthorizedPath source, AuthorizedPath destination, boolean recursive) throws StorageException;

    /**
     * Renames in one step when the filesystem allows it, otherwise copies then removes the source. An existing
     * destination is replaced.
     */
    void moveResource(AuthorizedPath source, AuthorizedPath destination) throws StorageException;
}
