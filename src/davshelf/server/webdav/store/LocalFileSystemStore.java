package davshelf.server.webdav.store;

import davshelf.server.util.Logging;
import davshelf.server.webdav.AuthorizedPath;
import davshelf.server.webdav.exceptions.StorageException;
import org.eclipse.jetty.http.MimeTypes;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Storage on the local filesystem below the upload directory.
 */
public class LocalFileSystemStore implements IWebdavStore {

    private static final Logger LOG = Logging.LOG();

    public static final String DIRECTORY_MIME_TYPE = "httpd/unix-directory";
    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private static final String UPLOAD_PREFIX = ".davshelf-upload-";

    @Override
    public Optional<Resource> getResource(AuthorizedPath path) throws StorageException {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path.file(), BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Cannot read attributes of " + path, e);
        }
        Instant lastModified = attrs.lastModifiedTime().toInstant();
        Instant created = attrs.creationTime() == null || attrs.creationTime().toMillis() == 0 ?
                null :
                attrs.creationTime().toInstant();
        if (attrs.isDirectory())
            return Optional.of(new Resource(path.path(), Resource.Kind.COLLECTION, 0, lastModified, created, DIRECTORY_MIME_TYPE));
        return Optional.of(new Resource(path.path(), Resource.Kind.FILE, attrs.size(), lastModified, created, mimeTypeOf(path.name())));
    }

    /**
     * @return true for the spool files of uploads still in progress, which are never listed or copied
     */
    public static boolean isUploadFile(String fileName) {
        return fileName.startsWith(UPLOAD_PREFIX);
    }

    public static String mimeTypeOf(String fileName) {
        String mimeType = MimeTypes.getDefaultMimeByExtension(fileName);
        return mimeType == null ? DEFAULT_MIME_TYPE : mimeType;
    }

    @Override
    public List<String> getChildrenNames(AuthorizedPath collection) throws StorageException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(collection.file())) {
            for (Path child : children) {
                String name = child.getFileName().toString();
                if (! isUploadFile(name))
                    names.add(name);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot list " + collection, e);
        }
        return names;
    }

    @Override
    public InputStream getResourceContent(AuthorizedPath file) throws StorageException {
        try {
            return Files.newInputStream(file.file());
        } catch (IOException e) {
            throw new StorageException("Cannot open " + file, e);
        }
    }

    @Override
    public Path createUploadFile(AuthorizedPath destination) throws StorageException {
        try {
            return Files.createTempFile(destination.file().getParent(), UPLOAD_PREFIX, ".tmp");
        } catch (IOException e) {
            throw new StorageException("Cannot create upload file for " + destination, e);
        }
    }

    @Override
    public void commitUpload(Path uploadFile, AuthorizedPath destination) throws StorageException {
        try {
            try {
                Files.move(uploadFile, destination.file(), StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(uploadFile, destination.file(), StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            discardUpload(uploadFile);
            throw new StorageException("Cannot store upload at " + destination, e);
        }
    }

    @Override
    public void discardUpload(Path uploadFile) {
        try {
            Files.deleteIfExists(uploadFile);
        } catch (IOException e) {
            LOG.log(Level.WARNING, e, () -> "Cannot remove upload file " + uploadFile);
        }
    }

    @Override
    public void createFolder(AuthorizedPath path) throws StorageException {
        try {
            Files.createDirectory(path.file());
        } catch (IOException e) {
            throw new StorageException("Cannot create folder " + path, e);
        }
    }

    @Override
    public void removeObject(AuthorizedPath path) throws StorageException {
        try {
            deleteTree(path.file());
        } catch (IOException e) {
            throw new StorageException("Cannot remove " + path, e);
        }
    }

    @Override
    public void copyResource(AuthorizedPath source, AuthorizedPath destination, boolean recursive) throws StorageException {
        try {
            if (recursive)
                copyTree(source.file(), destination.file());
            else
                Files.copy(source.file(), destination.file(), StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            throw new StorageException("Cannot copy " + source + " to " + destination, e);
        }
    }

    @Override
    public void moveResource(AuthorizedPath source, AuthorizedPath destination) throws StorageException {
        Path from = source.file();
        Path to = destination.file();
        try {
            boolean fileOverFile = Files.isRegularFile(from, LinkOption.NOFOLLOW_LINKS)
                    && Files.isRegularFile(to, LinkOption.NOFOLLOW_LINKS);
            // rename(2) replaces a file in one step but cannot replace a directory
            if (! fileOverFile && Files.exists(to, LinkOption.NOFOLLOW_LINKS))
                deleteTree(to);
            try {
                Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.fine("Moving " + source + " across volumes by copying");
                if (fileOverFile)
                    Files.delete(to);
                copyTree(from, to);
                deleteTree(from);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot move " + source + " to " + destination, e);
        }
    }

    private static void copyTree(Path from, Path to) throws IOException {
        Files.walkFileTree(from, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.copy(dir, to.resolve(from.relativize(dir).toString()), StandardCopyOption.COPY_ATTRIBUTES);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (isUploadFile(file.getFileName().toString()))
                    return FileVisitResult.CONTINUE;
                Files.copy(file, to.resolve(from.relativize(file).toString()),
                        StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void deleteTree(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null)
                    throw exc;
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
