package davshelf.server.webdav;

import davshelf.server.util.Logging;
import davshelf.server.webdav.exceptions.PathRejectedException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Validates request paths before any storage access: the path must stay inside the upload directory (also through
 * symbolic links), must not name a hidden item unless those are allowed, and a file must carry an allowed extension.
 */
public class SecurityGate {

    private static final Logger LOG = Logging.LOG();

    private final WebdavConfig config;
    private final Path root;

    public SecurityGate(WebdavConfig config) {
        this.config = config;
        this.root = config.getUploadDirectory();
    }

    public WebdavConfig getConfig() {
        return config;
    }

    /**
     * Containment and hidden item checks. Use for paths that may name a collection.
     */
    public AuthorizedPath authorize(String path) throws PathRejectedException {
        if (path == null)
            throw new PathRejectedException("Missing path");
        Path resolved;
        try {
            String relative = path.startsWith("/") ? path.substring(1) : path;
            resolved = root.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            throw new PathRejectedException("Invalid path " + path);
        }
        if (! resolved.startsWith(root)) {
            LOG.fine("Rejected path escaping the upload directory: " + path);
            throw new PathRejectedException("Path outside upload directory: " + path);
        }
        checkRealPath(resolved, path);

        Path relative = root.relativize(resolved);
        StringBuilder normalised = new StringBuilder();
        for (Path segment : relative) {
            String name = segment.toString();
            if (name.isEmpty())
                continue;
            if (! isHiddenAllowed(name)) {
                LOG.fine("Rejected hidden item: " + path);
                throw new PathRejectedException("Hidden item: " + path);
            }
            normalised.append('/').append(name);
        }
        return new AuthorizedPath(normalised.length() == 0 ? "/" : normalised.toString(), resolved);
    }

    /**
     * {@link #authorize(String)} plus the extension allow-list, for paths known to name a file.
     */
    public AuthorizedPath authorizeFile(String path) throws PathRejectedException {
        AuthorizedPath authorized = authorize(path);
        checkExtension(authorized, false);
        return authorized;
    }

    /**
     * Applies the extension allow-list once the kind of an item is known; collections are exempt.
     */
    public void checkExtension(AuthorizedPath path, boolean isCollection) throws PathRejectedException {
        if (isCollection)
            return;
        if (path.isRoot() || ! isExtensionAllowed(path.name())) {
            LOG.fine("Rejected file extension: " + path);
            throw new PathRejectedException("File extension not allowed: " + path);
        }
    }

    public boolean isExtensionAllowed(String fileName) {
        if (config.getAllowedFileExtensions().isEmpty())
            return true;
        return config.getAllowedFileExtensions().contains(extensionOf(fileName));
    }

    public boolean isHiddenAllowed(String name) {
        return config.isAllowHiddenItems() || ! name.startsWith(".");
    }

    /**
     * Whether a directory entry may be listed to clients.
     */
    public boolean isVisible(String name, boolean isCollection) {
        return isHiddenAllowed(name) && (isCollection || isExtensionAllowed(name));
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0)
            return "";
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves symbolic links of the deepest existing ancestor and checks it is still inside the root.
     */
    private void checkRealPath(Path resolved, String requested) throws PathRejectedException {
        Path existing = resolved;
        while (existing != null && ! Files.exists(existing, LinkOption.NOFOLLOW_LINKS))
            existing = existing.getParent();
        if (existing == null || ! existing.startsWith(root))
            throw new PathRejectedException("Path outside upload directory: " + requested);
        try {
            Path real = existing.toRealPath();
            if (! real.startsWith(root)) {
                LOG.fine("Rejected symbolic link escaping the upload directory: " + requested);
                throw new PathRejectedException("Path outside upload directory: " + requested);
            }
        } catch (IOException e) {
            // dangling symbolic link
            throw new PathRejectedException("Unresolvable path: " + requested);
        }
    }
}
