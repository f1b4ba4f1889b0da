package davshelf.server.webdav;

import davshelf.server.util.Args;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Process wide settings of a WebDAV share. The upload directory is canonicalised once here and never changes.
 */
public final class WebdavConfig {

    public static final int DEFAULT_LOCK_SWEEP_SECONDS = 60;

    private final Path uploadDirectory;
    private final Set<String> allowedFileExtensions;
    private final boolean allowHiddenItems;
    private final int lockSweepSeconds;

    public WebdavConfig(Path uploadDirectory,
                        Collection<String> allowedFileExtensions,
                        boolean allowHiddenItems,
                        int lockSweepSeconds) {
        if (! Files.isDirectory(uploadDirectory))
            throw new IllegalArgumentException("Upload directory does not exist: " + uploadDirectory);
        try {
            this.uploadDirectory = uploadDirectory.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        Set<String> extensions = allowedFileExtensions.stream()
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(TreeSet::new));
        this.allowedFileExtensions = Collections.unmodifiableSet(extensions);
        this.allowHiddenItems = allowHiddenItems;
        this.lockSweepSeconds = lockSweepSeconds;
    }

    public WebdavConfig(Path uploadDirectory) {
        this(uploadDirectory, Collections.emptyList(), false, DEFAULT_LOCK_SWEEP_SECONDS);
    }

    public static WebdavConfig fromArgs(Args args) {
        return new WebdavConfig(
                Paths.get(args.getArg("webdav.root")),
                args.getList("webdav.allowed-extensions"),
                args.getBoolean("webdav.allow-hidden", false),
                args.getInt("webdav.lock.sweep-seconds", DEFAULT_LOCK_SWEEP_SECONDS));
    }

    public Path getUploadDirectory() {
        return uploadDirectory;
    }

    /**
     * @return lower case extensions without the leading period, empty when every extension is allowed
     */
    public Set<String> getAllowedFileExtensions() {
        return allowedFileExtensions;
    }

    public boolean isAllowHiddenItems() {
        return allowHiddenItems;
    }

    public int getLockSweepSeconds() {
        return lockSweepSeconds;
    }

    public WebdavConfig withAllowedFileExtensions(Collection<String> extensions) {
        return new WebdavConfig(uploadDirectory, extensions, allowHiddenItems, lockSweepSeconds);
    }

    public WebdavConfig withAllowHiddenItems(boolean allowHidden) {
        return new WebdavConfig(uploadDirectory, allowedFileExtensions, allowHidden, lockSweepSeconds);
    }

    @Override
    public String toString() {
        return "WebdavConfig{root=" + uploadDirectory +
                ", extensions=" + allowedFileExtensions +
                ", allowHidden=" + allowHiddenItems + "}";
    }
}
