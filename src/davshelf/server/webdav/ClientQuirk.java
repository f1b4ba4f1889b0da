package davshelf.server.webdav;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Known WebDAV clients whose behaviour the server adapts to. Detection only looks at request headers.
 */
public enum ClientQuirk {

    /** OS X Finder refuses to mount read-write unless class 2 is advertised. */
    MAC_FINDER("1, 2"),

    /** Windows Explorer probes every folder for desktop.ini and folder thumbnails. */
    WINDOWS_MINIREDIRECTOR("1"),

    NONE("1");

    private static final Set<String> WINDOWS_PROBES = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("desktop.ini", "folder.jpg", "folder.gif")));

    private final String davCompliance;

    ClientQuirk(String davCompliance) {
        this.davCompliance = davCompliance;
    }

    /**
     * @param header looks up a request header by name, returning null when absent
     */
    public static ClientQuirk detect(UnaryOperator<String> header) {
        String userAgent = header.apply("User-Agent");
        if (userAgent == null)
            return NONE;
        if (userAgent.startsWith("WebDAVFS/") || userAgent.startsWith("WebDAVLib/"))
            return MAC_FINDER;
        if (userAgent.startsWith("Microsoft-WebDAV-MiniRedir"))
            return WINDOWS_MINIREDIRECTOR;
        return NONE;
    }

    /**
     * @return the value of the DAV header in OPTIONS responses
     */
    public String davCompliance() {
        return davCompliance;
    }

    /**
     * @return true if a PROPFIND of this item name should be answered with 404 without touching storage
     */
    public boolean ignoresPropfindOf(String name) {
        return this == WINDOWS_MINIREDIRECTOR && WINDOWS_PROBES.contains(name.toLowerCase(Locale.ROOT));
    }
}
