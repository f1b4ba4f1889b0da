package davshelf.server.webdav.propfind;

import davshelf.server.webdav.xml.XMLHelper;

import java.util.EnumSet;
import java.util.Optional;

/**
 * Live properties reported by PROPFIND. The first seven make up allprop; the rest are only reported when a client
 * names them.
 */
public enum DavProperty {
    RESOURCE_TYPE(XMLHelper.DAV_NAMESPACE, "resourcetype"),
    CREATION_DATE(XMLHelper.DAV_NAMESPACE, "creationdate"),
    LAST_MODIFIED(XMLHelper.DAV_NAMESPACE, "getlastmodified"),
    CONTENT_LENGTH(XMLHelper.DAV_NAMESPACE, "getcontentlength"),
    CONTENT_TYPE(XMLHelper.DAV_NAMESPACE, "getcontenttype"),
    DISPLAY_NAME(XMLHelper.DAV_NAMESPACE, "displayname"),
    /** mod_dav's executable flag, always "F"; Finder asks for it before it lets files be edited. */
    PERMISSIONS(XMLHelper.APACHE_PROPS_NAMESPACE, "executable"),
    ETAG(XMLHelper.DAV_NAMESPACE, "getetag"),
    LOCK_DISCOVERY(XMLHelper.DAV_NAMESPACE, "lockdiscovery"),
    SUPPORTED_LOCK(XMLHelper.DAV_NAMESPACE, "supportedlock");

    private static final EnumSet<DavProperty> ALL = EnumSet.range(RESOURCE_TYPE, PERMISSIONS);

    private final String namespace;
    private final String localName;

    DavProperty(String namespace, String localName) {
        this.namespace = namespace;
        this.localName = localName;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getLocalName() {
        return localName;
    }

    /**
     * @return the name in the "namespace:local" form XMLWriter expects
     */
    public String qualifiedName() {
        return namespace + ":" + localName;
    }

    /**
     * The properties returned for allprop and for an empty PROPFIND body.
     */
    public static EnumSet<DavProperty> all() {
        return EnumSet.copyOf(ALL);
    }

    /**
     * Looks a requested property up. A request without a namespace matches on the local name alone.
     */
    public static Optional<DavProperty> byName(String namespace, String localName) {
        for (DavProperty property : values()) {
            if (! property.localName.equals(localName))
                continue;
            if (namespace == null || namespace.isEmpty() || property.namespace.equals(namespace))
                return Optional.of(property);
        }
        return Optional.empty();
    }
}
