package davshelf.server.webdav.propfind;

import davshelf.server.webdav.exceptions.BadRequestException;
import davshelf.server.webdav.xml.XMLHelper;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.*;

/**
 * What a PROPFIND asks for: a set of known live properties, the names it asked for that this server does not
 * know (reported back as not found), or only the property names.
 */
public final class PropertySet {

    private final EnumSet<DavProperty> properties;
    private final List<String> unknown;
    private final boolean namesOnly;

    private PropertySet(EnumSet<DavProperty> properties, List<String> unknown, boolean namesOnly) {
        this.properties = properties;
        this.unknown = Collections.unmodifiableList(unknown);
        this.namesOnly = namesOnly;
    }

    public static PropertySet all() {
        return new PropertySet(DavProperty.all(), Collections.emptyList(), false);
    }

    public static PropertySet namesOnly() {
        return new PropertySet(EnumSet.noneOf(DavProperty.class), Collections.emptyList(), true);
    }

    public static PropertySet of(DavProperty first, DavProperty... rest) {
        return new PropertySet(EnumSet.of(first, rest), Collections.emptyList(), false);
    }

    /**
     * Reads a PROPFIND body. An empty body, an empty propfind element and allprop all mean every property in
     * {@link DavProperty#all()}.
     *
     * @throws BadRequestException if the body is not XML or its root is not propfind
     */
    public static PropertySet parse(byte[] body) throws BadRequestException {
        if (isBlank(body))
            return all();
        Element root = XMLHelper.parse(body)
                .orElseThrow(() -> new BadRequestException("Malformed PROPFIND body"));
        if (! "propfind".equals(XMLHelper.localNameOf(root)))
            throw new BadRequestException("Expected propfind, got " + XMLHelper.localNameOf(root));

        Node prop = XMLHelper.findSubElement(root, "prop");
        if (prop != null) {
            EnumSet<DavProperty> known = EnumSet.noneOf(DavProperty.class);
            List<String> unknown = new ArrayList<>();
            for (String name : XMLHelper.getPropertiesFromXML(prop)) {
                int split = name.lastIndexOf(':');
                Optional<DavProperty> property = DavProperty.byName(name.substring(0, split), name.substring(split + 1));
                if (property.isPresent())
                    known.add(property.get());
                else if (! unknown.contains(name))
                    unknown.add(name);
            }
            return new PropertySet(known, unknown, false);
        }
        if (XMLHelper.findSubElement(root, "propname") != null)
            return namesOnly();
        return all();
    }

    private static boolean isBlank(byte[] body) {
        if (body == null)
            return true;
        for (byte b : body) {
            if (! Character.isWhitespace(b))
                return false;
        }
        return true;
    }

    public boolean contains(DavProperty property) {
        return properties.contains(property);
    }

    public Set<DavProperty> getProperties() {
        return Collections.unmodifiableSet(properties);
    }

    /**
     * @return requested names this server does not serve, as "namespace:local"
     */
    public List<String> getUnknown() {
        return unknown;
    }

    public boolean isNamesOnly() {
        return namesOnly;
    }

    @Override
    public String toString() {
        return namesOnly ? "propname" : properties + (unknown.isEmpty() ? "" : " + " + unknown);
    }
}
