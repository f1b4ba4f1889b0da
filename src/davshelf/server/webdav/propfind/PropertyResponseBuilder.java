/*
 * Copyright 1999,2004 The Apache Software Foundation.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package davshelf.server.webdav.propfind;

import davshelf.server.webdav.WebdavStatus;
import davshelf.server.webdav.locking.LockManager;
import davshelf.server.webdav.locking.LockScope;
import davshelf.server.webdav.locking.LockToken;
import davshelf.server.webdav.store.Resource;
import davshelf.server.webdav.xml.URLEncoder;
import davshelf.server.webdav.xml.XMLWriter;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Renders the response element describing one resource in a multistatus body.
 */
public class PropertyResponseBuilder {

    /**
     * Simple date format for the creation date ISO 8601 representation (partial).
     */
    public static final DateTimeFormatter CREATION_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'", Locale.US)
            .withZone(ZoneId.of("GMT"));

    /**
     * Simple date format for the last modified date. (RFC 822 updated by RFC 1123)
     */
    public static final DateTimeFormatter LAST_MODIFIED_DATE_FORMAT = DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss z", Locale.US)
            .withZone(ZoneId.of("GMT"));

    /**
     * Value of the executable property: no file served here is executable.
     */
    public static final String PERMISSIONS_VALUE = "F";

    private static final URLEncoder URL_ENCODER = URLEncoder.forPaths();

    private final String hrefBase;
    private final LockManager locks;

    /**
     * @param hrefBase prefix of every href, the context and servlet path the share is mounted under ("" for "/")
     */
    public PropertyResponseBuilder(String hrefBase, LockManager locks) {
        this.hrefBase = hrefBase.endsWith("/") ? hrefBase.substring(0, hrefBase.length() - 1) : hrefBase;
        this.locks = locks;
    }

    public static Map<String, String> namespaces() {
        Map<String, String> namespaces = new LinkedHashMap<>();
        namespaces.put("DAV:", "D");
        return namespaces;
    }

    public static String creationDateFormat(Instant instant) {
        return CREATION_DATE_FORMAT.format(instant);
    }

    public static String lastModifiedDateFormat(Instant instant) {
        return LAST_MODIFIED_DATE_FORMAT.format(instant);
    }

    /**
     * Renders a standalone response element, declaring the DAV: namespace itself.
     */
    public String buildResponse(Resource resource, PropertySet properties) {
        XMLWriter generatedXML = new XMLWriter(namespaces());
        writeResponse(generatedXML, resource, properties);
        return generatedXML.toString();
    }

    public String href(Resource resource) {
        String path = resource.getPath();
        if (resource.isCollection() && ! path.endsWith("/"))
            path = path + "/";
        return hrefBase + URL_ENCODER.encode(path);
    }

    public void writeResponse(XMLWriter generatedXML, Resource resource, PropertySet properties) {
        generatedXML.writeElement("DAV::response", XMLWriter.OPENING);
        generatedXML.writeProperty("DAV::href", href(resource));

        if (properties.isNamesOnly()) {
            generatedXML.writeElement("DAV::propstat", XMLWriter.OPENING);
            generatedXML.writeElement("DAV::prop", XMLWriter.OPENING);
            for (DavProperty property : DavProperty.values())
                generatedXML.writeElement(property.qualifiedName(), XMLWriter.NO_CONTENT);
            generatedXML.writeElement("DAV::prop", XMLWriter.CLOSING);
            writeStatus(generatedXML, WebdavStatus.SC_OK);
            generatedXML.writeElement("DAV::propstat", XMLWriter.CLOSING);
        } else {
            if (! properties.getProperties().isEmpty() || properties.getUnknown().isEmpty()) {
                generatedXML.writeElement("DAV::propstat", XMLWriter.OPENING);
                generatedXML.writeElement("DAV::prop", XMLWriter.OPENING);
                for (DavProperty property : properties.getProperties())
                    writeProperty(generatedXML, resource, property);
                generatedXML.writeElement("DAV::prop", XMLWriter.CLOSING);
                writeStatus(generatedXML, WebdavStatus.SC_OK);
                generatedXML.writeElement("DAV::propstat", XMLWriter.CLOSING);
            }

            if (! properties.getUnknown().isEmpty()) {
                generatedXML.writeElement("DAV::propstat", XMLWriter.OPENING);
                generatedXML.writeElement("DAV::prop", XMLWriter.OPENING);
                for (String name : properties.getUnknown())
                    generatedXML.writeElement(name, XMLWriter.NO_CONTENT);
                generatedXML.writeElement("DAV::prop", XMLWriter.CLOSING);
                writeStatus(generatedXML, WebdavStatus.SC_NOT_FOUND);
                generatedXML.writeElement("DAV::propstat", XMLWriter.CLOSING);
            }
        }

        generatedXML.writeElement("DAV::response", XMLWriter.CLOSING);
    }

    private void writeProperty(XMLWriter generatedXML, Resource resource, DavProperty property) {
        switch (property) {
            case RESOURCE_TYPE:
                if (resource.isCollection()) {
                    generatedXML.writeElement("DAV::resourcetype", XMLWriter.OPENING);
                    generatedXML.writeElement("DAV::collection", XMLWriter.NO_CONTENT);
                    generatedXML.writeElement("DAV::resourcetype", XMLWriter.CLOSING);
                } else {
                    generatedXML.writeElement("DAV::resourcetype", XMLWriter.NO_CONTENT);
                }
                break;
            case CREATION_DATE:
                generatedXML.writeProperty("DAV::creationdate", creationDateFormat(resource.getCreationTime()));
                break;
            case LAST_MODIFIED:
                generatedXML.writeProperty("DAV::getlastmodified", lastModifiedDateFormat(resource.getLastModified()));
                break;
            case CONTENT_LENGTH:
                generatedXML.writeProperty("DAV::getcontentlength", Long.toString(resource.getSize()));
                break;
            case CONTENT_TYPE:
                generatedXML.writeProperty("DAV::getcontenttype", resource.getMimeType());
                break;
            case DISPLAY_NAME:
                generatedXML.writeProperty("DAV::displayname", resource.getName());
                break;
            case PERMISSIONS:
                generatedXML.writeProperty(property.qualifiedName(), PERMISSIONS_VALUE);
                break;
            case ETAG:
                generatedXML.writeProperty("DAV::getetag", resource.getETag());
                break;
            case LOCK_DISCOVERY:
                Optional<LockToken> lock = locks.getLock(resource.getPath());
                if (lock.isPresent()) {
                    generatedXML.writeElement("DAV::lockdiscovery", XMLWriter.OPENING);
                    writeActiveLock(generatedXML, lock.get());
                    generatedXML.writeElement("DAV::lockdiscovery", XMLWriter.CLOSING);
                } else {
                    generatedXML.writeElement("DAV::lockdiscovery", XMLWriter.NO_CONTENT);
                }
                break;
            case SUPPORTED_LOCK:
                generatedXML.writeElement("DAV::supportedlock", XMLWriter.OPENING);
                for (LockScope scope : LockScope.values()) {
                    generatedXML.writeElement("DAV::lockentry", XMLWriter.OPENING);
                    generatedXML.writeElement("DAV::lockscope", XMLWriter.OPENING);
                    generatedXML.writeElement("DAV::" + scope.elementName(), XMLWriter.NO_CONTENT);
                    generatedXML.writeElement("DAV::lockscope", XMLWriter.CLOSING);
                    generatedXML.writeElement("DAV::locktype", XMLWriter.OPENING);
                    generatedXML.writeElement("DAV::write", XMLWriter.NO_CONTENT);
                    generatedXML.writeElement("DAV::locktype", XMLWriter.CLOSING);
                    generatedXML.writeElement("DAV::lockentry", XMLWriter.CLOSING);
                }
                generatedXML.writeElement("DAV::supportedlock", XMLWriter.CLOSING);
                break;
        }
    }

    /**
     * Writes the activelock element describing a granted lock, used by lockdiscovery and by LOCK responses.
     */
    public static void writeActiveLock(XMLWriter generatedXML, LockToken lock) {
        generatedXML.writeElement("DAV::activelock", XMLWriter.OPENING);

        generatedXML.writeElement("DAV::locktype", XMLWriter.OPENING);
        generatedXML.writeProperty("DAV::write");
        generatedXML.writeElement("DAV::locktype", XMLWriter.CLOSING);

        generatedXML.writeElement("DAV::lockscope", XMLWriter.OPENING);
        generatedXML.writeProperty("DAV::" + lock.getScope().elementName());
        generatedXML.writeElement("DAV::lockscope", XMLWriter.CLOSING);

        generatedXML.writeProperty("DAV::depth",
                lock.getDepth() == LockToken.INFINITE_DEPTH ? "Infinity" : String.valueOf(lock.getDepth()));

        if (lock.getOwner() != null) {
            generatedXML.writeElement("DAV::owner", XMLWriter.OPENING);
            generatedXML.writeProperty("DAV::href", lock.getOwner());
            generatedXML.writeElement("DAV::owner", XMLWriter.CLOSING);
        }

        generatedXML.writeProperty("DAV::timeout", "Second-" + lock.getTimeoutSeconds());

        generatedXML.writeElement("DAV::locktoken", XMLWriter.OPENING);
        generatedXML.writeProperty("DAV::href", lock.getUri());
        generatedXML.writeElement("DAV::locktoken", XMLWriter.CLOSING);

        generatedXML.writeElement("DAV::activelock", XMLWriter.CLOSING);
    }

    private static void writeStatus(XMLWriter generatedXML, int status) {
        generatedXML.writeProperty("DAV::status", WebdavStatus.statusLine(status));
    }
}
