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

package davshelf.server.webdav.xml;

import java.util.Map;

/**
 * Streaming builder for WebDAV response bodies.
 *
 * Element names are given as "namespace:local", for example "DAV::href", and written with the prefix registered
 * for that namespace. Namespaces are declared on the root element.
 *
 * @author <a href="mailto:remm@apache.org">Remy Maucherat</a>
 */
public class XMLWriter {

    // -------------------------------------------------------------- Constants

    /**
     * Opening tag.
     */
    public static final int OPENING = 0;

    /**
     * Closing tag.
     */
    public static final int CLOSING = 1;

    /**
     * Element with no content.
     */
    public static final int NO_CONTENT = 2;

    // ----------------------------------------------------- Instance Variables

    protected final StringBuilder buffer = new StringBuilder();

    /**
     * Namespace URI to prefix, declared in the root element
     */
    protected final Map<String, String> namespaces;

    /**
     * Is true until the root element is written
     */
    protected boolean isRootElement = true;

    // ----------------------------------------------------------- Constructors

    public XMLWriter( Map<String, String> namespaces ) {
        this.namespaces = namespaces;
    }

    // --------------------------------------------------------- Public Methods

    /**
     * Retrieve generated XML.
     *
     * @return String containing the generated XML
     */
    @Override
    public String toString() {
        return buffer.toString();
    }

    /**
     * Write a property with escaped text content.
     *
     * @param name Property name
     * @param value Property value
     */
    public void writeProperty( String name,
                               String value ) {
        writeElement(name, OPENING);
        writeText(value);
        writeElement(name, CLOSING);
    }

    /**
     * Write an empty property.
     *
     * @param name Property name
     */
    public void writeProperty( String name ) {
        writeElement(name, NO_CONTENT);
    }

    /**
     * Write an element.
     *
     * @param name Element name
     * @param type Element type
     */
    public void writeElement( String name,
                              int type ) {
        StringBuilder nsdecl = new StringBuilder();

        if (isRootElement) {
            for (Map.Entry<String, String> ns : namespaces.entrySet()) {
                nsdecl.append(" xmlns:").append(ns.getValue()).append("=\"").append(escape(ns.getKey())).append("\"");
            }
            isRootElement = false;
        }

        int pos = name.lastIndexOf(':');
        if (pos >= 0) {
            String fullns = name.substring(0, pos);
            String prefix = namespaces.get(fullns);
            if (prefix == null && namespaces.containsValue(fullns)) {
                prefix = fullns;
            }
            if (prefix == null) {
                // undeclared namespace, make it the default for this element
                name = name.substring(pos + 1);
                if (type != CLOSING)
                    nsdecl.append(" xmlns=\"").append(escape(fullns)).append("\"");
            } else {
                name = prefix + ":" + name.substring(pos + 1);
            }
        }

        switch (type) {
            case OPENING:
                buffer.append('<').append(name).append(nsdecl).append('>');
                break;
            case CLOSING:
                buffer.append("</").append(name).append(">\n");
                break;
            case NO_CONTENT:
            default:
                buffer.append('<').append(name).append(nsdecl).append("/>");
                break;
        }
    }

    /**
     * Write escaped text.
     *
     * @param text Text to append
     */
    public void writeText( String text ) {
        buffer.append(escape(text));
    }

    /**
     * Write XML Header.
     */
    public void writeXMLHeader() {
        buffer.append("<?xml version=\"1.0\" encoding=\"utf-8\" ?>\n");
    }

    public static String escape( String text ) {
        if (text == null)
            return "";
        StringBuilder escaped = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String replacement;
            switch (c) {
                case '&': replacement = "&amp;"; break;
                case '<': replacement = "&lt;"; break;
                case '>': replacement = "&gt;"; break;
                case '"': replacement = "&quot;"; break;
                case '\'': replacement = "&apos;"; break;
                default: replacement = null;
            }
            if (replacement == null) {
                if (escaped != null)
                    escaped.append(c);
                continue;
            }
            if (escaped == null)
                escaped = new StringBuilder(text.length() + 16).append(text, 0, i);
            escaped.append(replacement);
        }
        return escaped == null ? text : escaped.toString();
    }
}
