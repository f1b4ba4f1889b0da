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

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reading of the small request vocabulary (propfind, lockinfo). Matching is on local names so clients that omit or
 * misspell the DAV: namespace are still understood.
 */
public class XMLHelper {

    public static final String DAV_NAMESPACE = "DAV:";

    /** Namespace of mod_dav's properties, of which only executable is served. */
    public static final String APACHE_PROPS_NAMESPACE = "http://apache.org/dav/props/";

    /**
     * Parses a request body. Document type declarations are refused so no external entity is ever resolved.
     *
     * @return the document element, or empty if the body is not well formed XML
     */
    public static Optional<Element> parse( byte[] body ) {
        try {
            DocumentBuilder builder = newDocumentBuilder();
            // reports fatal errors by throwing instead of printing them
            builder.setErrorHandler(new DefaultHandler());
            Document document = builder.parse(new InputSource(new ByteArrayInputStream(body)));
            return Optional.ofNullable(document.getDocumentElement());
        } catch (SAXException | IOException e) {
            return Optional.empty();
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setExpandEntityReferences(false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("jaxp failed", e);
        }
    }

    public static Node findSubElement( Node parent,
                                       String localName ) {
        if (parent == null) {
            return null;
        }
        Node child = parent.getFirstChild();
        while (child != null) {
            if ((child.getNodeType() == Node.ELEMENT_NODE) && localName.equals(localNameOf(child))) {
                return child;
            }
            child = child.getNextSibling();
        }
        return null;
    }

    /**
     * @return the first element child, whatever its name
     */
    public static Node firstSubElement( Node parent ) {
        if (parent == null) {
            return null;
        }
        Node child = parent.getFirstChild();
        while (child != null && child.getNodeType() != Node.ELEMENT_NODE) {
            child = child.getNextSibling();
        }
        return child;
    }

    /**
     * @return the element children of propNode as "namespace:localName", with an empty namespace when none is declared
     */
    public static List<String> getPropertiesFromXML( Node propNode ) {
        List<String> properties = new ArrayList<>();
        Node child = propNode.getFirstChild();
        while (child != null) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                String namespace = child.getNamespaceURI();
                properties.add((namespace == null ? "" : namespace) + ":" + localNameOf(child));
            }
            child = child.getNextSibling();
        }
        return properties;
    }

    public static String localNameOf( Node node ) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    public static String textOf( Node node ) {
        return node == null ? null : node.getTextContent().trim();
    }
}
