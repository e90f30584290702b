package com.pipeline.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;

/**
 * Converts an XML response body into nested JSON objects.
 * <ul>
 *   <li>the root element's content is returned, not the root element itself</li>
 *   <li>attributes go under an {@code @attributes} object</li>
 *   <li>sibling elements sharing a tag become an array</li>
 *   <li>an element with only text becomes that text</li>
 *   <li>namespace prefixes are dropped from tag names</li>
 * </ul>
 * A body that is not well-formed XML comes back as {@code {"raw_text": body}}.
 */
@Slf4j
public final class XmlResponseParser {

    static final String ATTRIBUTES_KEY = "@attributes";

    private XmlResponseParser() {
    }

    public static JsonNode parse(String body) {
        try {
            Document document = newBuilder().parse(new InputSource(new StringReader(body)));
            return convert(document.getDocumentElement());
        } catch (SAXException | IOException e) {
            log.debug("Response is not well-formed XML: {}", e.getMessage());
            return JsonNodeFactory.instance.objectNode().put("raw_text", body);
        }
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler() {
                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    private static JsonNode convert(Element element) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();

        NamedNodeMap attributes = element.getAttributes();
        ObjectNode attributeValues = JsonNodeFactory.instance.objectNode();
        for (int i = 0; i < attributes.getLength(); i++) {
            Node attribute = attributes.item(i);
            String name = attribute.getNodeName();
            if (!"xmlns".equals(name) && !name.startsWith("xmlns:")) {
                attributeValues.put(localName(attribute), attribute.getNodeValue());
            }
        }
        if (attributeValues.size() > 0) {
            result.set(ATTRIBUTES_KEY, attributeValues);
        }

        boolean hasChildElements = false;
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element child) {
                hasChildElements = true;
                addChild(result, localName(child), convert(child));
            }
        }

        if (!hasChildElements) {
            String text = element.getTextContent();
            if (text != null && !text.isBlank()) {
                return TextNode.valueOf(text.strip());
            }
        }
        return result;
    }

    private static void addChild(ObjectNode parent, String tag, JsonNode value) {
        JsonNode existing = parent.get(tag);
        if (existing == null) {
            parent.set(tag, value);
        } else if (existing.isArray()) {
            ((ArrayNode) existing).add(value);
        } else {
            ArrayNode repeated = parent.putArray(tag);
            repeated.add(existing);
            repeated.add(value);
        }
    }

    private static String localName(Node node) {
        if (node.getLocalName() != null) {
            return node.getLocalName();
        }
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }
}
