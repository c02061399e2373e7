package com.netmig.pan2tf.loader;

import com.netmig.pan2tf.exception.MalformedInputException;
import com.netmig.pan2tf.model.tree.ConfigNode;
import com.netmig.pan2tf.model.tree.ConfigTree;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a configuration export into a {@link ConfigTree}.
 * The document is read once, fully into memory. Whitespace-only text between
 * elements is dropped; element text is trimmed.
 */
@Slf4j
public class TreeLoader {

    public ConfigTree load(Path path) throws IOException, MalformedInputException {
        log.info("Loading configuration export: {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    public ConfigTree load(InputStream in) throws IOException, MalformedInputException {
        return load(in, "input stream");
    }

    public ConfigTree parse(String xml) throws MalformedInputException {
        try {
            return toTree(newBuilder().parse(new InputSource(new StringReader(xml))), "string");
        } catch (SAXException e) {
            throw new MalformedInputException("Export is not well-formed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedInputException("Cannot read export: " + e.getMessage(), e);
        }
    }

    private ConfigTree load(InputStream in, String source) throws IOException, MalformedInputException {
        try {
            return toTree(newBuilder().parse(in), source);
        } catch (SAXException e) {
            throw new MalformedInputException("Export " + source + " is not well-formed XML: " + e.getMessage(), e);
        }
    }

    private DocumentBuilder newBuilder() throws MalformedInputException {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(false);
            dbf.setValidating(false);
            dbf.setXIncludeAware(false);
            dbf.setExpandEntityReferences(false);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = dbf.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    log.debug("XML parser warning at line {}: {}", e.getLineNumber(), e.getMessage());
                }

                @Override
                public void error(SAXParseException e) throws SAXException {
                    throw e;
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return builder;
        } catch (ParserConfigurationException e) {
            throw new MalformedInputException("XML parser is not available: " + e.getMessage(), e);
        }
    }

    private ConfigTree toTree(Document document, String source) throws MalformedInputException {
        Element rootElement = document.getDocumentElement();
        if (!ConfigTree.ROOT_TAG.equals(rootElement.getTagName())) {
            throw new MalformedInputException(String.format(
                    "Export %s has root element <%s>, expected <%s>",
                    source, rootElement.getTagName(), ConfigTree.ROOT_TAG));
        }

        NodeConverter converter = new NodeConverter();
        ConfigNode root = converter.convert(rootElement);
        ConfigTree tree = new ConfigTree(root);
        log.info("Loaded {} elements, {} named entries from {}",
                converter.position, root.countEntries(), source);
        return tree;
    }

    /**
     * DOM to {@link ConfigNode}, numbering elements in document order
     */
    private static final class NodeConverter {
        private int position;

        ConfigNode convert(Element element) {
            Map<String, String> attributes = new LinkedHashMap<>();
            NamedNodeMap attrs = element.getAttributes();
            for (int i = 0; i < attrs.getLength(); i++) {
                Node attr = attrs.item(i);
                attributes.put(attr.getNodeName(), attr.getNodeValue());
            }

            StringBuilder text = new StringBuilder();
            NodeList children = element.getChildNodes();
            for (int i = 0; i < children.getLength(); i++) {
                Node child = children.item(i);
                if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                    text.append(child.getNodeValue());
                }
            }
            String trimmed = text.toString().trim();

            ConfigNode node = new ConfigNode(element.getTagName(), attributes,
                    trimmed.isEmpty() ? null : trimmed, position++);
            for (int i = 0; i < children.getLength(); i++) {
                Node child = children.item(i);
                if (child.getNodeType() == Node.ELEMENT_NODE) {
                    node.addChild(convert((Element) child));
                }
            }
            return node;
        }
    }
}
