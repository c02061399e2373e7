package com.netmig.pan2tf.loader;

import com.netmig.pan2tf.model.tree.ConfigNode;
import com.netmig.pan2tf.model.tree.ConfigTree;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serialises a {@link ConfigTree} back to indented XML.
 */
public class TreeWriter {

    public void write(ConfigTree tree, Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            transformer().transform(new DOMSource(toDocument(tree)), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IOException("Failed to write " + path + ": " + e.getMessage(), e);
        }
    }

    public String toXml(ConfigTree tree) throws IOException {
        StringWriter writer = new StringWriter();
        try {
            transformer().transform(new DOMSource(toDocument(tree)), new StreamResult(writer));
        } catch (TransformerException e) {
            throw new IOException("Failed to serialise configuration tree: " + e.getMessage(), e);
        }
        return writer.toString();
    }

    private Document toDocument(ConfigTree tree) throws IOException {
        try {
            Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            document.appendChild(toElement(document, tree.getRoot()));
            return document;
        } catch (ParserConfigurationException e) {
            throw new IOException("XML builder is not available: " + e.getMessage(), e);
        }
    }

    private Element toElement(Document document, ConfigNode node) {
        Element element = document.createElement(node.getTag());
        for (Map.Entry<String, String> attribute : node.getAttributes().entrySet()) {
            element.setAttribute(attribute.getKey(), attribute.getValue());
        }
        if (node.getText() != null) {
            element.appendChild(document.createTextNode(node.getText()));
        }
        for (ConfigNode child : node.getChildren()) {
            element.appendChild(toElement(document, child));
        }
        return element;
    }

    private Transformer transformer() throws TransformerException {
        Transformer transformer = TransformerFactory.newInstance().newTransformer();
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
        return transformer;
    }
}
