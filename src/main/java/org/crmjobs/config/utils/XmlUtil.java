package org.crmjobs.config.utils;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.Unmarshaller;
import org.w3c.dom.Document;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.InputStream;

public class XmlUtil {
    private XmlUtil() {}

    /**
     * Parse an XML stream into a DOM document. DTDs and external entities are refused.
     */
    public static Document parse(InputStream in) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(true);
        DocumentBuilder builder = factory.newDocumentBuilder();
        return builder.parse(in);
    }

    /**
     * Convert a parsed XML document into an instance of the given JAXB-annotated type.
     */
    public static <T> T unmarshal(Document xmlDoc, Class<T> type) throws Exception {
        JAXBContext ctx = JAXBContext.newInstance(type);
        Unmarshaller um = ctx.createUnmarshaller();
        return um.unmarshal(xmlDoc, type).getValue();
    }
}
