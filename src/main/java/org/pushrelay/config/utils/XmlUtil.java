package org.pushrelay.config.utils;

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
     * Parse an XML stream into a DOM document. DOCTYPE declarations are rejected
     * so that config files cannot pull in external entities.
     */
    public static Document parse(InputStream in) throws Exception {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbf.setExpandEntityReferences(false);
        DocumentBuilder builder = dbf.newDocumentBuilder();
        return builder.parse(in);
    }

    /**
     * Convert XML → Java object.
     * The {@link JAXBContext} is created for the requested type, so any JAXB-annotated
     * class can be bound. Invalid XML or binding problems are thrown to the caller.
     */
    @SuppressWarnings("unchecked")
    public static <T> T unmarshal(Document xmlDoc, Class<T> type) throws Exception {
        JAXBContext ctx = JAXBContext.newInstance(type);
        Unmarshaller um = ctx.createUnmarshaller();
        return (T) um.unmarshal(xmlDoc);
    }
}
