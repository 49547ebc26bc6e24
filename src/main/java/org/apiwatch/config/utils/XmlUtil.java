package org.apiwatch.config.utils;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.Unmarshaller;

import java.io.InputStream;

public class XmlUtil {

    private XmlUtil() {}

    /**
     * Convert XML to a Java object of the given JAXB-annotated type.
     * Caller must handle or propagate exceptions (e.g., invalid XML).
     */
    public static <T> T unmarshal(InputStream xml, Class<T> type) throws Exception {
        JAXBContext ctx = JAXBContext.newInstance(type);
        Unmarshaller um = ctx.createUnmarshaller();
        return type.cast(um.unmarshal(xml));
    }
}
