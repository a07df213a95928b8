package io.papyrser.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Loads TEI files into namespace-aware DOM documents. External entities and DTDs are never
 * fetched; EpiDoc files reference remote schemas that must not be resolved.
 */
public final class TeiReader {
  private final DocumentBuilderFactory factory;

  public TeiReader() {
    factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setValidating(false);
    factory.setExpandEntityReferences(false);
    factory.setXIncludeAware(false);
    try {
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
      factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser does not support secure processing", e);
    }
  }

  public Document read(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return parse(new InputSource(in), file.toString());
    }
  }

  public Document read(InputStream in) throws IOException {
    return parse(new InputSource(in), "stream");
  }

  public Document readString(String xml) throws IOException {
    return parse(new InputSource(new StringReader(xml)), "string");
  }

  private Document parse(InputSource source, String origin) throws IOException {
    try {
      // DocumentBuilder is not thread-safe; the factory is only read here
      DocumentBuilder builder;
      synchronized (factory) {
        builder = factory.newDocumentBuilder();
      }
      builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
      builder.setErrorHandler(null);
      return builder.parse(source);
    } catch (ParserConfigurationException e) {
      throw new IOException("Cannot create XML parser", e);
    } catch (SAXException e) {
      throw new IOException("Malformed XML in " + origin + ": " + e.getMessage(), e);
    }
  }
}
