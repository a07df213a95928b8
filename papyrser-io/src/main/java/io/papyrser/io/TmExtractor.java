package io.papyrser.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;

/**
 * Reads the Trismegistos numbers of an edition from its {@code idno[@type="TM"]} elements. An
 * element may list several numbers separated by whitespace.
 */
public final class TmExtractor {
  private static final Logger log = LoggerFactory.getLogger(TmExtractor.class);

  static final String TM_XPATH = "//*[local-name()='idno'][@type='TM']";

  private final TeiReader reader;

  public TmExtractor(TeiReader reader) {
    this.reader = reader;
  }

  public List<Integer> tmNumbers(Path file) throws IOException {
    return tmNumbers(reader.read(file));
  }

  /** Distinct TM numbers in document order. Non-numeric values are skipped. */
  public static List<Integer> tmNumbers(Document document) {
    Set<Integer> numbers = new LinkedHashSet<>();
    for (String text : select(document, TM_XPATH)) {
      for (String token : text.strip().split("\\s+")) {
        if (token.isEmpty()) {
          continue;
        }
        try {
          numbers.add(Integer.parseInt(token));
        } catch (NumberFormatException e) {
          log.debug("Ignoring non-numeric TM value '{}'", token);
        }
      }
    }
    return new ArrayList<>(numbers);
  }

  /** Text content of every node matching {@code expression}. */
  static List<String> select(Document document, String expression) {
    XPath xpath = XPathFactory.newInstance().newXPath();
    try {
      NodeList nodes = (NodeList) xpath.evaluate(expression, document, XPathConstants.NODESET);
      List<String> values = new ArrayList<>(nodes.getLength());
      for (int i = 0; i < nodes.getLength(); i++) {
        values.add(nodes.item(i).getTextContent());
      }
      return values;
    } catch (XPathExpressionException e) {
      throw new IllegalArgumentException("Invalid XPath " + expression, e);
    }
  }
}
