package io.papyrser.core.parser;

import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/** Namespace-agnostic DOM helpers. Documents may be parsed with or without namespace awareness. */
final class Dom {
  static final String XML_NS = "http://www.w3.org/XML/1998/namespace";

  private Dom() {}

  static String localName(Node node) {
    String name = node.getLocalName();
    if (name == null) {
      name = node.getNodeName();
      int colon = name.indexOf(':');
      if (colon >= 0) {
        name = name.substring(colon + 1);
      }
    }
    return name;
  }

  /** Attribute value, or null when absent. */
  static String attr(Element element, String name) {
    if (!element.hasAttribute(name)) {
      return null;
    }
    return element.getAttribute(name);
  }

  /** {@code xml:lang} of the element itself, or null. */
  static String lang(Element element) {
    if (element.hasAttributeNS(XML_NS, "lang")) {
      return element.getAttributeNS(XML_NS, "lang");
    }
    return attr(element, "xml:lang");
  }

  /** {@code xml:lang} of the element or its nearest ancestor declaring one. */
  static String inheritedLang(Element element) {
    for (Node n = element; n instanceof Element; n = n.getParentNode()) {
      String lang = lang((Element) n);
      if (lang != null) {
        return lang;
      }
    }
    return null;
  }

  static List<Node> children(Node parent) {
    NodeList list = parent.getChildNodes();
    List<Node> result = new ArrayList<>(list.getLength());
    for (int i = 0; i < list.getLength(); i++) {
      result.add(list.item(i));
    }
    return result;
  }

  /** Descendant elements with the given local name, in document order. */
  static List<Element> descendants(Node root, String localName) {
    List<Element> result = new ArrayList<>();
    collect(root, localName, result);
    return result;
  }

  private static void collect(Node node, String localName, List<Element> result) {
    for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (child.getNodeType() == Node.ELEMENT_NODE) {
        if (localName.equals(localName(child))) {
          result.add((Element) child);
        }
        collect(child, localName, result);
      }
    }
  }

  static List<Element> allElements(Node root) {
    List<Element> result = new ArrayList<>();
    collectAll(root, result);
    return result;
  }

  private static void collectAll(Node node, List<Element> result) {
    for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (child.getNodeType() == Node.ELEMENT_NODE) {
        result.add((Element) child);
        collectAll(child, result);
      }
    }
  }

  /** Nearest ancestor element with the given local name, or null. */
  static Element ancestor(Element element, String localName) {
    for (Node n = element.getParentNode(); n instanceof Element; n = n.getParentNode()) {
      if (localName.equals(localName(n))) {
        return (Element) n;
      }
    }
    return null;
  }
}
