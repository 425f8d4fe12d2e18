package com.github.xmdmodel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Adapts a JAXP DOM {@link Node} to {@link XmdNode}. Wrapping is shallow; children are wrapped on
 * demand, so adapting a whole document costs nothing until it's walked.
 */
public final class DomXmdNode implements XmdNode {
  private final Node node;

  public DomXmdNode(final Node node) {
    if (node == null) {
      throw new IllegalArgumentException("DOM node cannot be null");
    }
    this.node = node;
  }

  @Override
  public String getTagName() {
    return node.getNodeName();
  }

  @Override
  public boolean isElement() {
    return node.getNodeType() == Node.ELEMENT_NODE;
  }

  @Override
  public Map<String, String> getAttributes() {
    final NamedNodeMap domAttributes = node.getAttributes();
    if (domAttributes == null || domAttributes.getLength() == 0) {
      return Collections.emptyMap();
    }
    final Map<String, String> attributes = new LinkedHashMap<>();
    for (int iter = 0; iter < domAttributes.getLength(); iter++) {
      final Node attribute = domAttributes.item(iter);
      attributes.put(attribute.getNodeName(), attribute.getNodeValue());
    }
    return Collections.unmodifiableMap(attributes);
  }

  @Override
  public Optional<String> getAttribute(final String name) {
    final NamedNodeMap domAttributes = node.getAttributes();
    if (domAttributes == null) {
      return Optional.empty();
    }
    final Node attribute = domAttributes.getNamedItem(name);
    return attribute == null ? Optional.empty() : Optional.ofNullable(attribute.getNodeValue());
  }

  @Override
  public List<XmdNode> getChildren() {
    final NodeList domChildren = node.getChildNodes();
    final List<XmdNode> children = new ArrayList<>(domChildren.getLength());
    for (int iter = 0; iter < domChildren.getLength(); iter++) {
      children.add(new DomXmdNode(domChildren.item(iter)));
    }
    return Collections.unmodifiableList(children);
  }

  @Override
  public Optional<String> getTextContent() {
    final String text = node.getTextContent();
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(text);
  }

  public Node getDomNode() {
    return node;
  }

  @Override
  public String toString() {
    return "DomXmdNode [tagName=" + getTagName() + "]";
  }
}
