package com.github.xmdmodel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory {@link XmdNode}. Use the {@code SimpleXmdNodeBuilder} to put a tree together
 * when the document doesn't come out of a DOM.
 */
public final class SimpleXmdNode implements XmdNode {
  static final String TEXT_NODE_NAME = "#text";
  static final String DOCUMENT_NODE_NAME = "#document";

  private final String tagName;
  private final boolean element;
  private final Map<String, String> attributes;
  private final List<XmdNode> children;
  private final String text;

  private SimpleXmdNode(final String tagName, final boolean element,
      final Map<String, String> attributes, final List<XmdNode> children, final String text) {
    this.tagName = tagName;
    this.element = element;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    this.children = Collections.unmodifiableList(new ArrayList<>(children));
    this.text = text;
  }

  /**
   * A bare text node, eg. the whitespace between two elements.
   */
  public static SimpleXmdNode text(final String text) {
    return new SimpleXmdNode(TEXT_NODE_NAME, false, Collections.<String, String>emptyMap(),
        Collections.<XmdNode>emptyList(), text);
  }

  /**
   * A document node wrapping the given root element, mirroring what a DOM parser hands out.
   */
  public static SimpleXmdNode document(final XmdNode rootElement) {
    return new SimpleXmdNode(DOCUMENT_NODE_NAME, false, Collections.<String, String>emptyMap(),
        Collections.singletonList(rootElement), null);
  }

  @Override
  public String getTagName() {
    return tagName;
  }

  @Override
  public boolean isElement() {
    return element;
  }

  @Override
  public Map<String, String> getAttributes() {
    return attributes;
  }

  @Override
  public List<XmdNode> getChildren() {
    return children;
  }

  @Override
  public Optional<String> getTextContent() {
    if (text != null) {
      return Optional.of(text);
    }
    final StringBuilder builder = new StringBuilder();
    for (final XmdNode child : children) {
      child.getTextContent().ifPresent(builder::append);
    }
    return builder.length() == 0 ? Optional.empty() : Optional.of(builder.toString());
  }

  @Override
  public String toString() {
    return "SimpleXmdNode [tagName=" + tagName + ", attributes=" + attributes + ", children="
        + children.size() + "]";
  }

  public final static class SimpleXmdNodeBuilder {
    private final String tagName;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<XmdNode> children = new ArrayList<>();

    public static SimpleXmdNodeBuilder element(final String tagName) {
      return new SimpleXmdNodeBuilder(tagName);
    }

    public SimpleXmdNodeBuilder attribute(final String name, final String value) {
      attributes.put(name, value);
      return this;
    }

    public SimpleXmdNodeBuilder child(final XmdNode child) {
      children.add(child);
      return this;
    }

    public SimpleXmdNodeBuilder child(final SimpleXmdNodeBuilder child) {
      children.add(child.build());
      return this;
    }

    public SimpleXmdNodeBuilder text(final String text) {
      children.add(SimpleXmdNode.text(text));
      return this;
    }

    public SimpleXmdNode build() {
      return new SimpleXmdNode(tagName, true, attributes, children, null);
    }

    private SimpleXmdNodeBuilder(final String tagName) {
      if (tagName == null || tagName.trim().isEmpty()) {
        throw new IllegalArgumentException("Element tag name cannot be null or blank");
      }
      this.tagName = tagName;
    }
  }
}
