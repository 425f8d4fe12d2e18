package com.github.xmdmodel;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal read-only view of a node in a parsed document tree. The parser core only ever talks to
 * this interface, so any tree source (a DOM, a streaming builder, a hand-made fixture) can feed it
 * through an adapter.
 */
public interface XmdNode {

  /**
   * Element tag name. Non-element nodes report their synthetic name (eg. "#text") and are never
   * matched by the navigator or the classifier.
   */
  String getTagName();

  /**
   * True iff this node is an element as opposed to text, comment, processing-instruction or
   * document nodes.
   */
  boolean isElement();

  /**
   * Attribute name/value pairs in document order. Never null.
   */
  Map<String, String> getAttributes();

  /**
   * Direct children in document order. Never null.
   */
  List<XmdNode> getChildren();

  /**
   * Concatenated text of this node and its descendants, if there is any.
   */
  Optional<String> getTextContent();

  default Optional<String> getAttribute(final String name) {
    return Optional.ofNullable(getAttributes().get(name));
  }
}
