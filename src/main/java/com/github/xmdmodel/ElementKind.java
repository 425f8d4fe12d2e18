package com.github.xmdmodel;

import java.util.Optional;

/**
 * Kinds of elements that may live under the data node of an XMD document.
 */
public enum ElementKind {
  STATE("state"),
  EVENT("event"),
  TRANSITION("transition");

  private final String tagName;

  private ElementKind(final String tagName) {
    this.tagName = tagName;
  }

  public String getTagName() {
    return tagName;
  }

  /**
   * Classify a child of the data node. Unknown tags and non-element nodes (whitespace, comments)
   * come back empty and are meant to be skipped.
   */
  public static Optional<ElementKind> classify(final XmdNode node) {
    if (node == null || !node.isElement()) {
      return Optional.empty();
    }
    for (final ElementKind kind : values()) {
      if (kind.tagName.equals(node.getTagName())) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
