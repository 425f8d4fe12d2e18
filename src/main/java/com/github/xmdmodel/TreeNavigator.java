package com.github.xmdmodel;

import java.util.Optional;

/**
 * Schema-agnostic lookups over the direct children of a node. Both lookups tolerate an absent
 * parent and propagate that absence instead of failing, which lets callers chain them without
 * checking every hop.
 */
public final class TreeNavigator {

  /**
   * First direct element child of parent tagged tagName, in document order.
   */
  public static Optional<XmdNode> findChild(final XmdNode parent, final String tagName) {
    if (parent == null || tagName == null) {
      return Optional.empty();
    }
    for (final XmdNode child : parent.getChildren()) {
      if (child.isElement() && tagName.equals(child.getTagName())) {
        return Optional.of(child);
      }
    }
    return Optional.empty();
  }

  public static Optional<XmdNode> findChild(final Optional<XmdNode> parent,
      final String tagName) {
    if (parent == null || !parent.isPresent()) {
      return Optional.empty();
    }
    return findChild(parent.get(), tagName);
  }

  public static boolean hasChild(final XmdNode parent, final String tagName) {
    return findChild(parent, tagName).isPresent();
  }

  public static boolean hasChild(final Optional<XmdNode> parent, final String tagName) {
    return findChild(parent, tagName).isPresent();
  }

  private TreeNavigator() {}
}
