package com.github.xmdmodel;

import java.util.Optional;

import com.github.xmdmodel.XmdParseException.Code;

/**
 * Pulls typed records out of classified state, event and transition elements.
 *
 * Notes:<br>
 * 1. identifiers must be plain non-negative decimal integers that fit an int; anything else is a
 * {@link Code#MALFORMED_IDENTIFIER}<br>
 * 2. a missing properties node means every flag is false, a missing name node means no display
 * name; neither is an error<br>
 */
final class ElementExtractor {
  static final String ID = "id";
  static final String SOURCE = "source";
  static final String TARGET = "target";
  static final String EVENT = "event";

  static final String PROPERTIES = "properties";
  static final String NAME = "name";
  static final String INITIAL = "initial";
  static final String MARKED = "marked";
  static final String CONTROLLABLE = "controllable";
  static final String OBSERVABLE = "observable";

  static State extractState(final XmdNode node) throws XmdParseException {
    final int id = parseIdentifier(node, ID);
    final Optional<XmdNode> properties = TreeNavigator.findChild(node, PROPERTIES);
    return new State(id, extractName(node), TreeNavigator.hasChild(properties, INITIAL),
        TreeNavigator.hasChild(properties, MARKED));
  }

  static Event extractEvent(final XmdNode node) throws XmdParseException {
    final int id = parseIdentifier(node, ID);
    final Optional<XmdNode> properties = TreeNavigator.findChild(node, PROPERTIES);
    return new Event(id, extractName(node), TreeNavigator.hasChild(properties, CONTROLLABLE),
        TreeNavigator.hasChild(properties, OBSERVABLE));
  }

  static Transition extractTransition(final XmdNode node) throws XmdParseException {
    return new Transition(parseIdentifier(node, ID), parseIdentifier(node, SOURCE),
        parseIdentifier(node, TARGET), parseIdentifier(node, EVENT));
  }

  static Optional<String> extractName(final XmdNode node) {
    final Optional<XmdNode> nameNode = TreeNavigator.findChild(node, NAME);
    if (!nameNode.isPresent()) {
      return Optional.empty();
    }
    final Optional<String> text = nameNode.get().getTextContent();
    return text.isPresent() ? Optional.of(text.get().trim()) : Optional.<String>empty();
  }

  static int parseIdentifier(final XmdNode node, final String attributeName)
      throws XmdParseException {
    final Optional<String> raw = node.getAttribute(attributeName);
    if (!raw.isPresent()) {
      throw malformed(node, attributeName, "is missing");
    }
    final String value = raw.get().trim();
    if (value.isEmpty()) {
      throw malformed(node, attributeName, "is empty");
    }
    for (int iter = 0; iter < value.length(); iter++) {
      final char digit = value.charAt(iter);
      if (digit < '0' || digit > '9') {
        throw malformed(node, attributeName, "is not a non-negative integer: '" + raw.get() + "'");
      }
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException overflow) {
      throw new XmdParseException(Code.MALFORMED_IDENTIFIER,
          describe(node, attributeName) + " is out of range: '" + raw.get() + "'", overflow);
    }
  }

  private static XmdParseException malformed(final XmdNode node, final String attributeName,
      final String problem) {
    return new XmdParseException(Code.MALFORMED_IDENTIFIER,
        describe(node, attributeName) + " " + problem);
  }

  private static String describe(final XmdNode node, final String attributeName) {
    return "Attribute '" + attributeName + "' of <" + node.getTagName() + ">";
  }

  private ElementExtractor() {}
}
