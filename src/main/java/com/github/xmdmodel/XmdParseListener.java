package com.github.xmdmodel;

/**
 * Observer of a parse in progress. Callbacks fire on the parsing thread, in document order, right
 * after each element has been extracted. Implementations should not throw.
 */
public interface XmdParseListener {

  default void onState(final State state) {}

  default void onEvent(final Event event) {}

  default void onTransition(final Transition transition) {}

  /**
   * A child of the data node that is not a state, event or transition element.
   */
  default void onIgnoredElement(final XmdNode node) {}

  /**
   * An element dropped under {@link MalformedIdentifierPolicy#SKIP_ELEMENT}.
   */
  default void onSkippedElement(final XmdNode node, final XmdParseException problem) {}
}
