package com.github.xmdmodel;

import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reports parse progress to the log, one line per extracted element plus one per flag.
 */
public final class LoggingParseListener implements XmdParseListener {
  private static final Logger logger =
      LogManager.getLogger(LoggingParseListener.class.getSimpleName());

  @Override
  public void onState(final State state) {
    if (logger.isDebugEnabled()) {
      logger.debug("Found state " + label(state.getId(), state.getName()));
      if (state.isInitial()) {
        logger.debug("    state " + state.getId() + " is the initial state");
      }
      if (state.isMarked()) {
        logger.debug("    state " + state.getId() + " is marked");
      }
    }
  }

  @Override
  public void onEvent(final Event event) {
    if (logger.isDebugEnabled()) {
      logger.debug("Found event " + label(event.getId(), event.getName()));
      if (event.isControllable()) {
        logger.debug("    event " + event.getId() + " is controllable");
      }
      if (event.isObservable()) {
        logger.debug("    event " + event.getId() + " is observable");
      }
    }
  }

  @Override
  public void onTransition(final Transition transition) {
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Found transition %d from state %d to %d on event %d",
          transition.getId(), transition.getSourceStateId(), transition.getTargetStateId(),
          transition.getEventId()));
    }
  }

  @Override
  public void onIgnoredElement(final XmdNode node) {
    if (logger.isDebugEnabled()) {
      logger.debug("Ignoring unrecognized element <" + node.getTagName() + ">");
    }
  }

  @Override
  public void onSkippedElement(final XmdNode node, final XmdParseException problem) {
    logger.warn("Skipped <" + node.getTagName() + ">: " + problem.getMessage());
  }

  private static String label(final int id, final Optional<String> name) {
    return name.isPresent() ? id + " (" + name.get() + ")" : String.valueOf(id);
  }
}
