package com.github.xmdmodel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import com.github.xmdmodel.XmdParseException.Code;

/**
 * Accumulates states, events and transitions in insertion order during a single pass and hands out
 * the finished {@link XmdModel} exactly once.
 *
 * The builder has two phases, ACCUMULATING and FINALIZED. {@link #build()} moves it from the
 * former to the latter; after that every add and every further build fails with
 * {@link Code#BUILDER_FINALIZED}. A builder belongs to one parse and is not meant to be shared
 * between threads.
 */
public final class ModelBuilder {
  private final IntegrityMode integrityMode;
  private final AtomicBoolean finalized = new AtomicBoolean();

  private final List<State> states = new ArrayList<>();
  private final List<Event> events = new ArrayList<>();
  private final List<Transition> transitions = new ArrayList<>();

  public ModelBuilder(final IntegrityMode integrityMode) {
    if (integrityMode == null) {
      throw new IllegalArgumentException("IntegrityMode cannot be null");
    }
    this.integrityMode = integrityMode;
  }

  public ModelBuilder addState(final State state) throws XmdParseException {
    accumulating();
    states.add(state);
    return this;
  }

  public ModelBuilder addEvent(final Event event) throws XmdParseException {
    accumulating();
    events.add(event);
    return this;
  }

  public ModelBuilder addTransition(final Transition transition) throws XmdParseException {
    accumulating();
    transitions.add(transition);
    return this;
  }

  public boolean isFinalized() {
    return finalized.get();
  }

  /**
   * Finalize the builder and emit the model. In {@link IntegrityMode#STRICT} mode, the model is
   * checked for duplicate ids and dangling transition references first and every violation found
   * is reported in a single {@link Code#INTEGRITY_VIOLATION}. The builder is finalized either way.
   */
  public XmdModel build() throws XmdParseException {
    if (!finalized.compareAndSet(false, true)) {
      throw new XmdParseException(Code.BUILDER_FINALIZED);
    }
    if (integrityMode == IntegrityMode.STRICT) {
      final List<String> violations = findIntegrityViolations();
      if (!violations.isEmpty()) {
        throw new XmdParseException(Code.INTEGRITY_VIOLATION,
            violations.size() + " integrity violation(s): " + String.join("; ", violations));
      }
    }
    return new XmdModel(states, events, transitions, Optional.<SourceFile>empty());
  }

  List<String> findIntegrityViolations() {
    final List<String> violations = new ArrayList<>();
    final Set<Integer> stateIds = new HashSet<>();
    for (final State state : states) {
      if (!stateIds.add(state.getId())) {
        violations.add("duplicate state id " + state.getId());
      }
    }
    final Set<Integer> eventIds = new HashSet<>();
    for (final Event event : events) {
      if (!eventIds.add(event.getId())) {
        violations.add("duplicate event id " + event.getId());
      }
    }
    final Set<Integer> transitionIds = new HashSet<>();
    for (final Transition transition : transitions) {
      if (!transitionIds.add(transition.getId())) {
        violations.add("duplicate transition id " + transition.getId());
      }
      if (!stateIds.contains(transition.getSourceStateId())) {
        violations.add("transition " + transition.getId() + " has unknown source state "
            + transition.getSourceStateId());
      }
      if (!stateIds.contains(transition.getTargetStateId())) {
        violations.add("transition " + transition.getId() + " has unknown target state "
            + transition.getTargetStateId());
      }
      if (!eventIds.contains(transition.getEventId())) {
        violations.add(
            "transition " + transition.getId() + " has unknown event " + transition.getEventId());
      }
    }
    return violations;
  }

  private void accumulating() throws XmdParseException {
    if (finalized.get()) {
      throw new XmdParseException(Code.BUILDER_FINALIZED);
    }
  }
}
