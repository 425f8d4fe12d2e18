package com.github.xmdmodel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable automaton extracted from one XMD document. Collections keep document order. Lookups by
 * id return the first entry declared with that id, which only matters for models built in
 * {@link IntegrityMode#PERMISSIVE} mode.
 */
public final class XmdModel {
  private final List<State> states;
  private final List<Event> events;
  private final List<Transition> transitions;

  private final Map<Integer, State> statesById;
  private final Map<Integer, Event> eventsById;
  private final Map<Integer, Transition> transitionsById;

  private final Optional<SourceFile> sourceFile;

  XmdModel(final List<State> states, final List<Event> events,
      final List<Transition> transitions, final Optional<SourceFile> sourceFile) {
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.events = Collections.unmodifiableList(new ArrayList<>(events));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    this.sourceFile = sourceFile == null ? Optional.<SourceFile>empty() : sourceFile;

    final Map<Integer, State> stateIndex = new HashMap<>();
    for (final State state : this.states) {
      stateIndex.putIfAbsent(state.getId(), state);
    }
    final Map<Integer, Event> eventIndex = new HashMap<>();
    for (final Event event : this.events) {
      eventIndex.putIfAbsent(event.getId(), event);
    }
    final Map<Integer, Transition> transitionIndex = new HashMap<>();
    for (final Transition transition : this.transitions) {
      transitionIndex.putIfAbsent(transition.getId(), transition);
    }
    this.statesById = Collections.unmodifiableMap(stateIndex);
    this.eventsById = Collections.unmodifiableMap(eventIndex);
    this.transitionsById = Collections.unmodifiableMap(transitionIndex);
  }

  /**
   * Same model, tagged with the file it came from.
   */
  XmdModel withSourceFile(final SourceFile sourceFile) {
    return new XmdModel(states, events, transitions, Optional.ofNullable(sourceFile));
  }

  public List<State> getStates() {
    return states;
  }

  public List<Event> getEvents() {
    return events;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  public int getNumStates() {
    return states.size();
  }

  public int getNumEvents() {
    return events.size();
  }

  public int getNumTransitions() {
    return transitions.size();
  }

  public Optional<State> findState(final int stateId) {
    return Optional.ofNullable(statesById.get(stateId));
  }

  public Optional<Event> findEvent(final int eventId) {
    return Optional.ofNullable(eventsById.get(eventId));
  }

  public Optional<Transition> findTransition(final int transitionId) {
    return Optional.ofNullable(transitionsById.get(transitionId));
  }

  public Optional<State> sourceOf(final Transition transition) {
    return findState(transition.getSourceStateId());
  }

  public Optional<State> targetOf(final Transition transition) {
    return findState(transition.getTargetStateId());
  }

  public Optional<Event> eventOf(final Transition transition) {
    return findEvent(transition.getEventId());
  }

  /**
   * Well-formed automata declare exactly one, but nothing here enforces it.
   */
  public List<State> getInitialStates() {
    final List<State> initialStates = new ArrayList<>();
    for (final State state : states) {
      if (state.isInitial()) {
        initialStates.add(state);
      }
    }
    return Collections.unmodifiableList(initialStates);
  }

  public List<State> getMarkedStates() {
    final List<State> markedStates = new ArrayList<>();
    for (final State state : states) {
      if (state.isMarked()) {
        markedStates.add(state);
      }
    }
    return Collections.unmodifiableList(markedStates);
  }

  /**
   * Transitions leaving the given state, in document order.
   */
  public List<Transition> transitionsFrom(final int stateId) {
    final List<Transition> outgoing = new ArrayList<>();
    for (final Transition transition : transitions) {
      if (transition.getSourceStateId() == stateId) {
        outgoing.add(transition);
      }
    }
    return Collections.unmodifiableList(outgoing);
  }

  public Optional<SourceFile> getSourceFile() {
    return sourceFile;
  }

  @Override
  public String toString() {
    return "XmdModel [numStates=" + getNumStates() + ", numEvents=" + getNumEvents()
        + ", numTransitions=" + getNumTransitions() + ", sourceFile=" + sourceFile.orElse(null)
        + "]";
  }
}
