package com.github.xmdmodel;

/**
 * A directed edge source->target labeled by an event. States and events are referenced by id
 * only; {@link XmdModel} resolves them.
 */
public final class Transition {
  private final int id;
  private final int sourceStateId;
  private final int targetStateId;
  private final int eventId;

  public Transition(final int id, final int sourceStateId, final int targetStateId,
      final int eventId) {
    if (id < 0 || sourceStateId < 0 || targetStateId < 0 || eventId < 0) {
      throw new IllegalArgumentException(String.format(
          "Transition identifiers cannot be negative: id=%d, source=%d, target=%d, event=%d", id,
          sourceStateId, targetStateId, eventId));
    }
    this.id = id;
    this.sourceStateId = sourceStateId;
    this.targetStateId = targetStateId;
    this.eventId = eventId;
  }

  public int getId() {
    return id;
  }

  public int getSourceStateId() {
    return sourceStateId;
  }

  public int getTargetStateId() {
    return targetStateId;
  }

  public int getEventId() {
    return eventId;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + id;
    result = prime * result + sourceStateId;
    result = prime * result + targetStateId;
    result = prime * result + eventId;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    Transition other = (Transition) obj;
    return id == other.id && sourceStateId == other.sourceStateId
        && targetStateId == other.targetStateId && eventId == other.eventId;
  }

  @Override
  public String toString() {
    return "Transition [id=" + id + ", source=" + sourceStateId + ", target=" + targetStateId
        + ", event=" + eventId + "]";
  }
}
