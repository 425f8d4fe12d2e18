package com.github.xmdmodel;

import java.util.Optional;

/**
 * This object represents an immutable event, ie. the label that triggers transitions.
 */
public final class Event {
  private final int id;
  private final Optional<String> name; // optional
  private final boolean controllable;
  private final boolean observable;

  public Event(final int id, final Optional<String> name, final boolean controllable,
      final boolean observable) {
    if (id < 0) {
      throw new IllegalArgumentException("Event id cannot be negative: " + id);
    }
    this.id = id;
    this.name = name == null ? Optional.<String>empty() : name;
    this.controllable = controllable;
    this.observable = observable;
  }

  public int getId() {
    return id;
  }

  public Optional<String> getName() {
    return name;
  }

  public boolean isControllable() {
    return controllable;
  }

  public boolean isObservable() {
    return observable;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + id;
    result = prime * result + name.hashCode();
    result = prime * result + (controllable ? 1231 : 1237);
    result = prime * result + (observable ? 1231 : 1237);
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
    Event other = (Event) obj;
    return id == other.id && controllable == other.controllable
        && observable == other.observable && name.equals(other.name);
  }

  @Override
  public String toString() {
    return "Event [id=" + id + ", name=" + name.orElse(null) + ", controllable=" + controllable
        + ", observable=" + observable + "]";
  }
}
