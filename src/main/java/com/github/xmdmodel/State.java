package com.github.xmdmodel;

import java.util.Optional;

/**
 * This object represents an immutable state of the automaton as declared in an XMD document.
 */
public final class State {
  private final int id;
  private final Optional<String> name; // optional
  private final boolean initial;
  private final boolean marked;

  public State(final int id, final Optional<String> name, final boolean initial,
      final boolean marked) {
    if (id < 0) {
      throw new IllegalArgumentException("State id cannot be negative: " + id);
    }
    this.id = id;
    this.name = name == null ? Optional.<String>empty() : name;
    this.initial = initial;
    this.marked = marked;
  }

  public int getId() {
    return id;
  }

  public Optional<String> getName() {
    return name;
  }

  public boolean isInitial() {
    return initial;
  }

  public boolean isMarked() {
    return marked;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + id;
    result = prime * result + name.hashCode();
    result = prime * result + (initial ? 1231 : 1237);
    result = prime * result + (marked ? 1231 : 1237);
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
    State other = (State) obj;
    return id == other.id && initial == other.initial && marked == other.marked
        && name.equals(other.name);
  }

  @Override
  public String toString() {
    return "State [id=" + id + ", name=" + name.orElse(null) + ", initial=" + initial
        + ", marked=" + marked + "]";
  }
}
