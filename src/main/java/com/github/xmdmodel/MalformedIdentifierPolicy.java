package com.github.xmdmodel;

/**
 * This represents what the parser does when an id, source, target or event attribute can't be
 * read as a non-negative integer.
 */
public enum MalformedIdentifierPolicy {
  // abort the whole parse, no partial model is handed out
  FAIL,
  // drop the offending element, warn, and keep going with its siblings
  SKIP_ELEMENT;
}
