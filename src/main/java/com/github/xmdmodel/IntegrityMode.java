package com.github.xmdmodel;

/**
 * This represents how strictly the model builder checks identifiers when it finalizes a model.
 */
public enum IntegrityMode {
  // reject duplicate ids and transitions pointing at unknown states or events
  STRICT,
  // accept whatever the document declares; duplicates and dangling references pass through
  PERMISSIVE;
}
