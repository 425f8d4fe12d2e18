package com.github.xmdmodel;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals for one parser instance across all of its parses.
 */
public final class XmdParserStatistics {
  private final String parserId;
  private final long startTstampMillis = System.currentTimeMillis();

  final AtomicLong successfulParses = new AtomicLong();
  final AtomicLong failedParses = new AtomicLong();
  final AtomicLong ignoredElements = new AtomicLong();
  final AtomicLong skippedElements = new AtomicLong();
  final AtomicLong lastParseMillis = new AtomicLong();

  XmdParserStatistics(final String parserId) {
    this.parserId = parserId;
  }

  public String getParserId() {
    return parserId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getSuccessfulParses() {
    return successfulParses.get();
  }

  public long getFailedParses() {
    return failedParses.get();
  }

  /**
   * Children of data nodes that were neither states, events nor transitions.
   */
  public long getIgnoredElements() {
    return ignoredElements.get();
  }

  /**
   * Elements dropped for malformed identifiers under
   * {@link MalformedIdentifierPolicy#SKIP_ELEMENT}.
   */
  public long getSkippedElements() {
    return skippedElements.get();
  }

  public long getLastParseMillis() {
    return lastParseMillis.get();
  }

  @Override
  public String toString() {
    return "XmdParserStatistics [parserId=" + parserId + ", startTstampMillis=" + startTstampMillis
        + ", successfulParses=" + successfulParses + ", failedParses=" + failedParses
        + ", ignoredElements=" + ignoredElements + ", skippedElements=" + skippedElements
        + ", lastParseMillis=" + lastParseMillis + "]";
  }
}
