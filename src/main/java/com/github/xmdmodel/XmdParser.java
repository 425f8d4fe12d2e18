package com.github.xmdmodel;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns XMD documents into {@link XmdModel}s.
 *
 * Notes for users:<br>
 * 1. a parser instance is thread-safe and reusable; every parse gets its own model builder, so
 * there's no need to make a new parser per document<br>
 *
 * 2. the parser only needs a generic {@link XmdNode} tree. {@link #parse(Path)} is a convenience
 * that goes through {@link XmdDocumentReader} first<br>
 *
 * 3. a parse either hands back a complete model or throws; partial models never escape<br>
 *
 * 4. children of the data node other than state, event and transition elements are ignored<br>
 *
 * 5. progress is not logged element by element unless a listener such as
 * {@link LoggingParseListener} is registered<br>
 */
public interface XmdParser {

  /**
   * Parse a document tree. The root is expected to have a {@code <model>} child which in turn has a
   * {@code <data>} child.
   */
  XmdModel parse(final XmdNode documentRoot) throws XmdParseException;

  /**
   * Read an .xmd file and parse it. The returned model carries the {@link SourceFile}.
   */
  XmdModel parse(final Path xmdFile) throws XmdParseException;

  /**
   * Reports the id of this parser instance, used to tag its log lines.
   */
  String getId();

  /**
   * Returns the config that this parser is wired with.
   */
  XmdParserConfiguration getConfiguration();

  /**
   * Report statistics for this parser.
   */
  XmdParserStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build parsers.
   */
  public final static class XmdParserBuilder {
    private XmdParserConfiguration config;
    private XmdDocumentReader documentReader;
    private final List<XmdParseListener> listeners = new ArrayList<>();

    public static XmdParserBuilder newBuilder() {
      return new XmdParserBuilder();
    }

    public XmdParserBuilder config(final XmdParserConfiguration config) {
      this.config = config;
      return this;
    }

    public XmdParserBuilder documentReader(final XmdDocumentReader documentReader) {
      this.documentReader = documentReader;
      return this;
    }

    public XmdParserBuilder listener(final XmdParseListener listener) {
      if (listener != null) {
        this.listeners.add(listener);
      }
      return this;
    }

    public XmdParser build() {
      return new XmdParserImpl(config == null ? XmdParserConfiguration.defaults() : config,
          documentReader == null ? new XmdDocumentReader() : documentReader, listeners);
    }

    private XmdParserBuilder() {}
  }

}
