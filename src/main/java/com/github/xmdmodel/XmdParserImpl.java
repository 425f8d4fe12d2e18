package com.github.xmdmodel;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.xmdmodel.XmdParseException.Code;

/**
 * Default {@link XmdParser}.
 *
 * A parse is one linear walk over the children of the data node:<br>
 * 1. locate model, then data; either missing is a {@link Code#STRUCTURE_MISSING}<br>
 * 2. classify each child; unknown tags and non-element nodes are ignored<br>
 * 3. extract a typed record, notify listeners, hand it to the {@link ModelBuilder}<br>
 * 4. once the children are exhausted, finalize the builder into the model<br>
 *
 * The only state shared across parses is the immutable config, the listeners and the statistics
 * counters, so instances are safe to share between threads.
 */
final class XmdParserImpl implements XmdParser {
  private static final Logger logger = LogManager.getLogger(XmdParserImpl.class.getSimpleName());

  static final String MODEL = "model";
  static final String DATA = "data";

  private final String parserId = UUID.randomUUID().toString();
  private final XmdParserConfiguration config;
  private final XmdDocumentReader documentReader;
  private final List<XmdParseListener> listeners;
  private final XmdParserStatistics parserStats;

  XmdParserImpl(final XmdParserConfiguration config, final XmdDocumentReader documentReader,
      final List<XmdParseListener> listeners) {
    this.config = config;
    this.documentReader = documentReader;
    this.listeners = Collections.unmodifiableList(new ArrayList<>(listeners));
    this.parserStats = new XmdParserStatistics(parserId);
    logInfo(parserId, null, "Fired up parser with " + config);
  }

  @Override
  public XmdModel parse(final XmdNode documentRoot) throws XmdParseException {
    return parse(documentRoot, "tree");
  }

  @Override
  public XmdModel parse(final Path xmdFile) throws XmdParseException {
    final XmdDocument document;
    try {
      document = documentReader.load(xmdFile);
    } catch (XmdParseException problem) {
      parserStats.failedParses.incrementAndGet();
      logError(parserId, String.valueOf(xmdFile), "Failed to load document", problem);
      throw problem;
    }
    final SourceFile sourceFile = document.getSourceFile();
    return parse(document.getRoot(), sourceFile.getFullPath().toString())
        .withSourceFile(sourceFile);
  }

  private XmdModel parse(final XmdNode documentRoot, final String documentLabel)
      throws XmdParseException {
    final long startMillis = System.currentTimeMillis();
    logInfo(parserId, documentLabel, "Parsing document");
    try {
      final XmdModel model = extract(documentRoot, documentLabel);
      parserStats.successfulParses.incrementAndGet();
      logInfo(parserId, documentLabel, "Successfully parsed " + model);
      return model;
    } catch (XmdParseException problem) {
      parserStats.failedParses.incrementAndGet();
      logError(parserId, documentLabel, "Failed to parse document", problem);
      throw problem;
    } finally {
      parserStats.lastParseMillis.set(System.currentTimeMillis() - startMillis);
    }
  }

  private XmdModel extract(final XmdNode documentRoot, final String documentLabel)
      throws XmdParseException {
    final Optional<XmdNode> modelNode = TreeNavigator.findChild(documentRoot, MODEL);
    if (!modelNode.isPresent()) {
      throw new XmdParseException(Code.STRUCTURE_MISSING,
          "Document has no <" + MODEL + "> element");
    }
    final Optional<XmdNode> dataNode = TreeNavigator.findChild(modelNode, DATA);
    if (!dataNode.isPresent()) {
      throw new XmdParseException(Code.STRUCTURE_MISSING,
          "<" + MODEL + "> has no <" + DATA + "> element");
    }

    final ModelBuilder builder = new ModelBuilder(config.getIntegrityMode());
    for (final XmdNode child : dataNode.get().getChildren()) {
      final Optional<ElementKind> kind = ElementKind.classify(child);
      if (!kind.isPresent()) {
        if (child.isElement()) {
          parserStats.ignoredElements.incrementAndGet();
          for (final XmdParseListener listener : listeners) {
            listener.onIgnoredElement(child);
          }
        }
        continue;
      }
      try {
        accumulate(builder, kind.get(), child);
      } catch (XmdParseException problem) {
        if (problem.getCode() != Code.MALFORMED_IDENTIFIER
            || config.getMalformedIdentifierPolicy() != MalformedIdentifierPolicy.SKIP_ELEMENT) {
          throw problem;
        }
        parserStats.skippedElements.incrementAndGet();
        logWarning(parserId, documentLabel,
            "Skipping <" + child.getTagName() + ">: " + problem.getMessage());
        for (final XmdParseListener listener : listeners) {
          listener.onSkippedElement(child, problem);
        }
      }
    }
    return builder.build();
  }

  private void accumulate(final ModelBuilder builder, final ElementKind kind, final XmdNode node)
      throws XmdParseException {
    switch (kind) {
      case STATE:
        final State state = ElementExtractor.extractState(node);
        for (final XmdParseListener listener : listeners) {
          listener.onState(state);
        }
        builder.addState(state);
        break;
      case EVENT:
        final Event event = ElementExtractor.extractEvent(node);
        for (final XmdParseListener listener : listeners) {
          listener.onEvent(event);
        }
        builder.addEvent(event);
        break;
      case TRANSITION:
        final Transition transition = ElementExtractor.extractTransition(node);
        for (final XmdParseListener listener : listeners) {
          listener.onTransition(transition);
        }
        builder.addTransition(transition);
        break;
      default:
        throw new IllegalStateException("Unhandled element kind " + kind);
    }
  }

  @Override
  public String getId() {
    return parserId;
  }

  @Override
  public XmdParserConfiguration getConfiguration() {
    return config;
  }

  @Override
  public XmdParserStatistics getStatistics() {
    return parserStats;
  }

  private static void logError(final String parserId, final String documentLabel,
      final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[p:").append(parserId).append("][d:")
        .append(documentLabel).append("] ").append(message).toString(), error);
  }

  private static void logWarning(final String parserId, final String documentLabel,
      final String message) {
    logger.warn(new StringBuilder().append("[p:").append(parserId).append("][d:")
        .append(documentLabel).append("] ").append(message).toString());
  }

  private static void logInfo(final String parserId, final String documentLabel,
      final String message) {
    logger.info(new StringBuilder().append("[p:").append(parserId).append("][d:")
        .append(documentLabel).append("] ").append(message).toString());
  }

  @Override
  public String toString() {
    return "XmdParserImpl [parserId=" + parserId + ", config=" + config + ", listeners="
        + listeners.size() + "]";
  }
}
