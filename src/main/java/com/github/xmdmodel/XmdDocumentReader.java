package com.github.xmdmodel;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import com.github.xmdmodel.XmdParseException.Code;

/**
 * Reads XMD files off disk into {@link XmdNode} trees. This is plain I/O glue; the parser core
 * never depends on it and will happily take a tree from anywhere else.
 *
 * Notes:<br>
 * 1. only files carrying the {@value #XMD_EXTENSION} extension are accepted<br>
 * 2. relative paths are resolved against the current working directory<br>
 * 3. DTDs and external entities are never fetched<br>
 */
public final class XmdDocumentReader {
  private static final Logger logger =
      LogManager.getLogger(XmdDocumentReader.class.getSimpleName());

  public static final String XMD_EXTENSION = ".xmd";

  /**
   * Load and parse the given file, recording where it came from and when.
   */
  public XmdDocument load(final Path xmdFile) throws XmdParseException {
    if (xmdFile == null || xmdFile.getFileName() == null) {
      throw new XmdParseException(Code.DOCUMENT_READ_FAILURE, "XMD file path cannot be null");
    }
    final String fullName = xmdFile.getFileName().toString();
    final int dot = fullName.lastIndexOf('.');
    final String extension = dot < 0 ? "" : fullName.substring(dot);
    if (!XMD_EXTENSION.equals(extension)) {
      throw new XmdParseException(Code.UNSUPPORTED_FILE_TYPE, String.format(
          "Unsupported file type '%s'. Only %s files are currently supported.", extension,
          XMD_EXTENSION));
    }
    final Path fullPath = xmdFile.toAbsolutePath().normalize();
    final long loadTimeMillis = System.currentTimeMillis();
    final long modifiedTimeMillis;
    final XmdNode root;
    try (InputStream in = Files.newInputStream(fullPath)) {
      modifiedTimeMillis = Files.getLastModifiedTime(fullPath).toMillis();
      root = parse(in, fullPath.toString());
    } catch (IOException problem) {
      throw new XmdParseException(Code.DOCUMENT_READ_FAILURE,
          "Failed to read XML file: " + fullPath, problem);
    }
    final SourceFile sourceFile = new SourceFile(fullName.substring(0, dot), extension,
        fullPath.getParent(), fullPath, loadTimeMillis, modifiedTimeMillis);
    logger.info("Loaded " + sourceFile);
    return new XmdDocument(sourceFile, root);
  }

  /**
   * Parse raw bytes with no file bookkeeping. The stream is not closed.
   */
  public XmdNode read(final InputStream in) throws XmdParseException {
    if (in == null) {
      throw new XmdParseException(Code.DOCUMENT_READ_FAILURE, "Input stream cannot be null");
    }
    return parse(in, "<stream>");
  }

  private XmdNode parse(final InputStream in, final String label) throws XmdParseException {
    try {
      final DocumentBuilder builder = newDocumentBuilder(label);
      final Document document = builder.parse(in);
      return new DomXmdNode(document);
    } catch (SAXException | IOException problem) {
      throw new XmdParseException(Code.DOCUMENT_READ_FAILURE,
          "Failed to read XML document: " + label, problem);
    }
  }

  private static DocumentBuilder newDocumentBuilder(final String label)
      throws XmdParseException {
    final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(false);
    factory.setValidating(false);
    factory.setIgnoringComments(true);
    factory.setCoalescing(true);
    factory.setExpandEntityReferences(false);
    factory.setXIncludeAware(false);
    try {
      factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
      factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
      final DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(new LoggingErrorHandler(label));
      return builder;
    } catch (ParserConfigurationException problem) {
      throw new XmdParseException(Code.DOCUMENT_READ_FAILURE,
          "Failed to set up XML parser for " + label, problem);
    }
  }

  /**
   * Routes parser diagnostics to the log instead of stderr; errors abort the read.
   */
  private static final class LoggingErrorHandler implements ErrorHandler {
    private final String label;

    private LoggingErrorHandler(final String label) {
      this.label = label;
    }

    @Override
    public void warning(final SAXParseException exception) {
      logger.warn(describe(exception));
    }

    @Override
    public void error(final SAXParseException exception) throws SAXException {
      throw exception;
    }

    @Override
    public void fatalError(final SAXParseException exception) throws SAXException {
      logger.error(describe(exception));
      throw exception;
    }

    private String describe(final SAXParseException exception) {
      return String.format("%s [line:%d, column:%d] %s", label, exception.getLineNumber(),
          exception.getColumnNumber(), exception.getMessage());
    }
  }
}
