package com.github.xmdmodel;

/**
 * Unified single exception that's thrown and handled by this parser. The idea is to use the code
 * enum to encapsulate the various failure conditions. Stack traces of underlying causes, where
 * available, are kept intact.
 */
public final class XmdParseException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public XmdParseException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public XmdParseException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public XmdParseException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    STRUCTURE_MISSING("Document does not contain the required model/data structure"),
    // 2.
    MALFORMED_IDENTIFIER("Identifier attribute is absent or not a non-negative integer"),
    // 3.
    INTEGRITY_VIOLATION("Model contains duplicate identifiers or dangling references"),
    // 4.
    UNSUPPORTED_FILE_TYPE("Unsupported file type. Only .xmd files are currently supported"),
    // 5.
    DOCUMENT_READ_FAILURE("Failed to read XMD document"),
    // 6.
    BUILDER_FINALIZED("Model builder is already finalized and cannot be modified"),
    // 7.
    INVALID_PARSER_CONFIG("Parser configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
