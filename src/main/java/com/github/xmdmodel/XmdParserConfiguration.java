package com.github.xmdmodel;

/**
 * This class encapsulates all the configuration parameters for the XmdParser. Use the
 * {@code XmdParserConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. {@link #defaults()} fails on malformed identifiers and checks integrity strictly.<br>
 * 2. {@link IntegrityMode#PERMISSIVE} accepts duplicate ids and dangling references, which is
 * what older XMD tooling did; use it for compatibility testing against legacy documents.<br>
 */
public final class XmdParserConfiguration {
  private final MalformedIdentifierPolicy malformedIdentifierPolicy;
  private final IntegrityMode integrityMode;

  public MalformedIdentifierPolicy getMalformedIdentifierPolicy() {
    return malformedIdentifierPolicy;
  }

  public IntegrityMode getIntegrityMode() {
    return integrityMode;
  }

  public static XmdParserConfiguration defaults() {
    return new XmdParserConfiguration(MalformedIdentifierPolicy.FAIL, IntegrityMode.STRICT);
  }

  public final static class XmdParserConfigurationBuilder {
    private MalformedIdentifierPolicy malformedIdentifierPolicy;
    private IntegrityMode integrityMode;

    public static XmdParserConfigurationBuilder newBuilder() {
      return new XmdParserConfigurationBuilder();
    }

    public XmdParserConfigurationBuilder malformedIdentifierPolicy(
        final MalformedIdentifierPolicy malformedIdentifierPolicy) {
      this.malformedIdentifierPolicy = malformedIdentifierPolicy;
      return this;
    }

    public XmdParserConfigurationBuilder integrityMode(final IntegrityMode integrityMode) {
      this.integrityMode = integrityMode;
      return this;
    }

    public XmdParserConfiguration build() throws XmdParseException {
      final XmdParserConfiguration config =
          new XmdParserConfiguration(malformedIdentifierPolicy, integrityMode);
      config.validate();
      return config;
    }

    private XmdParserConfigurationBuilder() {}
  }

  private void validate() throws XmdParseException {
    StringBuilder messages = new StringBuilder();
    if (malformedIdentifierPolicy == null) {
      messages.append("MalformedIdentifierPolicy cannot be null. ");
    }
    if (integrityMode == null) {
      messages.append("IntegrityMode cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new XmdParseException(XmdParseException.Code.INVALID_PARSER_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "XmdParserConfiguration [malformedIdentifierPolicy=" + malformedIdentifierPolicy
        + ", integrityMode=" + integrityMode + "]";
  }

  private XmdParserConfiguration(final MalformedIdentifierPolicy malformedIdentifierPolicy,
      final IntegrityMode integrityMode) {
    this.malformedIdentifierPolicy = malformedIdentifierPolicy;
    this.integrityMode = integrityMode;
  }

}
