package com.github.xmdmodel;

/**
 * A parsed XMD file: the tree root handed to the parser plus where it was read from.
 */
public final class XmdDocument {
  private final SourceFile sourceFile;
  private final XmdNode root;

  XmdDocument(final SourceFile sourceFile, final XmdNode root) {
    this.sourceFile = sourceFile;
    this.root = root;
  }

  public SourceFile getSourceFile() {
    return sourceFile;
  }

  /**
   * The document node, whose only element child is expected to be {@code <model>}.
   */
  public XmdNode getRoot() {
    return root;
  }

  @Override
  public String toString() {
    return "XmdDocument [sourceFile=" + sourceFile + "]";
  }
}
