package com.github.xmdmodel;

import java.nio.file.Path;

/**
 * Where a model was read from and when. Load and modification times are epoch millis.
 */
public final class SourceFile {
  private final String fileName;
  private final String extension;
  private final Path directory;
  private final Path fullPath;
  private final long loadTimeMillis;
  private final long modifiedTimeMillis;

  SourceFile(final String fileName, final String extension, final Path directory,
      final Path fullPath, final long loadTimeMillis, final long modifiedTimeMillis) {
    this.fileName = fileName;
    this.extension = extension;
    this.directory = directory;
    this.fullPath = fullPath;
    this.loadTimeMillis = loadTimeMillis;
    this.modifiedTimeMillis = modifiedTimeMillis;
  }

  /**
   * File name without its extension.
   */
  public String getFileName() {
    return fileName;
  }

  public String getExtension() {
    return extension;
  }

  public Path getDirectory() {
    return directory;
  }

  public Path getFullPath() {
    return fullPath;
  }

  public long getLoadTimeMillis() {
    return loadTimeMillis;
  }

  public long getModifiedTimeMillis() {
    return modifiedTimeMillis;
  }

  @Override
  public String toString() {
    return "SourceFile [fullPath=" + fullPath + ", loadTimeMillis=" + loadTimeMillis
        + ", modifiedTimeMillis=" + modifiedTimeMillis + "]";
  }
}
