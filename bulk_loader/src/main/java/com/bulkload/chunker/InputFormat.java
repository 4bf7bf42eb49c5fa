package com.bulkload.chunker;

/** The two supported input formats and their chunkers. */
public enum InputFormat {
  RDF(".rdf") {
    @Override
    public Chunker newChunker() {
      return new RdfChunker();
    }
  },
  JSON(".json") {
    @Override
    public Chunker newChunker() {
      return new JsonChunker();
    }
  };

  private final String extension;

  InputFormat(String extension) {
    this.extension = extension;
  }

  /** File suffix of uncompressed inputs, e.g. {@code .rdf}. */
  public String extension() {
    return extension;
  }

  /** Fresh chunker for one file. */
  public abstract Chunker newChunker();
}
