package com.badu.ai.constraint.vocabulary;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable bidirectional map between model token ids and the byte pieces they decode to.
 *
 * <p>Token ids form the dense range {@code [0, size())}. Text pieces are unique. Special
 * tokens (e.g. {@code </s>}, {@code <pad>}) carry a display name but no bytes: the grammar
 * walk never admits them. At most one special token is the end-of-sequence token.
 *
 * <p>Usage example:
 * <pre>{@code
 * VocabularyIndex vocabulary = VocabularyIndex.builder()
 *     .add("bpm")
 *     .add(":")
 *     .add(" ")
 *     .addEos("</s>")
 *     .build();
 * int id = vocabulary.tokenId("bpm");    // 0
 * String piece = vocabulary.pieceText(1); // ":"
 * }</pre>
 *
 * <p>This class is immutable and thread-safe; one instance is normally shared process-wide.
 */
public final class VocabularyIndex {

  /** Returned by lookups when no token matches. */
  public static final int NOT_FOUND = -1;

  private static final byte[] NO_BYTES = new byte[0];

  private final byte[][] pieces;
  private final String[] specialNames;
  private final BitSet special;
  private final Map<String, Integer> reverse;
  private final int eosTokenId;

  private VocabularyIndex(Builder builder) {
    int size = builder.pieces.size();
    this.pieces = builder.pieces.toArray(new byte[size][]);
    this.specialNames = builder.specialNames.toArray(new String[size]);
    this.special = (BitSet) builder.special.clone();
    this.reverse = Collections.unmodifiableMap(new HashMap<>(builder.reverse));
    this.eosTokenId = builder.eosTokenId;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a vocabulary of plain text pieces, ids assigned in argument order.
   */
  public static VocabularyIndex of(String... pieces) {
    Builder builder = builder();
    for (String piece : pieces) {
      builder.add(piece);
    }
    return builder.build();
  }

  /** Vocabulary size V. */
  public int size() {
    return pieces.length;
  }

  /**
   * Returns a copy of the token's bytes (empty for special tokens).
   */
  public byte[] piece(int tokenId) {
    checkId(tokenId);
    return pieces[tokenId].clone();
  }

  /** Number of bytes in the token's piece. */
  public int pieceLength(int tokenId) {
    return pieces[tokenId].length;
  }

  /** Byte {@code index} of the token's piece. */
  public byte byteAt(int tokenId, int index) {
    return pieces[tokenId][index];
  }

  /**
   * Returns the piece as UTF-8 text, or the special token name.
   */
  public String pieceText(int tokenId) {
    checkId(tokenId);
    if (special.get(tokenId)) {
      return specialNames[tokenId];
    }
    return new String(pieces[tokenId], StandardCharsets.UTF_8);
  }

  /**
   * Looks up a text token by its bytes.
   *
   * @return token id or {@link #NOT_FOUND}
   */
  public int tokenId(byte[] piece) {
    Integer id = reverse.get(key(piece));
    return id == null ? NOT_FOUND : id;
  }

  /**
   * Looks up a text token by its UTF-8 text.
   *
   * @return token id or {@link #NOT_FOUND}
   */
  public int tokenId(String piece) {
    return tokenId(piece.getBytes(StandardCharsets.UTF_8));
  }

  public boolean isSpecial(int tokenId) {
    return special.get(tokenId);
  }

  public boolean hasEos() {
    return eosTokenId != NOT_FOUND;
  }

  /**
   * Returns the end-of-sequence token id, or {@link #NOT_FOUND}.
   */
  public int eosTokenId() {
    return eosTokenId;
  }

  /**
   * Concatenates the pieces of a token sequence (special tokens contribute nothing).
   */
  public byte[] concat(List<Integer> tokenIds) {
    int length = 0;
    for (int id : tokenIds) {
      length += pieces[id].length;
    }
    byte[] out = new byte[length];
    int offset = 0;
    for (int id : tokenIds) {
      System.arraycopy(pieces[id], 0, out, offset, pieces[id].length);
      offset += pieces[id].length;
    }
    return out;
  }

  @Override
  public String toString() {
    return "VocabularyIndex{size=" + size() + ", special=" + special.cardinality()
        + ", eos=" + eosTokenId + "}";
  }

  private void checkId(int tokenId) {
    if (tokenId < 0 || tokenId >= pieces.length) {
      throw new IndexOutOfBoundsException(
          "Token id " + tokenId + " out of range [0, " + pieces.length + ")");
    }
  }

  // ISO-8859-1 maps every byte to one char, so the key is lossless
  private static String key(byte[] piece) {
    return new String(piece, StandardCharsets.ISO_8859_1);
  }

  /**
   * Builder assigning consecutive ids.
   */
  public static final class Builder {
    private final List<byte[]> pieces = new ArrayList<>();
    private final List<String> specialNames = new ArrayList<>();
    private final BitSet special = new BitSet();
    private final Map<String, Integer> reverse = new HashMap<>();
    private int eosTokenId = NOT_FOUND;

    private Builder() {
    }

    /** Adds a UTF-8 text piece. */
    public Builder add(String piece) {
      return addBytes(piece.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Adds a raw byte piece.
     *
     * @throws IllegalArgumentException if the piece is empty or already present
     */
    public Builder addBytes(byte[] piece) {
      if (piece == null || piece.length == 0) {
        throw new IllegalArgumentException("Text pieces must be non-empty (use addSpecial)");
      }
      String key = key(piece);
      if (reverse.containsKey(key)) {
        throw new IllegalArgumentException("Duplicate piece '" + new String(piece, StandardCharsets.UTF_8)
            + "' (ids " + reverse.get(key) + " and " + pieces.size() + ")");
      }
      reverse.put(key, pieces.size());
      pieces.add(piece.clone());
      specialNames.add(null);
      return this;
    }

    /** Adds a special (byte-less) token. */
    public Builder addSpecial(String name) {
      special.set(pieces.size());
      pieces.add(NO_BYTES);
      specialNames.add(name);
      return this;
    }

    /** Adds a special token and marks it as end-of-sequence. */
    public Builder addEos(String name) {
      if (eosTokenId != NOT_FOUND) {
        throw new IllegalArgumentException("EOS token already defined: " + eosTokenId);
      }
      eosTokenId = pieces.size();
      return addSpecial(name);
    }

    /** Returns true when a text piece with these bytes was already added. */
    public boolean contains(byte[] piece) {
      return reverse.containsKey(key(piece));
    }

    /** Number of tokens added so far (the next id). */
    public int size() {
      return pieces.size();
    }

    public VocabularyIndex build() {
      if (pieces.isEmpty()) {
        throw new IllegalStateException("Vocabulary cannot be empty");
      }
      return new VocabularyIndex(this);
    }
  }
}
