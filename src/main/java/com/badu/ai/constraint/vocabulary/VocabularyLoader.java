package com.badu.ai.constraint.vocabulary;

import com.badu.ai.constraint.ConstraintException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link VocabularyIndex} from a HuggingFace {@code tokenizer.json} file.
 *
 * <p>Reads:
 * <ul>
 *   <li>{@code model.vocab}: either an object {@code piece → id} (BPE, WordPiece) or an array of
 *       {@code [piece, score]} pairs whose index is the id (Unigram)</li>
 *   <li>{@code added_tokens}: entries with {@code id}, {@code content}, {@code special}</li>
 *   <li>{@code decoder}/{@code pre_tokenizer}: to pick the piece encoding</li>
 * </ul>
 *
 * <p><b>Piece encodings:</b>
 * <ul>
 *   <li>Byte-level (GPT-2 style): each char maps back to one byte, e.g. {@code Ġ → 0x20}</li>
 *   <li>Metaspace (SentencePiece style): {@code ▁} becomes a space, {@code <0x0A>} a raw byte</li>
 * </ul>
 *
 * <p>Ids missing from the file become special placeholder tokens so the id range stays dense.
 * Pieces that decode to bytes already taken by a lower id are kept as special tokens.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * VocabularyIndex vocabulary = new VocabularyLoader()
 *     .load(Paths.get("models/lm/tokenizer.json"));
 * }</pre>
 */
public class VocabularyLoader {

  private static final Logger logger = LoggerFactory.getLogger(VocabularyLoader.class);

  private static final List<String> DEFAULT_EOS_NAMES =
      List.of("</s>", "<|endoftext|>", "<|im_end|>", "<eos>", "<|eot_id|>");

  private static final Pattern BYTE_FALLBACK = Pattern.compile("<0x([0-9A-Fa-f]{2})>");

  private static final char METASPACE = '▁';

  /** How pieces in the file are spelled. */
  public enum PieceEncoding {
    BYTE_LEVEL,
    METASPACE,
    RAW
  }

  private final ObjectMapper mapper = new ObjectMapper();
  private final String eosName;

  /**
   * Creates a loader that picks the EOS token among common names
   * ({@code </s>}, {@code <|endoftext|>}, ...).
   */
  public VocabularyLoader() {
    this(null);
  }

  /**
   * Creates a loader with an explicit EOS token name.
   *
   * @param eosName content of the EOS added token, or null for auto-detection
   */
  public VocabularyLoader(String eosName) {
    this.eosName = eosName;
  }

  /**
   * Loads a vocabulary from a tokenizer.json file.
   *
   * @param tokenizerJson path to tokenizer.json
   * @return vocabulary index
   * @throws IOException if the file cannot be read or is not JSON
   */
  public VocabularyIndex load(Path tokenizerJson) throws IOException {
    if (!Files.exists(tokenizerJson)) {
      throw new IOException("Tokenizer file does not exist: " + tokenizerJson);
    }
    try (InputStream in = Files.newInputStream(tokenizerJson)) {
      VocabularyIndex vocabulary = load(in);
      logger.debug("Loaded vocabulary from {}: {}", tokenizerJson, vocabulary);
      return vocabulary;
    }
  }

  /**
   * Loads a vocabulary from tokenizer.json content.
   *
   * @param in JSON stream (not closed)
   * @return vocabulary index
   * @throws IOException if the content is not JSON
   */
  public VocabularyIndex load(InputStream in) throws IOException {
    JsonNode root = mapper.readTree(in);
    JsonNode vocab = root.path("model").path("vocab");
    if (vocab.isMissingNode() || vocab.isNull()) {
      throw new ConstraintException("tokenizer.json has no model.vocab section",
          ConstraintException.ErrorType.VOCABULARY);
    }

    Map<Integer, String> texts = new HashMap<>();
    Map<Integer, Boolean> specials = new HashMap<>();
    int maxId = -1;

    if (vocab.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = vocab.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> entry = fields.next();
        int id = entry.getValue().asInt(-1);
        if (id < 0) {
          throw new ConstraintException("Invalid id for piece '" + entry.getKey() + "'",
              ConstraintException.ErrorType.VOCABULARY);
        }
        texts.put(id, entry.getKey());
        maxId = Math.max(maxId, id);
      }
    } else if (vocab.isArray()) {
      for (int id = 0; id < vocab.size(); id++) {
        JsonNode pair = vocab.get(id);
        texts.put(id, pair.isArray() ? pair.get(0).asText() : pair.asText());
        maxId = Math.max(maxId, id);
      }
    } else {
      throw new ConstraintException("model.vocab must be an object or an array",
          ConstraintException.ErrorType.VOCABULARY);
    }

    for (JsonNode added : root.path("added_tokens")) {
      int id = added.path("id").asInt(-1);
      if (id < 0) {
        continue;
      }
      texts.put(id, added.path("content").asText());
      specials.put(id, added.path("special").asBoolean(false));
      maxId = Math.max(maxId, id);
    }

    PieceEncoding encoding = detectEncoding(root);
    String eos = eosName != null ? eosName : detectEosName(texts, specials);
    logger.debug("tokenizer.json: {} ids, encoding={}, eos={}", maxId + 1, encoding, eos);

    VocabularyIndex.Builder builder = VocabularyIndex.builder();
    int duplicates = 0;
    for (int id = 0; id <= maxId; id++) {
      String text = texts.get(id);
      if (text == null) {
        builder.addSpecial("<unused:" + id + ">");
        continue;
      }
      if (Boolean.TRUE.equals(specials.get(id))) {
        if (text.equals(eos)) {
          builder.addEos(text);
        } else {
          builder.addSpecial(text);
        }
        continue;
      }
      byte[] bytes = decodePiece(text, encoding);
      if (bytes.length == 0 || builder.contains(bytes)) {
        duplicates++;
        builder.addSpecial(text);
        continue;
      }
      builder.addBytes(bytes);
    }

    if (duplicates > 0) {
      logger.debug("{} pieces decoded to empty or duplicate bytes and were kept as special tokens",
          duplicates);
    }
    return builder.build();
  }

  /**
   * Decodes a piece as spelled in tokenizer.json into raw bytes.
   *
   * @param text piece text
   * @param encoding piece encoding
   * @return bytes
   */
  public static byte[] decodePiece(String text, PieceEncoding encoding) {
    switch (encoding) {
      case BYTE_LEVEL: {
        int[] decoder = ByteLevelAlphabet.DECODER;
        ByteArrayOutputStream out = new ByteArrayOutputStream(text.length());
        for (int i = 0; i < text.length(); i++) {
          char c = text.charAt(i);
          int b = c < decoder.length ? decoder[c] : -1;
          if (b < 0) {
            // not a byte-level char: keep its UTF-8 form
            byte[] raw = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
            out.write(raw, 0, raw.length);
          } else {
            out.write(b);
          }
        }
        return out.toByteArray();
      }
      case METASPACE: {
        Matcher matcher = BYTE_FALLBACK.matcher(text);
        if (matcher.matches()) {
          return new byte[] {(byte) Integer.parseInt(matcher.group(1), 16)};
        }
        return text.replace(METASPACE, ' ').getBytes(StandardCharsets.UTF_8);
      }
      default:
        return text.getBytes(StandardCharsets.UTF_8);
    }
  }

  private PieceEncoding detectEncoding(JsonNode root) {
    if (hasType(root.path("decoder"), "ByteLevel") || hasType(root.path("pre_tokenizer"), "ByteLevel")) {
      return PieceEncoding.BYTE_LEVEL;
    }
    if (hasType(root.path("decoder"), "Metaspace") || hasType(root.path("pre_tokenizer"), "Metaspace")
        || hasType(root.path("decoder"), "ByteFallback")
        || "Unigram".equals(root.path("model").path("type").asText())) {
      return PieceEncoding.METASPACE;
    }
    return PieceEncoding.RAW;
  }

  // Looks through nested "Sequence" decoders/pre-tokenizers as well
  private boolean hasType(JsonNode node, String type) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return false;
    }
    if (type.equals(node.path("type").asText())) {
      return true;
    }
    for (String child : List.of("decoders", "pretokenizers")) {
      for (JsonNode element : node.path(child)) {
        if (hasType(element, type)) {
          return true;
        }
      }
    }
    return false;
  }

  private String detectEosName(Map<Integer, String> texts, Map<Integer, Boolean> specials) {
    for (String candidate : DEFAULT_EOS_NAMES) {
      for (Map.Entry<Integer, String> entry : texts.entrySet()) {
        if (candidate.equals(entry.getValue()) && Boolean.TRUE.equals(specials.get(entry.getKey()))) {
          return candidate;
        }
      }
    }
    return null;
  }

  /**
   * GPT-2 byte-to-unicode table: printable bytes map to themselves, the rest to U+0100 onward.
   */
  static final class ByteLevelAlphabet {
    static final int[] DECODER = buildDecoder();

    private ByteLevelAlphabet() {
    }

    private static int[] buildDecoder() {
      int[] decoder = new int[512];
      Arrays.fill(decoder, -1);
      int next = 0;
      for (int b = 0; b < 256; b++) {
        boolean printable = (b >= '!' && b <= '~') || (b >= 0xA1 && b <= 0xAC) || (b >= 0xAE && b <= 0xFF);
        if (printable) {
          decoder[b] = b;
        } else {
          decoder[256 + next] = b;
          next++;
        }
      }
      return decoder;
    }
  }
}
