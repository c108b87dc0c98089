package com.badu.ai.constraint.validation;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates music metadata blocks of {@code key: value} lines.
 *
 * <p>Checks:
 * <ul>
 *   <li>{@code bpm}: integer in [30, 300]</li>
 *   <li>{@code keyscale}: note A-G, optional {@code #} or {@code b}, then {@code major} or {@code minor}</li>
 *   <li>{@code timesignature}: 2, 3, 4 or 6, optionally written as {@code N/4}</li>
 *   <li>{@code duration}: seconds in [10, 600]</li>
 *   <li>required keys are present, keys appear once</li>
 * </ul>
 * Unknown keys are warnings. A trailing terminator marker (default {@code </think>}) is ignored.
 */
public class MetadataValidator implements SemanticValidator {

  public static final String DEFAULT_TERMINATOR = "</think>";

  private static final int MIN_BPM = 30;
  private static final int MAX_BPM = 300;
  private static final double MIN_DURATION = 10.0;
  private static final double MAX_DURATION = 600.0;
  private static final Set<Integer> TIME_SIGNATURES = Set.of(2, 3, 4, 6);

  private static final Pattern KEYSCALE = Pattern.compile("[A-G][#b]? (major|minor)");
  private static final Pattern TIME_SIGNATURE = Pattern.compile("(\\d+)(/4)?");

  private static final Set<String> KNOWN_KEYS =
      Set.of("bpm", "keyscale", "timesignature", "duration", "caption", "language", "genres");

  private final Set<String> requiredKeys;
  private final String terminator;

  /**
   * Creates a validator with no required keys and the default terminator.
   */
  public MetadataValidator() {
    this(Set.of(), DEFAULT_TERMINATOR);
  }

  /**
   * @param requiredKeys keys that must be present
   * @param terminator marker ending the block (stripped before parsing), or null
   */
  public MetadataValidator(Set<String> requiredKeys, String terminator) {
    this.requiredKeys = Set.copyOf(requiredKeys);
    this.terminator = terminator;
  }

  @Override
  public ValidationResult validate(byte[] emitted) {
    if (emitted == null) {
      return ValidationResult.invalid(List.of("Output is null"));
    }

    String text;
    try {
      text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(emitted))
          .toString();
    } catch (CharacterCodingException e) {
      return ValidationResult.invalid(List.of("Output contains invalid UTF-8 sequences"));
    }

    if (terminator != null && text.endsWith(terminator)) {
      text = text.substring(0, text.length() - terminator.length());
    }

    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    Map<String, String> values = new LinkedHashMap<>();

    for (String line : text.split("\n")) {
      if (line.isBlank()) {
        continue;
      }
      int colon = line.indexOf(':');
      if (colon <= 0) {
        errors.add(String.format("Line is not a key: value pair: '%s'", line));
        continue;
      }
      String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colon + 1).trim();
      if (values.putIfAbsent(key, value) != null) {
        errors.add(String.format("Key '%s' appears more than once", key));
      }
    }

    for (String required : requiredKeys) {
      if (!values.containsKey(required)) {
        errors.add(String.format("Required key '%s' is missing", required));
      }
    }

    values.forEach((key, value) -> {
      switch (key) {
        case "bpm" -> checkBpm(value, errors);
        case "keyscale" -> checkKeyscale(value, errors);
        case "timesignature" -> checkTimeSignature(value, errors);
        case "duration" -> checkDuration(value, errors);
        default -> {
          if (!KNOWN_KEYS.contains(key)) {
            warnings.add(String.format("Unknown key '%s'", key));
          }
        }
      }
    });

    return ValidationResult.of(errors, warnings);
  }

  private void checkBpm(String value, List<String> errors) {
    try {
      int bpm = Integer.parseInt(value);
      if (bpm < MIN_BPM || bpm > MAX_BPM) {
        errors.add(String.format("bpm %d is outside [%d, %d]", bpm, MIN_BPM, MAX_BPM));
      }
    } catch (NumberFormatException e) {
      errors.add(String.format("bpm '%s' is not an integer", value));
    }
  }

  private void checkKeyscale(String value, List<String> errors) {
    if (!KEYSCALE.matcher(value).matches()) {
      errors.add(String.format("keyscale '%s' is not a note followed by major or minor", value));
    }
  }

  private void checkTimeSignature(String value, List<String> errors) {
    var matcher = TIME_SIGNATURE.matcher(value);
    if (!matcher.matches()) {
      errors.add(String.format("timesignature '%s' is not a number or N/4", value));
      return;
    }
    try {
      int beats = Integer.parseInt(matcher.group(1));
      if (!TIME_SIGNATURES.contains(beats)) {
        errors.add(String.format("timesignature %d is not one of 2, 3, 4, 6", beats));
      }
    } catch (NumberFormatException e) {
      errors.add(String.format("timesignature '%s' is too large", value));
    }
  }

  private void checkDuration(String value, List<String> errors) {
    try {
      double seconds = Double.parseDouble(value);
      if (seconds < MIN_DURATION || seconds > MAX_DURATION) {
        errors.add(String.format("duration %s is outside [%.0f, %.0f] seconds", value, MIN_DURATION, MAX_DURATION));
      }
    } catch (NumberFormatException e) {
      errors.add(String.format("duration '%s' is not a number", value));
    }
  }
}
