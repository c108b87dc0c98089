package com.badu.ai.constraint.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of resolved feature switches.
 *
 * <p>Resolution order, highest first:
 * <ol>
 *   <li>explicit override via {@link #with(Feature, boolean)}</li>
 *   <li>environment variable {@code CONSTRAINT_FEATURE_<NAME>} ({@code true}, {@code 1},
 *       {@code yes} or {@code on} enable, anything else disables)</li>
 *   <li>the feature's default</li>
 * </ol>
 * The environment is read once, when the flags are created.
 *
 * <pre>{@code
 * FeatureFlags flags = FeatureFlags.fromEnvironment(System.getenv())
 *     .with(Feature.FORCED_COMPLETION, false);
 * if (flags.isEnabled(Feature.SEMANTIC_VALIDATION)) { ... }
 * }</pre>
 */
public final class FeatureFlags {

  private static final Logger logger = LoggerFactory.getLogger(FeatureFlags.class);

  /** Prefix of the environment variables read by {@link #fromEnvironment(Map)}. */
  public static final String ENV_PREFIX = "CONSTRAINT_FEATURE_";

  private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");

  private final Map<Feature, Boolean> flags;

  private FeatureFlags(Map<Feature, Boolean> flags) {
    this.flags = Collections.unmodifiableMap(new EnumMap<>(flags));
  }

  /**
   * Flags with every feature at its default.
   */
  public static FeatureFlags defaults() {
    Map<Feature, Boolean> flags = new EnumMap<>(Feature.class);
    for (Feature feature : Feature.values()) {
      flags.put(feature, feature.isEnabledByDefault());
    }
    return new FeatureFlags(flags);
  }

  /**
   * Flags resolved from environment variables, falling back to defaults.
   *
   * @param environment variables, typically {@code System.getenv()}
   */
  public static FeatureFlags fromEnvironment(Map<String, String> environment) {
    Map<Feature, Boolean> flags = new EnumMap<>(Feature.class);
    for (Feature feature : Feature.values()) {
      String value = environment.get(feature.environmentVariable());
      if (value != null) {
        boolean enabled = TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
        logger.debug("Feature {} resolved from environment: {}", feature, enabled);
        flags.put(feature, enabled);
      } else {
        flags.put(feature, feature.isEnabledByDefault());
      }
    }
    return new FeatureFlags(flags);
  }

  /**
   * Returns a copy with one feature overridden.
   */
  public FeatureFlags with(Feature feature, boolean enabled) {
    Map<Feature, Boolean> copy = new EnumMap<>(flags);
    copy.put(feature, enabled);
    return new FeatureFlags(copy);
  }

  public boolean isEnabled(Feature feature) {
    return flags.get(feature);
  }

  /**
   * Returns every feature's state keyed by lower-case name, in declaration order.
   */
  public Map<String, Boolean> asMap() {
    Map<String, Boolean> result = new LinkedHashMap<>();
    flags.forEach((feature, enabled) -> result.put(feature.name().toLowerCase(Locale.ROOT), enabled));
    return result;
  }

  /**
   * Returns a user-facing message describing the disabled features, or null when all are on.
   */
  public String disabledFeaturesMessage() {
    List<String> messages = flags.entrySet().stream()
        .filter(entry -> !entry.getValue())
        .map(entry -> entry.getKey().getDisabledMessage() + " Enable with "
            + entry.getKey().environmentVariable() + "=true.")
        .collect(Collectors.toList());
    return messages.isEmpty() ? null : String.join("\n", messages);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof FeatureFlags && flags.equals(((FeatureFlags) o).flags);
  }

  @Override
  public int hashCode() {
    return flags.hashCode();
  }

  @Override
  public String toString() {
    return "FeatureFlags" + asMap();
  }
}
