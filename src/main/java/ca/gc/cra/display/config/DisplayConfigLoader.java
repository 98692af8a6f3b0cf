package ca.gc.cra.display.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Loads display settings from a YAML document.
 * <p><strong>Format:</strong></p>
 * <pre>
 * display:
 *   verbosity: enable
 *   colorfulness: disable
 *   autoNewline: true
 *   showTrace: on
 *   filename: worker
 * </pre>
 * <p>Only the {@code display} section is read; other top-level sections are left for the host application.
 * Values are handed to a settings sink, normally {@code Display::applySetting}, so a bad value raises
 * {@link ca.gc.cra.display.domain.InvalidConfigValueException} just as a programmatic call would.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DisplayConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(DisplayConfigLoader.class);
  static final String SECTION = "display";

  private DisplayConfigLoader() {}

  /**
   * Reads the {@code display} section of a YAML file.
   *
   * @param path location of the YAML document
   * @return settings keyed by name, empty map when the section is absent, or empty optional when the file is
   *     missing
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or the section is not a flat mapping
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      log.debug("Display config {} not found; keeping current settings", path);
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      if (!(document instanceof Map<?, ?> root)) {
        throw new IllegalArgumentException("root of " + path + " must be a mapping");
      }
      Object section = findSection(root);
      if (section == null) {
        return Optional.of(Map.of());
      }
      if (!(section instanceof Map<?, ?> entries)) {
        throw new IllegalArgumentException(SECTION + " section must be a mapping");
      }
      return Optional.of(flatten(entries));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  /**
   * Loads {@code path} and passes every setting to {@code sink}, in document order.
   *
   * @param path location of the YAML document
   * @param sink receives each {@code (key, value)} pair
   * @return {@code true} if a file was found and applied
   * @throws IOException when the file cannot be read
   * @throws ca.gc.cra.display.domain.InvalidConfigValueException on an unknown key or out-of-domain value;
   *     settings applied before the failing key stay applied
   */
  public static boolean apply(Path path, BiConsumer<String, String> sink) throws IOException {
    Objects.requireNonNull(sink, "sink");
    Optional<Map<String, String>> settings = load(path);
    if (settings.isEmpty()) {
      return false;
    }
    for (Map.Entry<String, String> entry : settings.get().entrySet()) {
      sink.accept(entry.getKey(), entry.getValue());
    }
    log.debug("Applied {} display settings from {}", settings.get().size(), path);
    return true;
  }

  private static Object findSection(Map<?, ?> root) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (entry.getKey() instanceof String key && key.trim().toLowerCase(Locale.ROOT).equals(SECTION)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static Map<String, String> flatten(Map<?, ?> entries) {
    Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(SECTION + " section contains a blank or non-string key");
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Nested values are not supported for key " + SECTION + "." + key);
      }
      result.put(key.trim(), value == null ? "" : value.toString());
    }
    return result;
  }
}
