package ca.gc.cra.display.api;

import ca.gc.cra.display.validation.Strings;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Process arguments relevant to a display, split into recognized flags and {@code key=value} options.
 *
 * <p>Recognized flags: {@code --silent}/{@code -s} (disable verbosity), {@code --no-color}/{@code -n}
 * (disable colorfulness), {@code --verbose}/{@code -v} (DEBUG diagnostics) and {@code --help}/{@code -h}.
 * Short flags may be bundled, as in {@code -sn}.
 * Unknown flags and positional arguments are kept but never rejected, so a host application can share its
 * argument vector with the display.</p>
 */
public final class DisplayArgs {
  private static final Set<String> SILENT_FLAGS = Set.of("--silent", "-s");
  private static final Set<String> NO_COLOR_FLAGS = Set.of("--no-color", "-n");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h");
  private static final String SHORT_FLAGS = "snvh";

  private static final DisplayArgs EMPTY = new DisplayArgs(Set.of(), Map.of(), new String[0]);

  private final Set<String> flags;
  private final Map<String, String> options;
  private final String[] positional;

  private DisplayArgs(Set<String> flags, Map<String, String> options, String[] positional) {
    this.flags = flags;
    this.options = options;
    this.positional = positional;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw arguments (may be {@code null})
   * @return parsed representation
   */
  public static DisplayArgs parse(String[] args) {
    if (args == null || args.length == 0) {
      return EMPTY;
    }
    Set<String> flags = new LinkedHashSet<>();
    Map<String, String> options = new LinkedHashMap<>();
    List<String> positional = new ArrayList<>();
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int eq = arg.indexOf('=');
      if (arg.startsWith("-") && eq < 0) {
        addFlags(flags, normalize(arg));
      } else if (eq > 0 && !arg.startsWith("-") && eq < arg.length() - 1) {
        String key = arg.substring(0, eq).trim();
        String value = arg.substring(eq + 1).trim();
        if (!Strings.containsControl(key) && !Strings.containsControl(value)) {
          options.put(key, value);
        }
      } else {
        positional.add(arg);
      }
    }
    return new DisplayArgs(Set.copyOf(flags), Map.copyOf(options), positional.toArray(String[]::new));
  }

  public boolean silent() {
    return containsAny(SILENT_FLAGS);
  }

  public boolean noColor() {
    return containsAny(NO_COLOR_FLAGS);
  }

  public boolean verbose() {
    return containsAny(VERBOSE_FLAGS);
  }

  public boolean help() {
    return containsAny(HELP_FLAGS);
  }

  /**
   * @param key option name
   * @return value of {@code key=value}, or {@code null} if absent
   */
  public String option(String key) {
    return options.get(key);
  }

  /**
   * @return normalized (lower-case) flags
   */
  public Set<String> flags() {
    return flags;
  }

  /**
   * @return arguments that were neither flags nor options
   */
  public String[] positional() {
    return Arrays.copyOf(positional, positional.length);
  }

  private boolean containsAny(Set<String> candidates) {
    for (String candidate : candidates) {
      if (flags.contains(candidate)) {
        return true;
      }
    }
    return false;
  }

  // "-sn" is "-s -n" when every letter is a known short flag.
  private static void addFlags(Set<String> flags, String flag) {
    if (isShortBundle(flag)) {
      for (int i = 1; i < flag.length(); i++) {
        flags.add("-" + flag.charAt(i));
      }
      return;
    }
    flags.add(flag);
  }

  private static boolean isShortBundle(String flag) {
    if (flag.length() < 3 || flag.charAt(1) == '-') {
      return false;
    }
    for (int i = 1; i < flag.length(); i++) {
      if (SHORT_FLAGS.indexOf(flag.charAt(i)) < 0) {
        return false;
      }
    }
    return true;
  }

  private static String normalize(String flag) {
    return flag.toLowerCase(Locale.ROOT);
  }
}
