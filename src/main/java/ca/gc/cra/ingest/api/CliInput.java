package ca.gc.cra.ingest.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into {@code key=value} pairs and normalized flags.
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Partitions raw arguments. Tokens starting with {@code -} and carrying no {@code =} are flags; help and verbose
   * aliases collapse to {@code --help} and {@code --verbose}.
   *
   * @param args raw arguments; {@code null} is treated as empty
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns a copy of the non-flag arguments in order.
   *
   * @return key/value (or positional) arguments
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /**
   * Indicates whether help was requested.
   *
   * @return {@code true} for {@code --help}, {@code -h}, or {@code help}
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Indicates whether DEBUG logging was requested.
   *
   * @return {@code true} for {@code --verbose}, {@code -v}, or {@code --debug}
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a flag such as {@code --dry-run}, case-insensitively.
   *
   * @param flag flag to look up
   * @return {@code true} when supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && !flag.isBlank() && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns every normalized flag.
   *
   * @return lower-case flags
   */
  public Set<String> flags() {
    return flags;
  }
}
