package io.draftops.draftline.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Raw CLI arguments split into flags ({@code --json}) and positional or {@code key=value} tokens.
 * <p>{@code --help}, {@code -h} and {@code help} normalise to {@code --help}; {@code -v}, {@code --verbose} and
 * {@code --debug} normalise to {@code --verbose}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> arguments;
  private final Set<String> flags;

  private CliInput(List<String> arguments, Set<String> flags) {
    this.arguments = List.copyOf(arguments);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> arguments = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          arguments.add(arg);
        }
      }
    }
    return new CliInput(arguments, flags);
  }

  /**
   * @return non-flag arguments as an array for {@link CliArgsParser}
   */
  public String[] arguments() {
    return arguments.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * @param flag flag such as {@code --json} (case-insensitive)
   * @return {@code true} when supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
