package ca.gc.cra.reach.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed command line: optional command word, {@code key=value} arguments, and {@code --flags}.
 *
 * <p>Switch flags with a configuration counterpart ({@code --ping-first}, {@code --no-print}, {@code --dry-run})
 * are exposed through {@link #flagOptions()} as {@code key=true} so they merge like any other option.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Map<String, String> FLAG_OPTIONS = Map.of(
      "--ping-first", "pingFirst",
      "--no-print", "noPrint",
      "--dry-run", "dryRun");

  private final String command;
  private final String[] keyValueArgs;
  private final List<String> positionals;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(
      String command,
      String[] keyValueArgs,
      List<String> positionals,
      Set<String> flags,
      boolean help,
      boolean verbose) {
    this.command = command;
    this.keyValueArgs = keyValueArgs;
    this.positionals = positionals;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments. The first bare word (no {@code =}, no leading dash) becomes the command; later bare
   * words are kept as unexpected positionals.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(null, new String[0], List.of(), Set.of(), false, false);
    }

    String command = null;
    List<String> kv = new ArrayList<>();
    List<String> positionals = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
      } else if (arg.contains("=")) {
        kv.add(arg);
      } else if (arg.startsWith("-")) {
        flags.add(lower);
      } else if (command == null) {
        command = lower;
      } else {
        positionals.add(arg);
      }
    }
    return new CliInput(
        command,
        kv.toArray(String[]::new),
        List.copyOf(positionals),
        Collections.unmodifiableSet(flags),
        help,
        verbose);
  }

  /**
   * Returns the command word, e.g. {@code scan}.
   *
   * @return lower-case command, if any
   */
  public Optional<String> command() {
    return Optional.ofNullable(command);
  }

  /**
   * Returns a copy of the {@code key=value} arguments.
   *
   * @return copy of arguments intended for {@link CliArgsParser}
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /**
   * Returns bare words after the command; REACH commands accept none.
   *
   * @return unexpected positional arguments
   */
  public List<String> positionals() {
    return positionals;
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Translates recognized switch flags to configuration options.
   *
   * @return map such as {@code {pingFirst=true}}
   */
  public Map<String, String> flagOptions() {
    Map<String, String> options = new LinkedHashMap<>();
    for (String flag : flags) {
      String key = FLAG_OPTIONS.get(flag);
      if (key != null) {
        options.put(key, "true");
      }
    }
    return options;
  }

  /**
   * Returns flags that are neither global nor a known switch.
   *
   * @return unrecognized flags in command-line order
   */
  public List<String> unknownFlags() {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!flag.equals("--help") && !flag.equals("--verbose") && !FLAG_OPTIONS.containsKey(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }
}
