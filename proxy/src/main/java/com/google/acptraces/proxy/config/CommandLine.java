/*
 * Copyright 2026 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.acptraces.proxy.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * Parsed command line: proxy options first, then the agent command and its own arguments.
 *
 * <p>Parsing stops at {@code --} or at the first argument that is not a proxy option, so the
 * agent's flags are passed through untouched. This class does no logging; it runs before the
 * logging backend is configured.
 */
public final class CommandLine {

  public static final String USAGE =
      String.join(
          System.lineSeparator(),
          "Usage: acp-traces [options] [--] <agent-command> [agent-args...]",
          "",
          "Options:",
          "  --otlp-endpoint <url>     OTLP collector endpoint"
              + " (default http://localhost:4317, or :4318 for http)",
          "  --otlp-protocol <proto>   grpc | http | http/protobuf (default grpc)",
          "  --service-name <name>     service.name resource attribute (default acp-agent)",
          "  --record-content          record prompts, agent output and tool payloads",
          "  -v, -vv, -vvv, --verbose  log at info, debug or trace to stderr",
          "  -h, --help                print this help");

  static final String OTLP_ENDPOINT = "--otlp-endpoint";
  static final String OTLP_PROTOCOL = "--otlp-protocol";
  static final String SERVICE_NAME = "--service-name";
  static final String RECORD_CONTENT = "--record-content";
  static final String VERBOSE = "--verbose";

  static final String LOG_ENV = "ACP_TRACES_LOG";

  private static final ImmutableList<String> LOG_LEVELS =
      ImmutableList.of("trace", "debug", "info", "warn", "error", "off");

  @Nullable private final String otlpEndpoint;
  @Nullable private final String otlpProtocol;
  @Nullable private final String serviceName;
  private final boolean recordContent;
  private final int verbosity;
  private final boolean helpRequested;
  private final ImmutableList<String> command;

  private CommandLine(
      @Nullable String otlpEndpoint,
      @Nullable String otlpProtocol,
      @Nullable String serviceName,
      boolean recordContent,
      int verbosity,
      boolean helpRequested,
      ImmutableList<String> command) {
    this.otlpEndpoint = otlpEndpoint;
    this.otlpProtocol = otlpProtocol;
    this.serviceName = serviceName;
    this.recordContent = recordContent;
    this.verbosity = verbosity;
    this.helpRequested = helpRequested;
    this.command = command;
  }

  /**
   * Parses the proxy's arguments.
   *
   * @throws IllegalArgumentException on an unknown option, an option missing its value, or a
   *     missing agent command
   */
  public static CommandLine parse(List<String> args) {
    String otlpEndpoint = null;
    String otlpProtocol = null;
    String serviceName = null;
    boolean recordContent = false;
    int verbosity = 0;
    boolean help = false;

    int i = 0;
    while (i < args.size()) {
      String arg = args.get(i);
      if (arg.equals("--")) {
        i++;
        break;
      }
      if (!arg.startsWith("-") || arg.equals("-")) {
        break;
      }
      String name = arg;
      String inlineValue = null;
      int eq = arg.indexOf('=');
      if (arg.startsWith("--") && eq > 0) {
        name = arg.substring(0, eq);
        inlineValue = arg.substring(eq + 1);
      }
      switch (name) {
        case OTLP_ENDPOINT:
        case OTLP_PROTOCOL:
        case SERVICE_NAME:
          String value = inlineValue;
          if (value == null) {
            if (i + 1 >= args.size()) {
              throw new IllegalArgumentException("Missing value for " + name);
            }
            value = args.get(++i);
          }
          if (name.equals(OTLP_ENDPOINT)) {
            otlpEndpoint = value;
          } else if (name.equals(OTLP_PROTOCOL)) {
            otlpProtocol = value;
          } else {
            serviceName = value;
          }
          break;
        case RECORD_CONTENT:
          recordContent = true;
          break;
        case VERBOSE:
          verbosity++;
          break;
        case "-h":
        case "--help":
          help = true;
          break;
        default:
          if (arg.matches("-v+")) {
            verbosity += arg.length() - 1;
            break;
          }
          throw new IllegalArgumentException("Unknown option: " + arg);
      }
      i++;
    }

    ImmutableList<String> command = ImmutableList.copyOf(args.subList(i, args.size()));
    if (command.isEmpty() && !help) {
      throw new IllegalArgumentException("Missing agent command");
    }
    return new CommandLine(
        otlpEndpoint, otlpProtocol, serviceName, recordContent, verbosity, help, command);
  }

  public Optional<String> otlpEndpoint() {
    return Optional.ofNullable(otlpEndpoint);
  }

  public Optional<String> otlpProtocol() {
    return Optional.ofNullable(otlpProtocol);
  }

  public Optional<String> serviceName() {
    return Optional.ofNullable(serviceName);
  }

  public boolean recordContent() {
    return recordContent;
  }

  public int verbosity() {
    return verbosity;
  }

  public boolean helpRequested() {
    return helpRequested;
  }

  public ImmutableList<String> command() {
    return command;
  }

  /**
   * Log level for the proxy's own diagnostics: {@code ACP_TRACES_LOG} when it names a level,
   * otherwise derived from the number of {@code -v} flags.
   */
  public String logLevel(Function<String, String> lookup) {
    String override = lookup.apply(LOG_ENV);
    if (override != null) {
      String normalized = override.trim().toLowerCase(Locale.ROOT);
      if (LOG_LEVELS.contains(normalized)) {
        return normalized;
      }
    }
    switch (verbosity) {
      case 0:
        return "warn";
      case 1:
        return "info";
      case 2:
        return "debug";
      default:
        return "trace";
    }
  }
}
