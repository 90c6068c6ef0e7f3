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

package com.google.acptraces.proxy;

import com.google.acptraces.proxy.config.CommandLine;
import com.google.acptraces.proxy.config.ProxyConfig;
import com.google.acptraces.proxy.config.ProxyConfigLoader;
import com.google.acptraces.proxy.config.Settings;
import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.time.Duration;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: {@code acp-traces [options] <agent-command> [agent-args...]}.
 *
 * <p>stdout carries protocol bytes only; every diagnostic goes to stderr.
 */
public final class AcpTracesMain {

  static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(15);

  private AcpTracesMain() {}

  public static void main(String[] args) {
    CommandLine commandLine;
    try {
      commandLine = CommandLine.parse(Arrays.asList(args));
    } catch (IllegalArgumentException e) {
      System.err.println("acp-traces: " + e.getMessage());
      System.err.println(CommandLine.USAGE);
      System.exit(EXIT_USAGE);
      return;
    }
    if (commandLine.helpRequested()) {
      System.err.println(CommandLine.USAGE);
      System.exit(0);
      return;
    }

    // The logging backend reads its level once, when the first logger is created.
    if (System.getProperty(LOG_LEVEL_PROPERTY) == null) {
      System.setProperty(LOG_LEVEL_PROPERTY, commandLine.logLevel(Settings::get));
    }
    Logger logger = LoggerFactory.getLogger(AcpTracesMain.class);

    ProxyConfig config;
    try {
      config = ProxyConfigLoader.load(commandLine);
    } catch (IllegalArgumentException e) {
      System.err.println("acp-traces: " + e.getMessage());
      System.err.println(CommandLine.USAGE);
      System.exit(EXIT_USAGE);
      return;
    }

    int exitCode;
    try (OtlpTelemetrySink sink = OtlpTelemetrySink.create(config)) {
      AcpProxy proxy = new AcpProxy(config, sink);
      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    logger.info("Shutdown signal received, stopping proxy...");
                    proxy.stop(SHUTDOWN_TIMEOUT);
                    sink.close();
                  },
                  "acp-traces-shutdown"));
      exitCode =
          proxy.run(
              new FileInputStream(FileDescriptor.in), new FileOutputStream(FileDescriptor.out));
    } catch (AcpProxyException e) {
      logger.error("Fatal error: {}", e.getMessage(), e);
      exitCode = EXIT_FAILURE;
    }

    System.exit(exitCode);
  }
}
