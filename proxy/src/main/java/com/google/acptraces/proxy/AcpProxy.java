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

import com.google.acptraces.protocol.Direction;
import com.google.acptraces.proxy.config.ProxyConfig;
import com.google.acptraces.telemetry.AcpTelemetry;
import com.google.acptraces.telemetry.SpanCorrelator;
import com.google.acptraces.telemetry.TelemetrySink;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sits between an editor and an ACP agent process, forwarding both directions byte for byte while
 * the tapped traffic is turned into telemetry.
 *
 * <p>The run ends when the agent exits, when the editor closes its side, or when either pipe fails.
 * After an exit the agent's remaining output is forwarded for up to the configured drain timeout;
 * otherwise the agent is killed. The agent closing its stdout alone does not end the run. Either way the tap channel is closed, the correlator force-closes whatever is
 * still open, and the sink is flushed before {@link #run} returns.
 */
public final class AcpProxy {
  private static final Logger logger = LoggerFactory.getLogger(AcpProxy.class);

  private static final Duration KILL_TIMEOUT = Duration.ofSeconds(5);

  private final ProxyConfig config;
  private final TelemetrySink sink;
  private final CountDownLatch finished = new CountDownLatch(1);

  @Nullable private volatile Process process;
  private volatile boolean terminating;

  public AcpProxy(ProxyConfig config, TelemetrySink sink) {
    this.config = config;
    this.sink = sink;
  }

  /**
   * Spawns the configured agent and proxies between it and the editor's streams.
   *
   * @return the agent's exit code
   * @throws AcpProxyException if the agent cannot be started
   */
  public int run(InputStream editorIn, OutputStream editorOut) throws AcpProxyException {
    return run(spawn(config.getCommand()), editorIn, editorOut);
  }

  @VisibleForTesting
  int run(Process agent, InputStream editorIn, OutputStream editorOut) {
    this.process = agent;
    ExecutorService executor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("acp-traces-%d").setDaemon(true).build());
    try {
      TapChannel channel = new TapChannel();
      SpanCorrelator correlator =
          new SpanCorrelator(
              AcpTelemetry.create(sink.openTelemetry()), config.isRecordContent());
      Future<?> consumer = executor.submit(new CorrelatorConsumer(channel, correlator, sink));

      CompletableFuture<Long> editorDone =
          forward(
              new StreamTap(
                  Direction.EDITOR_TO_AGENT, editorIn, agent.getOutputStream(), channel),
              executor);
      CompletableFuture<Long> agentDone =
          forward(
              new StreamTap(Direction.AGENT_TO_EDITOR, agent.getInputStream(), editorOut, channel),
              executor);
      CompletableFuture<Integer> exited =
          CompletableFuture.supplyAsync(() -> waitFor(agent), executor);

      CompletableFuture<Void> agentOutputFailed = new CompletableFuture<>();
      agentDone.whenComplete(
          (lines, e) -> {
            if (e != null) {
              agentOutputFailed.complete(null);
            }
          });

      CompletableFuture.anyOf(editorDone, exited, agentOutputFailed)
          .handle((v, e) -> null)
          .join();
      terminating = true;

      if (exited.isDone()) {
        logger.debug("Agent exited, draining its remaining output");
      } else {
        if (agentOutputFailed.isDone() || editorDone.isCompletedExceptionally()) {
          logger.debug("Pipe failed, stopping agent");
        } else {
          logger.debug("Editor stream ended, stopping agent");
        }
        closeQuietly(agent.getOutputStream());
        agent.destroyForcibly();
      }
      awaitQuietly(agentDone, config.getDrainTimeout(), "agent output drain");

      channel.close();
      awaitConsumer(consumer);

      int exitCode = exitCode(agent);
      logger.info("Agent exited with code {}", exitCode);
      return exitCode;
    } finally {
      executor.shutdownNow();
      finished.countDown();
    }
  }

  /**
   * Kills the agent, which makes a running {@link #run} take its termination path, and waits for
   * that path to finish.
   */
  public void stop(Duration timeout) {
    Process agent = process;
    if (agent != null && agent.isAlive()) {
      logger.info("Stopping agent");
      agent.destroyForcibly();
    }
    try {
      if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("Proxy did not finish within {}", timeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static Process spawn(List<String> command) throws AcpProxyException {
    logger.info(
        "Spawning agent {} with args {}", command.get(0), command.subList(1, command.size()));
    try {
      return new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.INHERIT).start();
    } catch (IOException e) {
      throw new AcpProxyException("Failed to spawn agent: " + command.get(0), e);
    }
  }

  private CompletableFuture<Long> forward(StreamTap tap, ExecutorService executor) {
    CompletableFuture<Long> future = new CompletableFuture<>();
    executor.execute(
        () -> {
          try {
            future.complete(tap.call());
          } catch (IOException | RuntimeException e) {
            if (terminating) {
              logger.debug("Forwarder stopped during shutdown: {}", e.toString());
            } else {
              logger.error("Forwarder failed", e);
            }
            future.completeExceptionally(e);
          }
        });
    return future;
  }

  private static int waitFor(Process agent) {
    try {
      return agent.waitFor();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CompletionException(e);
    }
  }

  private static int exitCode(Process agent) {
    try {
      if (agent.waitFor(KILL_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        return agent.exitValue();
      }
      logger.warn("Agent still running {} after termination", KILL_TIMEOUT);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return 0;
  }

  private static void awaitQuietly(Future<?> future, Duration timeout, String what) {
    try {
      future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.warn("Gave up waiting for {} after {}", what, timeout);
    } catch (ExecutionException e) {
      logger.debug("{} ended with {}", what, e.getCause().toString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void awaitConsumer(Future<?> future) {
    try {
      future.get();
    } catch (ExecutionException e) {
      logger.warn("Correlator consumer failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void closeQuietly(OutputStream stream) {
    try {
      stream.close();
    } catch (IOException e) {
      logger.debug("Closing agent stdin failed: {}", e.toString());
    }
  }
}
