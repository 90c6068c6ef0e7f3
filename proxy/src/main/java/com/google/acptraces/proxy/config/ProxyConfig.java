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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.List;

/**
 * Configuration of one proxy run. Uses Builder Pattern for flexible configuration.
 *
 * <p>All fields are immutable once built. Use the builder to create instances.
 */
public final class ProxyConfig {
  public static final String DEFAULT_SERVICE_NAME = "acp-agent";
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofMillis(2000);

  private final String otlpEndpoint;
  private final OtlpProtocol otlpProtocol;
  private final String serviceName;
  private final boolean recordContent;
  private final Duration drainTimeout;
  private final ImmutableList<String> command;

  private ProxyConfig(Builder builder) {
    this.otlpProtocol = builder.otlpProtocol;
    this.otlpEndpoint =
        builder.otlpEndpoint != null ? builder.otlpEndpoint : otlpProtocol.defaultEndpoint();
    this.serviceName = builder.serviceName;
    this.recordContent = builder.recordContent;
    this.drainTimeout = builder.drainTimeout;
    this.command = ImmutableList.copyOf(builder.command);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getOtlpEndpoint() {
    return otlpEndpoint;
  }

  public OtlpProtocol getOtlpProtocol() {
    return otlpProtocol;
  }

  public String getServiceName() {
    return serviceName;
  }

  public boolean isRecordContent() {
    return recordContent;
  }

  public Duration getDrainTimeout() {
    return drainTimeout;
  }

  /** The agent executable followed by its arguments. */
  public ImmutableList<String> getCommand() {
    return command;
  }

  /** Builder for ProxyConfig. */
  public static class Builder {
    private String otlpEndpoint;
    private OtlpProtocol otlpProtocol = OtlpProtocol.GRPC;
    private String serviceName = DEFAULT_SERVICE_NAME;
    private boolean recordContent = false;
    private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
    private List<String> command = List.of();

    /** Collector endpoint; defaults to the protocol's local endpoint when unset. */
    @CanIgnoreReturnValue
    public Builder otlpEndpoint(String otlpEndpoint) {
      this.otlpEndpoint = otlpEndpoint;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder otlpProtocol(OtlpProtocol otlpProtocol) {
      this.otlpProtocol = otlpProtocol;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder serviceName(String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder recordContent(boolean recordContent) {
      this.recordContent = recordContent;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder drainTimeout(Duration drainTimeout) {
      if (drainTimeout.isNegative()) {
        throw new IllegalArgumentException("Drain timeout must be >= 0");
      }
      this.drainTimeout = drainTimeout;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder command(List<String> command) {
      this.command = List.copyOf(command);
      return this;
    }

    public ProxyConfig build() {
      if (command.isEmpty()) {
        throw new IllegalArgumentException("Agent command is required");
      }
      if (serviceName == null || serviceName.isEmpty()) {
        throw new IllegalArgumentException("Service name is required");
      }
      return new ProxyConfig(this);
    }
  }

  @Override
  public String toString() {
    return String.format(
        "ProxyConfig{endpoint='%s', protocol=%s, serviceName='%s', recordContent=%s, command=%s}",
        otlpEndpoint, otlpProtocol, serviceName, recordContent, command);
  }
}
