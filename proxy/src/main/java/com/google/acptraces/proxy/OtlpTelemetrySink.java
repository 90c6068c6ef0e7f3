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

import com.google.acptraces.proxy.config.OtlpProtocol;
import com.google.acptraces.proxy.config.ProxyConfig;
import com.google.acptraces.telemetry.TelemetrySink;
import com.google.common.annotations.VisibleForTesting;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.exporter.otlp.http.metrics.OtlpHttpMetricExporter;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricExporter;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports spans and metrics over OTLP. The SDK is built explicitly for this process and never
 * registered as the global instance.
 */
public final class OtlpTelemetrySink implements TelemetrySink {
  private static final Logger logger = LoggerFactory.getLogger(OtlpTelemetrySink.class);

  static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(10);
  static final String TRACES_PATH = "/v1/traces";
  static final String METRICS_PATH = "/v1/metrics";

  private final OpenTelemetrySdk sdk;
  private final SdkTracerProvider tracerProvider;
  private final SdkMeterProvider meterProvider;
  private final AtomicBoolean closed = new AtomicBoolean();

  @VisibleForTesting
  OtlpTelemetrySink(String serviceName, SpanExporter spanExporter, MetricExporter metricExporter) {
    Resource resource =
        Resource.getDefault().merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));
    this.tracerProvider =
        SdkTracerProvider.builder()
            .setResource(resource)
            .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
            .build();
    this.meterProvider =
        SdkMeterProvider.builder()
            .setResource(resource)
            .registerMetricReader(PeriodicMetricReader.builder(metricExporter).build())
            .build();
    this.sdk =
        OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setMeterProvider(meterProvider)
            .build();
  }

  /** Creates a sink exporting to the collector named in {@code config}. */
  public static OtlpTelemetrySink create(ProxyConfig config) {
    String endpoint = config.getOtlpEndpoint();
    logger.info(
        "Exporting telemetry to {} over {} as service {}",
        endpoint,
        config.getOtlpProtocol(),
        config.getServiceName());
    if (config.getOtlpProtocol() == OtlpProtocol.GRPC) {
      return new OtlpTelemetrySink(
          config.getServiceName(),
          OtlpGrpcSpanExporter.builder().setEndpoint(endpoint).build(),
          OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build());
    }
    return new OtlpTelemetrySink(
        config.getServiceName(),
        OtlpHttpSpanExporter.builder().setEndpoint(signalEndpoint(endpoint, TRACES_PATH)).build(),
        OtlpHttpMetricExporter.builder()
            .setEndpoint(signalEndpoint(endpoint, METRICS_PATH))
            .build());
  }

  /** Appends a per-signal path to a base HTTP endpoint. */
  static String signalEndpoint(String baseEndpoint, String path) {
    String base =
        baseEndpoint.endsWith("/")
            ? baseEndpoint.substring(0, baseEndpoint.length() - 1)
            : baseEndpoint;
    return base.endsWith(path) ? base : base + path;
  }

  @Override
  public OpenTelemetry openTelemetry() {
    return sdk;
  }

  @Override
  public void flush() {
    CompletableResultCode result =
        CompletableResultCode.ofAll(
                List.of(tracerProvider.forceFlush(), meterProvider.forceFlush()))
            .join(FLUSH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    if (!result.isSuccess()) {
      logger.warn("Telemetry flush did not complete within {}", FLUSH_TIMEOUT);
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    flush();
    CompletableResultCode result =
        sdk.shutdown().join(FLUSH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    if (!result.isSuccess()) {
      logger.warn("Telemetry shutdown did not complete within {}", FLUSH_TIMEOUT);
    }
  }
}
