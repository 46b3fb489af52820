/*
 * どこで: Assignment サービス層
 * 何を: 送信成功/失敗件数と送信所要時間のメトリクスを記録する
 * なぜ: メール送信の失敗傾向を Actuator から直接観測できるようにするため
 */
package com.taskmeister.assignment.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DispatchMetrics {

  static final String RESULT_SENT = "sent";
  static final String RESULT_FAILED = "failed";

  private static final String METRIC_DISPATCH_TOTAL = "taskmeister.dispatch.total";
  private static final String METRIC_DISPATCH_DURATION = "taskmeister.dispatch.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> resultCounters = new ConcurrentHashMap<>();
  private final Timer transportTimer;

  public DispatchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.transportTimer =
        Timer.builder(METRIC_DISPATCH_DURATION)
            .description("Time spent handing one assignment mail to the transport")
            .register(meterRegistry);
  }

  public void recordDispatchResult(String result, int assignmentCount) {
    resultCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("Assignment dispatch outcomes, counted per assignment")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment(assignmentCount);
  }

  public void recordTransportDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    transportTimer.record(duration);
  }
}
