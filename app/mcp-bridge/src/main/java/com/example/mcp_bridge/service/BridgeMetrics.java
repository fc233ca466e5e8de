/*
 * どこで: MCP Bridge サービス層
 * 何を: ログイン/自動再ログイン/upstream エラー/トークン発行のメトリクスを記録する
 * なぜ: upstream セッション切れの頻度と BROKEN 化を Prometheus から直接観測できるようにするため
 */
package com.example.mcp_bridge.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class BridgeMetrics {

  private static final String METRIC_LOGIN_TOTAL = "bridge.login.total";
  private static final String METRIC_RELOGIN_TOTAL = "bridge.relogin.total";
  private static final String METRIC_UPSTREAM_ERROR_TOTAL = "bridge.upstream.error.total";
  private static final String METRIC_TOKEN_ISSUED_TOTAL = "bridge.token.issued.total";
  private static final String METRIC_OAUTH_ERROR_TOTAL = "bridge.oauth.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public BridgeMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLoginResult(String result) {
    increment(METRIC_LOGIN_TOTAL, "Login bridge outcomes", "result", result);
  }

  public void recordReloginResult(String result) {
    increment(METRIC_RELOGIN_TOTAL, "Automatic upstream re-login outcomes", "result", result);
  }

  public void recordUpstreamError(String reason) {
    increment(METRIC_UPSTREAM_ERROR_TOTAL, "Upstream call failures by reason", "reason", reason);
  }

  public void recordTokenIssued(String binding) {
    increment(METRIC_TOKEN_ISSUED_TOTAL, "Access tokens issued", "binding", binding);
  }

  public void recordOAuthError(String error) {
    increment(METRIC_OAUTH_ERROR_TOTAL, "OAuth endpoint errors by error code", "error", error);
  }

  private void increment(String name, String description, String tagKey, String tagValue) {
    counters
        .computeIfAbsent(
            name + "|" + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
