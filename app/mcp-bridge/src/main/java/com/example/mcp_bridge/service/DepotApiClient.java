/*
 * どこで: MCP Bridge サービス層
 * 何を: upstream(depot API)への資格情報ログインと depot 口座取得を行う
 * なぜ: HTTP 失敗を成功/未認証/一時障害のタグ付き結果へ変換し、再ログイン判定を呼び出し側で明示的に行うため
 */
package com.example.mcp_bridge.service;

import com.example.mcp_bridge.config.UpstreamClientProperties;
import com.example.mcp_bridge.model.UpstreamCallResult;
import com.example.mcp_bridge.model.UpstreamLogin;
import com.example.mcp_bridge.model.UpstreamLoginResult;
import com.example.mcp_bridge.service.dto.UpstreamLoginRequest;
import com.example.mcp_bridge.service.dto.UpstreamLoginResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Objects;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class DepotApiClient {

  private static final Logger logger = LoggerFactory.getLogger(DepotApiClient.class);
  private static final int RESPONSE_CODE_OK = 1;

  private final RestClient upstreamRestClient;
  private final UpstreamClientProperties properties;

  public UpstreamLoginResult login(@NonNull String username, @NonNull String password) {
    final UpstreamLoginRequest request =
        new UpstreamLoginRequest(
            username, password, properties.clientId(), properties.appVersion());
    final UpstreamLoginResponse response;
    try {
      response =
          upstreamRestClient
              .post()
              .uri(properties.loginPath())
              .contentType(MediaType.APPLICATION_JSON)
              .accept(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(UpstreamLoginResponse.class);
    } catch (RestClientResponseException ex) {
      // 応答ボディは資格情報の詳細を含み得るためログに出さない
      logger.warn(
          "upstream login failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      return new UpstreamLoginResult.Rejected(ex.getStatusCode().value());
    } catch (ResourceAccessException ex) {
      final boolean timeout = isTimeout(ex);
      logger.warn("upstream login unreachable timeout={}", timeout);
      return new UpstreamLoginResult.Unreachable("upstream login unreachable", timeout);
    } catch (RestClientException ex) {
      logger.warn("upstream login response parse failed", ex);
      return new UpstreamLoginResult.Malformed("upstream login response parse failed");
    }
    return toLoginResult(response);
  }

  public UpstreamCallResult fetchDepotAccount(@NonNull String session, @NonNull String depotId) {
    try {
      final JsonNode payload =
          upstreamRestClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path(properties.depotAccountPath())
                          .queryParam("depot", depotId)
                          .build())
              .header(properties.sessionHeaderName(), session)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .body(JsonNode.class);
      return new UpstreamCallResult.Success(payload == null ? NullNode.getInstance() : payload);
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      if (status == 401 || status == 403) {
        logger.info("upstream rejected session for depot={} status={}", depotId, status);
        return new UpstreamCallResult.Unauthorized(status);
      }
      logger.warn(
          "upstream depot call failed depot={} status={} statusText={}",
          depotId,
          status,
          ex.getStatusText());
      return new UpstreamCallResult.TransientError(status, "upstream http " + status, false);
    } catch (ResourceAccessException ex) {
      final boolean timeout = isTimeout(ex);
      logger.warn("upstream depot call unreachable depot={} timeout={}", depotId, timeout);
      return new UpstreamCallResult.TransientError(
          0, timeout ? "upstream request timeout" : "upstream connection failed", timeout);
    } catch (RestClientException ex) {
      logger.warn("upstream depot response parse failed depot={}", depotId, ex);
      return new UpstreamCallResult.TransientError(0, "upstream response parse failed", false);
    }
  }

  private UpstreamLoginResult toLoginResult(UpstreamLoginResponse response) {
    if (response == null) {
      logger.warn("upstream login returned empty body");
      return new UpstreamLoginResult.Malformed("upstream login response is empty");
    }
    if (response.responseCode() == null || response.responseCode() != RESPONSE_CODE_OK) {
      logger.warn("upstream login returned responseCode={}", response.responseCode());
      return new UpstreamLoginResult.Malformed("upstream login was not accepted");
    }
    if (isBlank(response.session()) || response.user() == null || isBlank(response.user().id())) {
      logger.warn("upstream login response validation failed");
      return new UpstreamLoginResult.Malformed("upstream login response is invalid");
    }
    final List<String> depotIds =
        response.user().depots() == null
            ? List.of()
            : response.user().depots().stream()
                .filter(Objects::nonNull)
                .map(UpstreamLoginResponse.Depot::id)
                .filter(id -> !isBlank(id))
                .toList();
    return new UpstreamLoginResult.Success(
        new UpstreamLogin(
            response.user().id(), response.user().email(), response.session(), depotIds));
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
