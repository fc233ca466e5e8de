package com.example.mcp_bridge.model;

import com.fasterxml.jackson.databind.JsonNode;

/** upstream データ呼び出しの結果。401/403 のみが Unauthorized になる。 */
public sealed interface UpstreamCallResult
    permits UpstreamCallResult.Success,
        UpstreamCallResult.Unauthorized,
        UpstreamCallResult.TransientError {

  record Success(JsonNode payload) implements UpstreamCallResult {}

  record Unauthorized(int httpStatus) implements UpstreamCallResult {}

  /** httpStatus は HTTP 応答が無い場合(接続失敗/タイムアウト)0。 */
  record TransientError(int httpStatus, String detail, boolean timeout)
      implements UpstreamCallResult {}
}
