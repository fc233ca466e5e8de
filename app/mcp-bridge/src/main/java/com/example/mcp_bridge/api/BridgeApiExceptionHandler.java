package com.example.mcp_bridge.api;

import com.example.mcp_bridge.mcp.JsonRpcResponse;
import com.example.mcp_bridge.mcp.McpProtocolException;
import com.example.mcp_bridge.service.BridgeMetrics;
import com.example.mcp_bridge.service.OAuthFlowException;
import com.example.mcp_bridge.service.UpstreamLoginFailedException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class BridgeApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(BridgeApiExceptionHandler.class);

  private final BridgeMetrics bridgeMetrics;

  @ExceptionHandler(OAuthFlowException.class)
  public ResponseEntity<OAuthErrorResponse> handleOAuthFlow(OAuthFlowException ex) {
    final HttpStatus status =
        switch (ex.reason()) {
          case INVALID_CLIENT, INVALID_TOKEN -> HttpStatus.UNAUTHORIZED;
          case NOT_IMPLEMENTED -> HttpStatus.NOT_IMPLEMENTED;
          case INVALID_REQUEST, INVALID_GRANT, INVALID_TARGET, UNSUPPORTED_GRANT_TYPE ->
              HttpStatus.BAD_REQUEST;
        };
    logger.info("oauth request rejected reason={} message={}", ex.reason(), ex.getMessage());
    bridgeMetrics.recordOAuthError(ex.reason().errorCode());
    return ResponseEntity.status(status)
        .header("Cache-Control", "no-store")
        .body(new OAuthErrorResponse(ex.reason().errorCode(), ex.getMessage()));
  }

  @ExceptionHandler(UpstreamLoginFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleLoginFailed(UpstreamLoginFailedException ex) {
    final HttpStatus status =
        switch (ex.reason()) {
          case REJECTED -> HttpStatus.UNAUTHORIZED;
          case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse("LOGIN_" + ex.reason().name(), ex.getMessage()));
  }

  @ExceptionHandler(McpProtocolException.class)
  public ResponseEntity<JsonRpcResponse> handleMcpProtocol(McpProtocolException ex) {
    logger.info("mcp request rejected code={} message={}", ex.code(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .contentType(MediaType.APPLICATION_JSON)
        .body(JsonRpcResponse.failure(null, ex.toError()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }
}
