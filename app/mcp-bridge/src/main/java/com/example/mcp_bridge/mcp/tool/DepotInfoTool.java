/*
 * どこで: MCP ツール
 * 何を: セッションの identity に紐づく upstream depot 口座情報を返す
 * なぜ: upstream セッション切れを自動再ログインで隠したまま、ツール呼び出し側へデータを渡すため
 */
package com.example.mcp_bridge.mcp.tool;

import com.example.mcp_bridge.mcp.McpLogLevel;
import com.example.mcp_bridge.model.AuthContext;
import com.example.mcp_bridge.service.AutoReloginService;
import com.example.mcp_bridge.service.UpstreamAccountException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DepotInfoTool implements McpTool {

  static final String NAME = "get-depot-info";

  private static final Logger logger = LoggerFactory.getLogger(DepotInfoTool.class);

  private final AutoReloginService autoReloginService;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "Returns the account information of one of the user's depots";
  }

  @Override
  public Map<String, Object> inputSchema() {
    return Map.of(
        "type",
        "object",
        "properties",
        Map.of(
            "depotIndex",
            Map.of(
                "type", "integer",
                "minimum", 0,
                "description", "Index into the depots linked to the signed-in account"),
            "depotId",
            Map.of("type", "string", "description", "Explicit depot id, wins over depotIndex")));
  }

  /**
   * 役割: depot 口座情報を取得する。
   *
   * <p>期待動作: 認証コンテキストまたは identity が無ければ upstream を呼ばずにエラー結果を返す。
   * upstream 側の失敗はプロトコルエラーではなくツールのエラー結果として返す。
   */
  @Override
  public CallToolResult call(JsonNode arguments, ToolCallContext context) {
    final Optional<AuthContext> authContext = context.authContext();
    if (authContext.isEmpty() || !authContext.get().hasIdentity()) {
      logger.info("depot info requested without identity sessionId={}", context.sessionId());
      return CallToolResult.error(
          "Not authenticated with the depot service. Authorize this client and try again.");
    }
    final AuthContext auth = authContext.get();

    final String depotId;
    try {
      depotId = selectDepotId(arguments, auth.depotIds());
    } catch (IllegalArgumentException ex) {
      return CallToolResult.error(ex.getMessage());
    }

    context
        .transport()
        .sendLog(
            McpLogLevel.INFO,
            NAME,
            "Fetching depot account " + (depotId == null ? "(default)" : depotId));
    try {
      final JsonNode payload = autoReloginService.callWithAutoRelogin(auth.identity(), depotId);
      return CallToolResult.text(payload.toPrettyString());
    } catch (UpstreamAccountException ex) {
      logger.info(
          "depot info failed sessionId={} reason={}", context.sessionId(), ex.reason());
      context.transport().sendLog(McpLogLevel.ERROR, NAME, ex.getMessage());
      final String message =
          ex.requiresUserLogin()
              ? ex.getMessage() + " (re-authorize this client to log in again)"
              : ex.getMessage();
      return CallToolResult.error(message);
    }
  }

  private String selectDepotId(JsonNode arguments, List<String> knownDepotIds) {
    final JsonNode depotId = arguments.path("depotId");
    if (depotId.isTextual() && !depotId.asText().isBlank()) {
      return depotId.asText();
    }
    final JsonNode depotIndex = arguments.path("depotIndex");
    if (depotIndex.isMissingNode() || depotIndex.isNull()) {
      return null;
    }
    if (!depotIndex.canConvertToInt()
        || depotIndex.asInt() < 0
        || depotIndex.asInt() >= knownDepotIds.size()) {
      throw new IllegalArgumentException(
          "depotIndex is out of range, " + knownDepotIds.size() + " depot(s) are linked");
    }
    return knownDepotIds.get(depotIndex.asInt());
  }
}
