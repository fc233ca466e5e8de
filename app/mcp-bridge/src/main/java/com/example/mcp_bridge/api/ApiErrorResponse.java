/*
 * どこで: MCP Bridge API
 * 何を: OAuth 以外のエラー応答の標準フォーマットを定義する
 * なぜ: 例外ハンドリング時のレスポンス形状を統一するため
 */
package com.example.mcp_bridge.api;

public record ApiErrorResponse(String code, String message) {}
