/*
 * どこで: MCP Bridge Repository 層
 * 何を: PKCE code_challenge から identity への一時バインディングを保持する
 * なぜ: PKCE フローに identity を載せる唯一の経路を 1 箇所に閉じ込めるため
 */
package com.example.mcp_bridge.repository;

import java.util.Optional;

public interface CodeChallengeBindingRepository {

  /** 役割: バインディングを設定する。 動作: 同じ challenge 値の既存バインディングは上書きし、上書き前の identity を返す。 */
  Optional<String> bind(String codeChallenge, String identity);

  /** 役割: バインディングを取り出して削除する。 動作: 1 つの challenge につき最初の呼び出しだけが値を得る。 */
  Optional<String> consume(String codeChallenge);
}
