/*
 * どこで: MCP Bridge Repository 層
 * 何を: 公開クライアント登録の保存/参照を抽象化する
 * なぜ: 単一プロセスのメモリ保持から外部ストアへ差し替えても呼び出し側を変えないため
 */
package com.example.mcp_bridge.repository;

import com.example.mcp_bridge.model.ClientRegistration;
import java.util.Optional;

public interface ClientRegistrationRepository {

  Optional<ClientRegistration> findByClientId(String clientId);

  /** 役割: 登録を保存する。 動作: 同一 clientId は置き換える(redirect_uri の追記は呼び出し側で組み立てる)。 */
  ClientRegistration save(ClientRegistration registration);
}
