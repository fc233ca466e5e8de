package com.example.mcp_bridge.repository;

import com.example.mcp_bridge.model.AuthorizationCode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AuthorizationCodeRepository {

  void save(AuthorizationCode code);

  Optional<AuthorizationCode> findByCode(String code);

  /**
   * 役割: コードを消費する。 動作: 保存値が expected と同一の場合だけ削除し true を返す。 既に消費済みなら false。
   */
  boolean consume(AuthorizationCode expected);

  /** 期限切れのコードを削除し、削除したコードを返す。 */
  List<AuthorizationCode> deleteExpired(Instant now);
}
