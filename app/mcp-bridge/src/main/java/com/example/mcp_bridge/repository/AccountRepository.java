/*
 * どこで: MCP Bridge Repository 層
 * 何を: identity ごとの upstream アカウントを保持する
 * なぜ: ログインブリッジと再ログイン処理の 2 者が書き込む唯一の共有資源を 1 箇所で守るため
 */
package com.example.mcp_bridge.repository;

import com.example.mcp_bridge.model.AccountRecord;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface AccountRepository {

  Optional<AccountRecord> findByIdentity(String identity);

  /** 役割: アカウントを upsert する。 動作: 既存レコードは丸ごと置き換える。 */
  AccountRecord save(AccountRecord account);

  /**
   * 役割: 既存アカウントを原子的に置き換える。 動作: 存在すれば updater の戻り値で置き換えて返し、存在しなければ empty。
   * 前提: updater は副作用を持たないこと。
   */
  Optional<AccountRecord> update(String identity, UnaryOperator<AccountRecord> updater);
}
