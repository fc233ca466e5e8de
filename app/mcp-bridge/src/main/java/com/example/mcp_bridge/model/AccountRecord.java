package com.example.mcp_bridge.model;

import java.time.Instant;
import java.util.List;

/**
 * identity ごとの upstream 資格情報とセッション。
 *
 * <p>書き込みは常にレコード全体の置き換えで行う(部分更新しない)。
 */
public record AccountRecord(
    String identity,
    String upstreamUsername,
    String upstreamPassword,
    String upstreamSession,
    List<String> depotIds,
    AccountStatus status,
    int failedLoginCount,
    Instant lastLoginAt) {

  public AccountRecord {
    depotIds = depotIds == null ? List.of() : List.copyOf(depotIds);
  }

  public static AccountRecord connected(
      String identity,
      String upstreamUsername,
      String upstreamPassword,
      String upstreamSession,
      List<String> depotIds,
      Instant loginAt) {
    return new AccountRecord(
        identity,
        upstreamUsername,
        upstreamPassword,
        upstreamSession,
        depotIds,
        AccountStatus.CONNECTED,
        0,
        loginAt);
  }

  public AccountRecord withRefreshedSession(
      String newSession, List<String> newDepotIds, Instant loginAt) {
    return new AccountRecord(
        identity,
        upstreamUsername,
        upstreamPassword,
        newSession,
        newDepotIds,
        AccountStatus.CONNECTED,
        0,
        loginAt);
  }

  public AccountRecord markedBroken() {
    return new AccountRecord(
        identity,
        upstreamUsername,
        upstreamPassword,
        upstreamSession,
        depotIds,
        AccountStatus.BROKEN_NEEDS_USER,
        failedLoginCount + 1,
        lastLoginAt);
  }

  public boolean isBroken() {
    return status == AccountStatus.BROKEN_NEEDS_USER;
  }

  @Override
  public String toString() {
    // 資格情報とセッションはログに出さない
    return "AccountRecord[identity="
        + identity
        + ", upstreamUsername="
        + upstreamUsername
        + ", depotIds="
        + depotIds
        + ", status="
        + status
        + ", failedLoginCount="
        + failedLoginCount
        + ", lastLoginAt="
        + lastLoginAt
        + "]";
  }
}
