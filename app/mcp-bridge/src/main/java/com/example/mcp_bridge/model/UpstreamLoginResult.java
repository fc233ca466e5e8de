/*
 * どこで: app/mcp-bridge/src/main/java/com/example/mcp_bridge/model/UpstreamLoginResult.java
 * 何を: upstream ログイン呼び出しの結果をタグ付きで表す
 * なぜ: 拒否/不正応答/到達不能で後続処理(BROKEN 化するか否か)が異なるため
 */
package com.example.mcp_bridge.model;

public sealed interface UpstreamLoginResult
    permits UpstreamLoginResult.Success,
        UpstreamLoginResult.Rejected,
        UpstreamLoginResult.Malformed,
        UpstreamLoginResult.Unreachable {

  record Success(UpstreamLogin login) implements UpstreamLoginResult {}

  /** upstream が HTTP エラーを返した。 */
  record Rejected(int httpStatus) implements UpstreamLoginResult {}

  /** 2xx だが session/user が欠けている、または responseCode が成功でない。 */
  record Malformed(String detail) implements UpstreamLoginResult {}

  /** 接続失敗やタイムアウト。資格情報の正否は不明。 */
  record Unreachable(String detail, boolean timeout) implements UpstreamLoginResult {}
}
