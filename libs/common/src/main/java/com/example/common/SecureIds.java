/*
 * どこで: 共通ユーティリティ
 * 何を: リクエスト ID と推測不能な不透明値(コード/トークン)を生成する
 * なぜ: ID 生成方式をアプリ間で揃え、トークン値に構造を持たせないため
 */
package com.example.common;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

public final class SecureIds {

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final int OPAQUE_BYTES = 32;

  private SecureIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  // 256bit の乱数を URL セーフな Base64 で返す。値から何も復元できないこと。
  public static String newOpaqueValue() {
    final byte[] bytes = new byte[OPAQUE_BYTES];
    RANDOM.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
