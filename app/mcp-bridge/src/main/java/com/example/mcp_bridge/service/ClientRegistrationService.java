/*
 * どこで: MCP Bridge サービス層
 * 何を: 公開 PKCE クライアントの遅延登録と動的登録を行う
 * なぜ: redirect 先をループバックに限定してから登録し、登録済み redirect_uri は追記のみにするため
 */
package com.example.mcp_bridge.service;

import com.example.common.SecureIds;
import com.example.mcp_bridge.model.ClientRegistration;
import com.example.mcp_bridge.repository.ClientRegistrationRepository;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ClientRegistrationService {

  private static final Logger logger = LoggerFactory.getLogger(ClientRegistrationService.class);
  private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "[::1]");

  private final ClientRegistrationRepository clientRegistrationRepository;
  private final Clock clock;

  public Optional<ClientRegistration> find(String clientId) {
    if (clientId == null || clientId.isBlank()) {
      return Optional.empty();
    }
    return clientRegistrationRepository.findByClientId(clientId);
  }

  /**
   * 役割: 認可リクエストで初見の client_id を公開 PKCE クライアントとして登録する。 動作: 既存クライアントには redirect_uri
   * を追記し、未登録ならループバックの redirect_uri に限り新規登録する。 前提: どちらの場合も非ループバックは拒否する。
   */
  public synchronized ClientRegistration ensurePublicPkceClient(
      String clientId, String redirectUri) {
    requireLoopback(redirectUri);
    final Optional<ClientRegistration> existing = find(clientId);
    if (existing.isPresent()) {
      final ClientRegistration current = existing.get();
      if (current.allowsRedirectUri(redirectUri)) {
        return current;
      }
      logger.info("appending redirect_uri to client clientId={} redirectUri={}", clientId, redirectUri);
      return clientRegistrationRepository.save(current.withRedirectUri(redirectUri));
    }
    final ClientRegistration registration =
        ClientRegistration.publicPkceClient(clientId, List.of(redirectUri), Instant.now(clock));
    logger.info("registered public PKCE client clientId={} redirectUri={}", clientId, redirectUri);
    return clientRegistrationRepository.save(registration);
  }

  /** 動的クライアント登録。client_id はサーバーが採番する。 */
  public ClientRegistration register(List<String> redirectUris) {
    if (redirectUris == null || redirectUris.isEmpty()) {
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_REQUEST, "redirect_uris is required");
    }
    redirectUris.forEach(this::requireLoopback);
    final ClientRegistration registration =
        ClientRegistration.publicPkceClient(
            SecureIds.newRequestId(), redirectUris.stream().distinct().toList(), Instant.now(clock));
    logger.info("dynamically registered client clientId={}", registration.clientId());
    return clientRegistrationRepository.save(registration);
  }

  public static boolean isLoopbackRedirect(String redirectUri) {
    if (redirectUri == null || redirectUri.isBlank()) {
      return false;
    }
    try {
      final URI uri = new URI(redirectUri);
      return uri.getHost() != null && LOOPBACK_HOSTS.contains(uri.getHost().toLowerCase());
    } catch (URISyntaxException ex) {
      return false;
    }
  }

  private void requireLoopback(String redirectUri) {
    if (!isLoopbackRedirect(redirectUri)) {
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_REQUEST,
          "invalid_redirect_uri: only loopback redirect URIs are allowed");
    }
  }
}
