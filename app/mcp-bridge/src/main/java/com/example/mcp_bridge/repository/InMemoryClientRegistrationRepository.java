package com.example.mcp_bridge.repository;

import com.example.mcp_bridge.model.ClientRegistration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryClientRegistrationRepository implements ClientRegistrationRepository {

  private final Map<String, ClientRegistration> clients = new ConcurrentHashMap<>();

  @Override
  public Optional<ClientRegistration> findByClientId(String clientId) {
    return Optional.ofNullable(clients.get(clientId));
  }

  @Override
  public ClientRegistration save(ClientRegistration registration) {
    clients.put(registration.clientId(), registration);
    return registration;
  }
}
