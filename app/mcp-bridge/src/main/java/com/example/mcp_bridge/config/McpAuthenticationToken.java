package com.example.mcp_bridge.config;

import com.example.mcp_bridge.model.AuthContext;
import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/** 検証済み bearer トークンの認証。principal は {@link AuthContext}。 */
public class McpAuthenticationToken extends AbstractAuthenticationToken {

  private final transient AuthContext authContext;

  public McpAuthenticationToken(AuthContext authContext) {
    super(
        authContext.scopes().stream().map(scope -> new SimpleGrantedAuthority("SCOPE_" + scope)).toList());
    this.authContext = authContext;
    setAuthenticated(true);
  }

  public AuthContext authContext() {
    return authContext;
  }

  @Override
  public Object getCredentials() {
    return "";
  }

  @Override
  public Object getPrincipal() {
    return authContext;
  }

  @Override
  public String getName() {
    return authContext.hasIdentity() ? authContext.identity() : authContext.clientId();
  }

  @Override
  public boolean equals(Object obj) {
    return super.equals(obj);
  }

  @Override
  public int hashCode() {
    return super.hashCode();
  }
}
