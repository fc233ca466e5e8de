package com.example.mcp_bridge.config;

import com.example.mcp_bridge.service.IntrospectionService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.logout.HttpStatusReturningLogoutSuccessHandler;

@Configuration
public class BridgeSecurityConfig {

  public static final String MCP_PATH = "/mcp";
  static final String PROTECTED_RESOURCE_METADATA_PATH = "/.well-known/oauth-protected-resource/mcp";

  private final boolean csrfEnabled;
  private final OAuthServerProperties oauthProperties;
  private final McpProperties mcpProperties;

  public BridgeSecurityConfig(
      @Value("${app.security.csrf-enabled:true}") boolean csrfEnabled,
      OAuthServerProperties oauthProperties,
      McpProperties mcpProperties) {
    this.csrfEnabled = csrfEnabled;
    this.oauthProperties = oauthProperties;
    this.mcpProperties = mcpProperties;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, IntrospectionService introspectionService) throws Exception {
    if (csrfEnabled) {
      // トークン系と MCP はブラウザ外のクライアントが直接呼ぶ
      http.csrf(
          csrf -> csrf.ignoringRequestMatchers("/token", "/introspect", "/register", MCP_PATH));
    } else {
      http.csrf(csrf -> csrf.disable());
    }
    http.sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.IF_REQUIRED))
        .authorizeHttpRequests(
            auth -> {
              if (Boolean.TRUE.equals(mcpProperties.requireBearerToken())) {
                auth.requestMatchers(MCP_PATH).authenticated();
              } else {
                auth.requestMatchers(MCP_PATH).permitAll();
              }
              auth.anyRequest().permitAll();
            })
        .addFilterBefore(
            new McpBearerTokenFilter(introspectionService, oauthProperties),
            AuthorizationFilter.class)
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint()))
        .logout(
            logout ->
                logout
                    .logoutUrl("/logout")
                    .logoutSuccessHandler(
                        new HttpStatusReturningLogoutSuccessHandler(HttpStatus.NO_CONTENT))
                    .invalidateHttpSession(true)
                    .deleteCookies("JSESSIONID"));

    return http.build();
  }

  @Bean
  AuthenticationEntryPoint authenticationEntryPoint() {
    return (request, response, authException) -> {
      response.setHeader(
          HttpHeaders.WWW_AUTHENTICATE, bearerChallenge(oauthProperties, null, null));
      response.sendError(HttpStatus.UNAUTHORIZED.value(), "Authentication required");
    };
  }

  static String bearerChallenge(
      OAuthServerProperties properties, String error, String errorDescription) {
    final StringBuilder challenge = new StringBuilder("Bearer ");
    if (error != null) {
      challenge.append("error=\"").append(error).append("\", ");
      if (errorDescription != null) {
        challenge.append("error_description=\"").append(errorDescription).append("\", ");
      }
    }
    challenge
        .append("resource_metadata=\"")
        .append(properties.endpoint(PROTECTED_RESOURCE_METADATA_PATH))
        .append('"');
    return challenge.toString();
  }
}
