package com.example.mcp_bridge.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.mcp_bridge.api.response.IntrospectionResponse;
import com.example.mcp_bridge.api.response.TokenResponse;
import com.example.mcp_bridge.service.BridgeMetrics;
import com.example.mcp_bridge.service.IntrospectionService;
import com.example.mcp_bridge.service.OAuthFlowException;
import com.example.mcp_bridge.service.TokenService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TokenController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(BridgeApiExceptionHandler.class)
class TokenControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TokenService tokenService;
  @MockitoBean private IntrospectionService introspectionService;
  @MockitoBean private BridgeMetrics bridgeMetrics;

  @Test
  void tokenExchangesAuthorizationCode() throws Exception {
    when(tokenService.exchangeAuthorizationCode("client-a", "code-1", "verifier", "http://localhost/cb"))
        .thenReturn(new TokenResponse("tok-1", "bearer", 3600L, null));

    mockMvc
        .perform(
            post("/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("grant_type", "authorization_code")
                .param("client_id", "client-a")
                .param("code", "code-1")
                .param("code_verifier", "verifier")
                .param("redirect_uri", "http://localhost/cb"))
        .andExpect(status().isOk())
        .andExpect(header().string("Cache-Control", "no-store"))
        .andExpect(header().string("Pragma", "no-cache"))
        .andExpect(jsonPath("$.access_token").value("tok-1"))
        .andExpect(jsonPath("$.token_type").value("bearer"))
        .andExpect(jsonPath("$.expires_in").value(3600))
        .andExpect(jsonPath("$.scope").doesNotExist());
  }

  @Test
  void tokenRequiresGrantType() throws Exception {
    mockMvc
        .perform(post("/token").contentType(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));
  }

  @Test
  void tokenRejectsUnknownGrantType() throws Exception {
    mockMvc
        .perform(
            post("/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("grant_type", "client_credentials"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("unsupported_grant_type"));
  }

  @Test
  void tokenMapsUnknownClientTo401() throws Exception {
    when(tokenService.exchangeAuthorizationCode("nobody", "code-1", null, null))
        .thenThrow(new OAuthFlowException(OAuthFlowException.Reason.INVALID_CLIENT, "unknown client"));

    mockMvc
        .perform(
            post("/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("grant_type", "authorization_code")
                .param("client_id", "nobody")
                .param("code", "code-1"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("invalid_client"));
  }

  @Test
  void refreshGrantIsNotImplemented() throws Exception {
    when(tokenService.exchangeRefreshToken("client-a", "r-1"))
        .thenThrow(
            new OAuthFlowException(
                OAuthFlowException.Reason.NOT_IMPLEMENTED, "refresh tokens are not supported"));

    mockMvc
        .perform(
            post("/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("grant_type", "refresh_token")
                .param("client_id", "client-a")
                .param("refresh_token", "r-1"))
        .andExpect(status().isNotImplemented());
  }

  @Test
  void introspectReturnsActiveToken() throws Exception {
    when(introspectionService.introspect("tok-1"))
        .thenReturn(
            new IntrospectionResponse(
                true,
                "client-a",
                "mcp:tools",
                1_777_000_000L,
                "http://localhost:3000/mcp",
                "user-1",
                "sess-1",
                List.of("depot-1"),
                "CONNECTED"));

    mockMvc
        .perform(
            post("/introspect")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("token", "tok-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(true))
        .andExpect(jsonPath("$.identity").value("user-1"))
        .andExpect(jsonPath("$.resource_ids[0]").value("depot-1"))
        .andExpect(jsonPath("$.upstream_status").value("CONNECTED"));
  }

  @Test
  void introspectReturns401WithOnlyActiveFalse() throws Exception {
    when(introspectionService.introspect("stale")).thenReturn(IntrospectionResponse.inactive());

    mockMvc
        .perform(
            post("/introspect")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("token", "stale"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.active").value(false))
        .andExpect(jsonPath("$.client_id").doesNotExist())
        .andExpect(jsonPath("$.identity").doesNotExist());
  }

  @Test
  void introspectRequiresToken() throws Exception {
    mockMvc
        .perform(post("/introspect").contentType(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));
  }
}
