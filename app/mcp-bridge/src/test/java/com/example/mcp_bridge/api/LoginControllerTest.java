package com.example.mcp_bridge.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.mcp_bridge.model.BrowserSessionUser;
import com.example.mcp_bridge.service.BridgeMetrics;
import com.example.mcp_bridge.service.LoginBridgeService;
import com.example.mcp_bridge.service.UpstreamLoginFailedException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(LoginController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(BridgeApiExceptionHandler.class)
class LoginControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private LoginBridgeService loginBridgeService;
  @MockitoBean private BridgeMetrics bridgeMetrics;

  @Test
  void loginFormEscapesReturnTo() throws Exception {
    mockMvc
        .perform(get("/login").param("returnTo", "/authorize?client_id=a&state=\"x\""))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
        .andExpect(content().string(containsString("name=\"username\"")))
        .andExpect(content().string(containsString("&amp;state=&quot;x&quot;")))
        .andExpect(content().string(not(containsString("state=\"x\""))));
  }

  @Test
  void loginStoresSessionUserAndRedirects() throws Exception {
    final BrowserSessionUser user =
        new BrowserSessionUser("user-1", "a@example.com", "sess-1", List.of("depot-1"));
    when(loginBridgeService.login("alice", "pw")).thenReturn(user);

    mockMvc
        .perform(
            post("/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("username", "alice")
                .param("password", "pw")
                .param("returnTo", "/authorize?client_id=client-a"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "/authorize?client_id=client-a"))
        .andExpect(request().sessionAttribute(BrowserSessionUser.SESSION_ATTRIBUTE, user));
  }

  @Test
  void loginIgnoresOffSiteReturnTo() throws Exception {
    when(loginBridgeService.login("alice", "pw"))
        .thenReturn(new BrowserSessionUser("user-1", null, "sess-1", List.of()));

    mockMvc
        .perform(
            post("/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("username", "alice")
                .param("password", "pw")
                .param("returnTo", "//evil.example.com/steal"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "/authorize"));
  }

  @Test
  void rejectedLoginReturns401() throws Exception {
    when(loginBridgeService.login("alice", "wrong"))
        .thenThrow(
            new UpstreamLoginFailedException(
                UpstreamLoginFailedException.Reason.REJECTED, "login failed"));

    mockMvc
        .perform(
            post("/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("username", "alice")
                .param("password", "wrong"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("LOGIN_REJECTED"));
  }

  @Test
  void unreachableUpstreamReturns503() throws Exception {
    when(loginBridgeService.login("alice", "pw"))
        .thenThrow(
            new UpstreamLoginFailedException(
                UpstreamLoginFailedException.Reason.UNAVAILABLE, "login service is unavailable"));

    mockMvc
        .perform(
            post("/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("username", "alice")
                .param("password", "pw"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("LOGIN_UNAVAILABLE"));
  }

  @Test
  void missingCredentialsReturn400() throws Exception {
    when(loginBridgeService.login(null, null))
        .thenThrow(new IllegalArgumentException("username is required"));

    mockMvc
        .perform(post("/login").contentType(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void safeReturnToOnlyAcceptsSameOriginPaths() {
    assertThat(LoginController.safeReturnTo("/authorize?x=1")).isEqualTo("/authorize?x=1");
    assertThat(LoginController.safeReturnTo(null)).isEqualTo("/authorize");
    assertThat(LoginController.safeReturnTo("https://evil.example.com")).isEqualTo("/authorize");
    assertThat(LoginController.safeReturnTo("//evil.example.com")).isEqualTo("/authorize");
    assertThat(LoginController.safeReturnTo("/\\evil.example.com")).isEqualTo("/authorize");
  }
}
