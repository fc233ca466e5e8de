package com.example.mcp_bridge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.mcp_bridge.config.UpstreamClientProperties;
import com.example.mcp_bridge.model.UpstreamCallResult;
import com.example.mcp_bridge.model.UpstreamLoginResult;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class DepotApiClientTest {

  private static final String LOGIN_URL = "http://upstream.test/user/login";
  private static final String DEPOT_URL = "http://upstream.test/depot/account?depot=depot-1";

  @Test
  void loginPostsCredentialsWithClientIdentifiersAndMapsUser() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(LOGIN_URL))
        .andExpect(method(POST))
        .andExpect(
            content()
                .json(
                    """
                    {"username":"alice","password":"pw","client":"vtj-app","version":"v2.5.2"}
                    """))
        .andRespond(
            withSuccess(
                """
                {"responseCode":1,"session":"sess-1",
                 "user":{"_id":"user-1","email":"alice@example.com",
                         "depots":[{"_id":"depot-1"},{"_id":"depot-2"}]}}
                """,
                MediaType.APPLICATION_JSON));

    final UpstreamLoginResult result = fixture.client.login("alice", "pw");

    assertThat(result).isInstanceOf(UpstreamLoginResult.Success.class);
    final UpstreamLoginResult.Success success = (UpstreamLoginResult.Success) result;
    assertThat(success.login().identity()).isEqualTo("user-1");
    assertThat(success.login().email()).isEqualTo("alice@example.com");
    assertThat(success.login().session()).isEqualTo("sess-1");
    assertThat(success.login().depotIds()).containsExactly("depot-1", "depot-2");
    fixture.server.verify();
  }

  @Test
  void loginMapsHttpErrorToRejected() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(LOGIN_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    final UpstreamLoginResult result = fixture.client.login("alice", "wrong");

    assertThat(result).isEqualTo(new UpstreamLoginResult.Rejected(401));
  }

  @Test
  void loginMapsMissingSessionToMalformed() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(LOGIN_URL))
        .andRespond(
            withSuccess(
                "{\"responseCode\":1,\"user\":{\"_id\":\"user-1\"}}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.login("alice", "pw"))
        .isInstanceOf(UpstreamLoginResult.Malformed.class);
  }

  @Test
  void loginMapsUnsuccessfulResponseCodeToMalformed() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(LOGIN_URL))
        .andRespond(
            withSuccess(
                "{\"responseCode\":0,\"session\":\"s\",\"user\":{\"_id\":\"user-1\"}}",
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.login("alice", "pw"))
        .isInstanceOf(UpstreamLoginResult.Malformed.class);
  }

  @Test
  void loginWithoutResponseCodeIsMalformed() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(LOGIN_URL))
        .andRespond(
            withSuccess(
                "{\"session\":\"s\",\"user\":{\"_id\":\"user-1\"}}",
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.login("alice", "pw"))
        .isInstanceOf(UpstreamLoginResult.Malformed.class);
  }

  @Test
  void loginMapsTimeoutToUnreachable() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(LOGIN_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    final UpstreamLoginResult result = fixture.client.login("alice", "pw");

    assertThat(result).isInstanceOf(UpstreamLoginResult.Unreachable.class);
    assertThat(((UpstreamLoginResult.Unreachable) result).timeout()).isTrue();
  }

  @Test
  void fetchDepotAccountSendsSessionHeaderAndReturnsPayload() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(DEPOT_URL))
        .andExpect(method(GET))
        .andExpect(header("session", "sess-1"))
        .andRespond(
            withSuccess("{\"balance\":1200.5,\"currency\":\"EUR\"}", MediaType.APPLICATION_JSON));

    final UpstreamCallResult result = fixture.client.fetchDepotAccount("sess-1", "depot-1");

    assertThat(result).isInstanceOf(UpstreamCallResult.Success.class);
    assertThat(((UpstreamCallResult.Success) result).payload().path("currency").asText())
        .isEqualTo("EUR");
    fixture.server.verify();
  }

  @Test
  void fetchDepotAccountMaps401And403ToUnauthorized() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(DEPOT_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));
    fixture.server.expect(requestTo(DEPOT_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertThat(fixture.client.fetchDepotAccount("stale", "depot-1"))
        .isEqualTo(new UpstreamCallResult.Unauthorized(401));
    assertThat(fixture.client.fetchDepotAccount("stale", "depot-1"))
        .isEqualTo(new UpstreamCallResult.Unauthorized(403));
  }

  @Test
  void fetchDepotAccountMaps5xxToTransientError() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(DEPOT_URL)).andRespond(withServerError());

    final UpstreamCallResult result = fixture.client.fetchDepotAccount("sess-1", "depot-1");

    assertThat(result).isInstanceOf(UpstreamCallResult.TransientError.class);
    assertThat(((UpstreamCallResult.TransientError) result).httpStatus()).isEqualTo(500);
  }

  @Test
  void fetchDepotAccountMapsConnectionFailureToTransientError() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(DEPOT_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    final UpstreamCallResult result = fixture.client.fetchDepotAccount("sess-1", "depot-1");

    assertThat(result)
        .isEqualTo(new UpstreamCallResult.TransientError(0, "upstream connection failed", false));
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://upstream.test").build();
    final UpstreamClientProperties properties =
        new UpstreamClientProperties(
            "http://upstream.test", null, null, null, null, null, null, null);
    return new ClientFixture(new DepotApiClient(restClient, properties), server);
  }

  private record ClientFixture(DepotApiClient client, MockRestServiceServer server) {}
}
