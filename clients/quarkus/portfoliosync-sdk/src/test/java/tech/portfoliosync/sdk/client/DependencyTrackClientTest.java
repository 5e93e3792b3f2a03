package tech.portfoliosync.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.portfoliosync.sdk.dto.ListResult;
import tech.portfoliosync.sdk.dto.OidcGroup;
import tech.portfoliosync.sdk.dto.Project;
import tech.portfoliosync.sdk.exception.AuthenticationException;
import tech.portfoliosync.sdk.exception.DependencyTrackException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the read/write contract of DependencyTrackClient against a WireMock server.
 */
class DependencyTrackClientTest {

    private WireMockServer wireMockServer;
    private DependencyTrackClient client;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
        client = new DependencyTrackClient(ClientSettings.of(wireMockServer.baseUrl(), "test-key"));
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    @Test
    void shouldSendApiKeyHeaderOnEveryCall() {
        wireMockServer.stubFor(get(urlEqualTo("/api/v1/oidc/group"))
            .willReturn(okJson("[]")));
        wireMockServer.stubFor(put(urlEqualTo("/api/v1/oidc/group"))
            .willReturn(aResponse().withStatus(201)));

        client.request("GET", "/api/v1/oidc/group", null, new TypeReference<List<OidcGroup>>() {});
        client.mutate("PUT", "/api/v1/oidc/group", Map.of("name", "dev"), 201);

        wireMockServer.verify(getRequestedFor(urlEqualTo("/api/v1/oidc/group"))
            .withHeader("X-Api-Key", equalTo("test-key")));
        wireMockServer.verify(putRequestedFor(urlEqualTo("/api/v1/oidc/group"))
            .withHeader("X-Api-Key", equalTo("test-key"))
            .withRequestBody(equalToJson("{\"name\":\"dev\"}")));
    }

    @Test
    void shouldSendBearerTokenWhenHeaderIsAuthorization() {
        var settings = new ClientSettings(wireMockServer.baseUrl(), "jwt-token", "Authorization",
            Duration.ofSeconds(5), 50);
        var bearerClient = new DependencyTrackClient(settings);
        wireMockServer.stubFor(get(urlEqualTo("/api/v1/team")).willReturn(okJson("[]")));

        bearerClient.teams().list();

        wireMockServer.verify(getRequestedFor(urlEqualTo("/api/v1/team"))
            .withHeader("Authorization", equalTo("Bearer jwt-token")));
    }

    @Test
    void shouldStripTrailingSlashFromBaseUrl() {
        var slashed = new DependencyTrackClient(ClientSettings.of(wireMockServer.baseUrl() + "/", "test-key"));
        wireMockServer.stubFor(get(urlEqualTo("/api/v1/team")).willReturn(okJson("[]")));

        assertTrue(slashed.teams().list().items().isEmpty());
    }

    @Test
    void readShouldFailOnServerError() {
        wireMockServer.stubFor(get(urlEqualTo("/api/v1/team"))
            .willReturn(aResponse().withStatus(500).withBody("boom")));

        var e = assertThrows(DependencyTrackException.class, () -> client.teams().list());

        assertEquals(500, e.getStatusCode());
        assertEquals("GET", e.getMethod());
        assertEquals("/api/v1/team", e.getEndpoint());
        assertEquals("boom", e.getResponseBody());
    }

    @Test
    void readShouldFailWithAuthenticationExceptionOn401() {
        wireMockServer.stubFor(get(urlEqualTo("/api/v1/team"))
            .willReturn(aResponse().withStatus(401)));

        var e = assertThrows(AuthenticationException.class, () -> client.teams().list());
        assertEquals(401, e.getStatusCode());
        assertEquals("/api/v1/team", e.getEndpoint());
    }

    @Test
    void readShouldFailWithAuthenticationExceptionOn403() {
        wireMockServer.stubFor(get(urlEqualTo("/api/v1/oidc/group"))
            .willReturn(aResponse().withStatus(403)));

        assertThrows(AuthenticationException.class, () -> client.oidcGroups().list());
    }

    @Test
    void writeShouldReportChangeOnlyForExpectedStatus() {
        wireMockServer.stubFor(put(urlEqualTo("/created")).willReturn(aResponse().withStatus(201)));
        wireMockServer.stubFor(put(urlEqualTo("/conflict")).willReturn(aResponse().withStatus(409)));
        wireMockServer.stubFor(put(urlEqualTo("/ok")).willReturn(aResponse().withStatus(200)));

        assertTrue(client.mutate("PUT", "/created", null, 201));
        assertFalse(client.mutate("PUT", "/conflict", null, 201));
        assertFalse(client.mutate("PUT", "/ok", null, 201));
    }

    @Test
    void writeShouldNotThrowOnServerError() {
        wireMockServer.stubFor(delete(urlEqualTo("/api/v1/oidc/group/g-1"))
            .willReturn(aResponse().withStatus(500)));

        assertFalse(client.oidcGroups().delete("g-1"));
    }

    @Test
    void transportFailureShouldThrow() {
        var unreachable = new DependencyTrackClient(ClientSettings.of("http://localhost:1", "test-key"));

        var e = assertThrows(DependencyTrackException.class, () -> unreachable.oidcGroups().create("dev"));
        assertFalse(e.hasResponse());
        assertEquals("PUT", e.getMethod());
        assertNotNull(e.getCause());
    }

    @Test
    void requestPageShouldReadTotalCountHeader() {
        wireMockServer.stubFor(get(urlPathEqualTo("/api/v1/project"))
            .withQueryParam("pageNumber", equalTo("2"))
            .withQueryParam("pageSize", equalTo("100"))
            .willReturn(okJson("[{\"uuid\":\"p-1\",\"name\":\"A\"}]")
                .withHeader("X-Total-Count", "101")));

        ListResult<Project> page = client.requestPage("/api/v1/project?onlyRoot=true", 2,
            new TypeReference<List<Project>>() {});

        assertEquals(1, page.items().size());
        assertEquals(101, page.total());
        wireMockServer.verify(getRequestedFor(urlPathEqualTo("/api/v1/project"))
            .withQueryParam("onlyRoot", equalTo("true")));
    }

    @Test
    void requestPageShouldFallBackToItemCountWithoutHeader() {
        wireMockServer.stubFor(get(urlPathEqualTo("/api/v1/project"))
            .willReturn(okJson("[{\"uuid\":\"p-1\",\"name\":\"A\"},{\"uuid\":\"p-2\",\"name\":\"B\"}]")));

        var page = client.requestPage("/api/v1/project", 1, new TypeReference<List<Project>>() {});

        assertEquals(2, page.total());
        assertFalse(page.isIncomplete());
    }

    @Test
    void unreadableReadBodyShouldThrowWithStatus() {
        wireMockServer.stubFor(get(urlEqualTo("/api/v1/team"))
            .willReturn(okJson("{\"not\":\"a list\"}")));

        var e = assertThrows(DependencyTrackException.class, () -> client.teams().list());

        assertEquals(200, e.getStatusCode());
        assertTrue(e.hasResponse());
    }
}
