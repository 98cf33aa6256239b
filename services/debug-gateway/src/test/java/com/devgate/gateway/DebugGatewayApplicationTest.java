package com.devgate.gateway;

import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.devgate.gateway.config.GatewayProperties;
import com.devgate.security.AuthSettingsLoader;
import com.devgate.security.TokenValidator;
import com.devgate.security.testing.TestTokenFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Boots the whole gateway against a stand-in identity provider and drives it through MockMvc.
 *
 * <p>The provider is started before the context because the token validator fetches its
 * metadata while the context starts.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Debug Gateway Application")
class DebugGatewayApplicationTest {

    private static final String TENANT = TestTokenFactory.DEFAULT_TENANT;
    private static final TestTokenFactory SIGNER = new TestTokenFactory("integration-key");
    private static final WireMockServer IDP = new WireMockServer(wireMockConfig().dynamicPort());

    static {
        IDP.start();
        String jwksPath = "/" + TENANT + "/discovery/v2.0/keys";
        IDP.stubFor(WireMock.get("/" + TENANT + "/v2.0/.well-known/openid-configuration")
                .willReturn(WireMock.okJson(TestTokenFactory.openIdConfiguration(
                        TestTokenFactory.issuerFor(TENANT), IDP.baseUrl() + jwksPath))));
        IDP.stubFor(WireMock.get(jwksPath).willReturn(WireMock.okJson(TestTokenFactory.jwks(SIGNER))));
    }

    @DynamicPropertySource
    static void identityProvider(DynamicPropertyRegistry registry) {
        registry.add(AuthSettingsLoader.TENANT_ID, () -> TENANT);
        registry.add(AuthSettingsLoader.ALLOWED_AUDIENCES, () -> TestTokenFactory.DEFAULT_AUDIENCE);
        registry.add(AuthSettingsLoader.AUTHORITY_HOST, IDP::baseUrl);
    }

    @AfterAll
    static void stopIdentityProvider() {
        IDP.stop();
    }

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    private static String bearer() {
        return "Bearer " + SIGNER.token(Instant.now());
    }

    @Test
    @DisplayName("context loads with a ready validator and test-profile properties")
    void contextLoads() {
        assertThat(context.getBean(TokenValidator.class).state()).isEqualTo(TokenValidator.State.READY);
        var props = context.getBean(GatewayProperties.class);
        assertThat(props.name()).isEqualTo("debug-gateway-test");
        assertThat(props.environment()).isEqualTo("test");
    }

    @Nested
    @DisplayName("Anonymous routes")
    class AnonymousRoutes {

        @Test
        @DisplayName("health answers without a token")
        void health() throws Exception {
            mockMvc.perform(get("/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("healthy"))
                    .andExpect(jsonPath("$.entities_count").value(1))
                    .andExpect(jsonPath("$.framework").value("devgate"))
                    .andExpect(header().exists("X-Correlation-ID"));
        }

        @Test
        @DisplayName("actuator health is available")
        void actuatorHealth() throws Exception {
            mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
        }

        @Test
        @DisplayName("pre-flight to a protected route is not challenged")
        void preflight() throws Exception {
            mockMvc.perform(options("/v1/entities")
                            .header(HttpHeaders.ORIGIN, "http://localhost:5173")
                            .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
                    .andExpect(result -> assertThat(result.getResponse().getStatus()).isNotEqualTo(401));
        }
    }

    @Nested
    @DisplayName("Authentication")
    class Authentication {

        @Test
        @DisplayName("protected route without a token is a 401")
        void missingToken() throws Exception {
            mockMvc.perform(get("/v1/entities").header("X-Correlation-ID", "corr-401"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().exists(HttpHeaders.WWW_AUTHENTICATE))
                    .andExpect(jsonPath("$.error").value("missing_authorization"))
                    .andExpect(jsonPath("$.correlationId").value("corr-401"));
        }

        @Test
        @DisplayName("path parameters or percent-encoding do not get past the token check")
        void alternateSpellingsOfProtectedRoutes() throws Exception {
            mockMvc.perform(get(URI.create("/v1;x=1/entities")))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("missing_authorization"));
            mockMvc.perform(get(URI.create("/%76%31/entities")))
                    .andExpect(status().isUnauthorized());
            mockMvc.perform(delete(URI.create("/v1;x/entities/echo_agent")))
                    .andExpect(status().isUnauthorized());

            mockMvc.perform(get("/v1/entities").header(HttpHeaders.AUTHORIZATION, bearer()))
                    .andExpect(jsonPath("$.entities[0].id").value("echo_agent"));
        }

        @Test
        @DisplayName("token for another audience is a 401")
        void wrongAudience() throws Exception {
            String token = SIGNER.token(Instant.now(), claims -> claims.put("aud", "api://someone-else"));

            mockMvc.perform(get("/v1/entities").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("invalid_audience"));
        }

        @Test
        @DisplayName("token from another tenant is a 403")
        void wrongTenant() throws Exception {
            String token = SIGNER.token(Instant.now(), claims -> claims.put("tid", "other-tenant"));

            mockMvc.perform(get("/v1/entities").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.error").value("tenant_mismatch"));
        }

        @Test
        @DisplayName("valid token lists entities")
        void listsEntities() throws Exception {
            mockMvc.perform(get("/v1/entities").header(HttpHeaders.AUTHORIZATION, bearer()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.entities[0].id").value("echo_agent"))
                    .andExpect(jsonPath("$.entities[0].tools[0]").value("whoami"));
        }
    }

    @Nested
    @DisplayName("Responses")
    class Responses {

        @Test
        @DisplayName("synchronous execution sees the caller")
        void synchronousExecution() throws Exception {
            MvcResult result = mockMvc.perform(post("/v1/responses")
                            .header(HttpHeaders.AUTHORIZATION, bearer())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"model\":\"echo_agent\",\"input\":\"ping pong\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.object").value("response"))
                    .andExpect(jsonPath("$.status").value("completed"))
                    .andExpect(jsonPath("$.output_text").value("Hello test.user@example.com. ping pong"))
                    .andReturn();

            JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
            JsonNode whoami = objectMapper.readTree(body.at("/tool_calls/0/output").asText());
            assertThat(whoami.get("authenticated").asBoolean()).isTrue();
            assertThat(whoami.get("user").asText()).isEqualTo("test.user@example.com");
            assertThat(whoami.get("tenant_id").asText()).isEqualTo(TENANT);
        }

        @Test
        @DisplayName("streaming execution frames events and sees the caller on the async thread")
        void streamingExecution() throws Exception {
            MvcResult started = mockMvc.perform(post("/v1/responses")
                            .header(HttpHeaders.AUTHORIZATION, bearer())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"model\":\"ignored\",\"extra_body\":{\"entity_id\":\"echo_agent\"},"
                                    + "\"input\":\"hi\",\"stream\":true}"))
                    .andExpect(request().asyncStarted())
                    .andReturn();

            mockMvc.perform(asyncDispatch(started))
                    .andExpect(status().isOk())
                    .andExpect(header().string(HttpHeaders.CACHE_CONTROL, "no-cache"));

            String body = started.getResponse().getContentAsString(StandardCharsets.UTF_8);
            List<String> frames = Arrays.stream(body.split("\n\n")).filter(f -> !f.isBlank()).toList();
            assertThat(frames).allSatisfy(frame -> assertThat(frame).startsWith("data: "));
            assertThat(frames.get(frames.size() - 1)).isEqualTo("data: [DONE]");

            JsonNode completed = objectMapper.readTree(frames.get(frames.size() - 2).substring(6));
            assertThat(completed.get("type").asText()).isEqualTo("response.completed");
            assertThat(completed.get("sequence_number").asInt()).isEqualTo(frames.size() - 2);
            assertThat(completed.at("/response/output_text").asText()).isEqualTo("Hello test.user@example.com. hi");
            JsonNode whoami = objectMapper.readTree(completed.at("/response/tool_calls/0/output").asText());
            assertThat(whoami.get("authenticated").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("missing entity id is a 400 in OpenAI error shape")
        void missingEntity() throws Exception {
            mockMvc.perform(post("/v1/responses")
                            .header(HttpHeaders.AUTHORIZATION, bearer())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"input\":\"hi\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.type").value("invalid_request_error"));
        }

        @Test
        @DisplayName("unknown entity is a 404")
        void unknownEntity() throws Exception {
            mockMvc.perform(post("/v1/responses")
                            .header(HttpHeaders.AUTHORIZATION, bearer())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"model\":\"nope\",\"input\":\"hi\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.message").value("Entity not found: nope"));
        }
    }

    @Nested
    @DisplayName("Conversations")
    class Conversations {

        @Test
        @DisplayName("create, add items, page and delete")
        void lifecycle() throws Exception {
            MvcResult created = mockMvc.perform(post("/v1/conversations")
                            .header(HttpHeaders.AUTHORIZATION, bearer())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"metadata\":{\"agent_id\":\"echo_agent\"}}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.object").value("conversation"))
                    .andReturn();
            String id = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asText();

            mockMvc.perform(post("/v1/conversations/" + id + "/items")
                            .header(HttpHeaders.AUTHORIZATION, bearer())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"items\":[{\"role\":\"user\",\"content\":\"a\"},"
                                    + "{\"role\":\"user\",\"content\":\"b\"}]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.length()").value(2));

            mockMvc.perform(get("/v1/conversations/" + id + "/items?limit=1")
                            .header(HttpHeaders.AUTHORIZATION, bearer()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.length()").value(1))
                    .andExpect(jsonPath("$.has_more").value(true));

            mockMvc.perform(get("/v1/conversations?agent_id=echo_agent").header(HttpHeaders.AUTHORIZATION, bearer()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[?(@.id == '" + id + "')]").exists());

            mockMvc.perform(delete("/v1/conversations/" + id).header(HttpHeaders.AUTHORIZATION, bearer()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.deleted").value(true));

            mockMvc.perform(get("/v1/conversations/" + id).header(HttpHeaders.AUTHORIZATION, bearer()))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("invalid paging parameters are a 400 carrying the validation message")
        void invalidPaging() throws Exception {
            mockMvc.perform(get("/v1/conversations/conv_missing/items?limit=0")
                            .header(HttpHeaders.AUTHORIZATION, bearer()))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("limit must be at least 1"));

            mockMvc.perform(get("/v1/conversations/conv_missing/items?order=sideways")
                            .header(HttpHeaders.AUTHORIZATION, bearer()))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("order must be 'asc' or 'desc'"));
        }
    }
}
