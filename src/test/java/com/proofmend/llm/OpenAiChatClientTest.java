package com.proofmend.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiChatClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> requests = new ArrayList<>();

    private OpenAiChatClient clientReturning(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new OpenAiChatClient(builder, objectMapper, "https://api.example.test/v1",
                "sk-test", "gpt-5", "gpt-4o-mini", Duration.ofSeconds(5));
    }

    @Test
    void testExtractsMessageContent() {
        OpenAiChatClient client = clientReturning(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"theorem t : True := trivial\"}}]}");

        String content = client.generateWithRole(OracleRole.REPAIR, "fix it");

        assertEquals("theorem t : True := trivial", content);
        ClientRequest request = requests.get(0);
        assertEquals("https://api.example.test/v1/chat/completions", request.url().toString());
        assertEquals("Bearer sk-test", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testMissingContentGivesEmptyString() {
        OpenAiChatClient client = clientReturning(HttpStatus.OK, "{\"choices\":[]}");

        assertEquals("", client.generateWithRole(OracleRole.EXTEND, "extend"));
    }

    @Test
    void testHttpErrorBecomesOracleException() {
        OpenAiChatClient client = clientReturning(HttpStatus.UNAUTHORIZED, "{\"error\":{\"message\":\"bad key\"}}");

        OracleException e = assertThrows(OracleException.class,
                () -> client.generateWithRole(OracleRole.REPAIR, "fix it"));
        assertTrue(e.getMessage().contains("401"));
    }

    @Test
    void testMalformedBodyBecomesOracleException() {
        OpenAiChatClient client = clientReturning(HttpStatus.OK, "not json");

        assertThrows(OracleException.class, () -> client.generateWithRole(OracleRole.DOCUMENT, "doc"));
    }

    @Test
    void testRequestBodyShape() throws Exception {
        JsonNode body = objectMapper.readTree(buildBody(OracleRole.PATCH));

        assertEquals("gpt-4o-mini", body.path("model").asText());
        assertEquals(0, body.path("temperature").asInt());
        assertEquals("system", body.path("messages").path(0).path("role").asText());
        assertEquals("user", body.path("messages").path(1).path("role").asText());

        JsonNode repairBody = objectMapper.readTree(buildBody(OracleRole.REPAIR));
        assertEquals("gpt-5", repairBody.path("model").asText());
        assertTrue(repairBody.path("temperature").isMissingNode());
    }

    private String buildBody(OracleRole role) {
        StringBuilder captured = new StringBuilder();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            MockClientHttpRequest sent = new MockClientHttpRequest(request.method(), request.url());
            return request.body().insert(sent, insertContext())
                    .then(Mono.defer(sent::getBodyAsString))
                    .map(body -> {
                        captured.append(body);
                        return ClientResponse.create(HttpStatus.OK)
                                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                                .body("{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}")
                                .build();
                    });
        });
        new OpenAiChatClient(builder, objectMapper, "https://api.example.test/v1",
                "sk-test", "gpt-5", "gpt-4o-mini", Duration.ofSeconds(5))
                .generateWithRole(role, "prompt");
        return captured.toString();
    }

    private static BodyInserter.Context insertContext() {
        return new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return new HashMap<>();
            }
        };
    }
}
