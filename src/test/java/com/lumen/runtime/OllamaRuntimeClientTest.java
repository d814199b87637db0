package com.lumen.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.config.JacksonConfiguration;
import com.lumen.config.LumenProperties;
import com.lumen.exception.GatewayTimeoutException;
import com.lumen.exception.RuntimeFaultException;
import com.lumen.model.GenerateOptions;
import com.lumen.model.HealthStatus;
import com.lumen.model.RuntimeHealth;
import com.lumen.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OllamaRuntimeClient against a stubbed exchange function.
 */
class OllamaRuntimeClientTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private LumenProperties properties;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        properties = new LumenProperties();
        properties.getRuntime().setTimeout(Duration.ofMillis(200));
        objectMapper = JacksonConfiguration.configure(new ObjectMapper());
    }

    private OllamaRuntimeClient client(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        WebClient webClient = WebClient.builder()
                .baseUrl("http://runtime.test")
                .exchangeFunction(recording)
                .build();
        return new OllamaRuntimeClient(webClient, properties, new RuntimeRequestFactory(properties),
                objectMapper, MutableClock.startingAt("2024-05-01T10:00:00Z"));
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    private static DataBuffer buffer(String text) {
        return DefaultDataBufferFactory.sharedInstance.wrap(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testGenerateMapsResponse() {
        OllamaRuntimeClient client = client(request -> json(HttpStatus.OK,
                "{\"model\":\"llama3:8b\",\"response\":\"Paris\",\"done\":true,"
                        + "\"prompt_eval_count\":12,\"eval_count\":3,\"unknown_field\":1}"));

        StepVerifier.create(client.generate("Capital of France?", GenerateOptions.defaults()))
                .assertNext(result -> {
                    assertEquals("Paris", result.getContent());
                    assertEquals("llama3:8b", result.getModel());
                    assertEquals(15, result.getTokenUsage().getTotalTokens());
                })
                .verifyComplete();

        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("/api/generate", requests.get(0).url().getPath());
    }

    @Test
    void testErrorStatusBecomesRuntimeFault() {
        OllamaRuntimeClient client = client(request -> json(HttpStatus.NOT_FOUND, "{\"error\":\"model not found\"}"));

        StepVerifier.create(client.generate("hi", GenerateOptions.builder().model("missing").build()))
                .expectErrorSatisfies(error -> {
                    RuntimeFaultException fault = assertInstanceOf(RuntimeFaultException.class, error);
                    assertEquals(404, fault.getRuntimeStatus());
                    assertTrue(fault.getMessage().contains("model not found"));
                })
                .verify();
    }

    @Test
    void testDeadlineBecomesTimeout() {
        OllamaRuntimeClient client = client(request -> Mono.never());

        StepVerifier.create(client.generate("hi", GenerateOptions.defaults()))
                .expectErrorSatisfies(error -> {
                    GatewayTimeoutException timeout = assertInstanceOf(GatewayTimeoutException.class, error);
                    assertEquals("runtime_timeout", timeout.getCode());
                    assertEquals(Duration.ofMillis(200), timeout.getDeadline());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testConnectionFailureIsFaultNotTimeout() {
        OllamaRuntimeClient client = client(request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), HttpMethod.POST,
                URI.create("http://runtime.test/api/generate"), new HttpHeaders())));

        StepVerifier.create(client.generate("hi", GenerateOptions.defaults()))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(RuntimeFaultException.class, error);
                    assertTrue(error.getMessage().contains("unreachable"));
                })
                .verify();
    }

    @Test
    void testStreamDecodesFragmentsAcrossBuffers() {
        OllamaRuntimeClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_NDJSON_VALUE)
                .body(Flux.just(
                        buffer("{\"response\":\"The \"}\n{\"respo"),
                        buffer("nse\":\"sky\"}\n{\"response\":\"\"}\n"),
                        buffer("{\"response\":\" is blue\",\"done\":true}\n{\"response\":\"ignored\"}\n")))
                .build()));

        StepVerifier.create(client.generateStream("Why?", GenerateOptions.defaults()))
                .expectNext("The ", "sky", " is blue")
                .verifyComplete();
    }

    @Test
    void testProbeCollectsModelsAndResourceStats() {
        OllamaRuntimeClient client = client(request -> {
            if (request.url().getPath().equals("/api/tags")) {
                return json(HttpStatus.OK, "{\"models\":[{\"name\":\"llama3:8b\",\"size\":4000},"
                        + "{\"name\":\"mistral:7b\",\"size\":3000}]}");
            }
            return json(HttpStatus.OK, "{\"models\":[{\"name\":\"llama3:8b\",\"size\":4000,\"size_vram\":2500}]}");
        });

        RuntimeHealth health = client.probe().block();

        assertNotNull(health);
        assertEquals(HealthStatus.HEALTHY, health.getStatus());
        assertEquals(2, health.getModels().size());
        assertEquals("llama3:8b", health.getModels().get(0).getName());
        assertEquals(1, health.getResourceStats().get("runningModels"));
        assertEquals(2500L, health.getResourceStats().get("vramBytes"));
    }

    @Test
    void testTranslatePassesGatewayErrorsThrough() {
        OllamaRuntimeClient client = client(request -> Mono.never());
        RuntimeFaultException fault = new RuntimeFaultException("already mapped");

        assertSame(fault, client.translate("generate", Duration.ofSeconds(1), fault));
        assertInstanceOf(RuntimeFaultException.class,
                client.translate("generate", Duration.ofSeconds(1), new IllegalStateException("other")));
    }
}
