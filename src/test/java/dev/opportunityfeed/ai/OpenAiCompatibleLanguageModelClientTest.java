package dev.opportunityfeed.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opportunityfeed.config.ClassificationConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiCompatibleLanguageModelClientTest {

    private MockWebServer mockWebServer;
    private ClassificationConfig config;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        config = new ClassificationConfig();
        config.setProvider("openai");
        String url = mockWebServer.url("/v1").toString();
        config.setBaseUrl(url);
        config.setModel("llama-3.1-8b-instant");
        config.setApiKey("test-key");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    @DisplayName("Should post a chat completion with bearer auth and return the content")
    void shouldReturnCompletionContent() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setBody("""
                        {
                          "id": "chatcmpl-1",
                          "choices": [{
                            "index": 0,
                            "message": {"role": "assistant", "content": "{\\"is_opportunity\\": false}"}
                          }]
                        }
                        """)
                .addHeader("Content-Type", "application/json"));

        OpenAiCompatibleLanguageModelClient client = new OpenAiCompatibleLanguageModelClient(WebClient.builder(), config);

        StepVerifier.create(client.generate("Is this an opportunity?"))
                .expectNext("{\"is_opportunity\": false}")
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-key");

        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("llama-3.1-8b-instant");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(256);
        assertThat(body.path("messages").get(0).path("content").asText()).isEqualTo("Is this an opportunity?");
    }

    @Test
    @DisplayName("Should fail on an empty choice list")
    void shouldFailOnEmptyChoices() {
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"choices\": []}")
                .addHeader("Content-Type", "application/json"));

        OpenAiCompatibleLanguageModelClient client = new OpenAiCompatibleLanguageModelClient(WebClient.builder(), config);

        StepVerifier.create(client.generate("prompt"))
                .expectError(ClassifierException.class)
                .verify();
    }

    @Test
    @DisplayName("Should omit the authorization header without a key")
    void shouldOmitAuthWithoutKey() throws Exception {
        config.setApiKey("");
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"choices\": [{\"message\": {\"content\": \"ok\"}}]}")
                .addHeader("Content-Type", "application/json"));

        OpenAiCompatibleLanguageModelClient client = new OpenAiCompatibleLanguageModelClient(WebClient.builder(), config);

        StepVerifier.create(client.generate("prompt"))
                .expectNext("ok")
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getHeader("Authorization")).isNull();
    }
}
