package com.notes.ingestion.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OllamaClientTest {

    @Nested
    @DisplayName("Unit Tests (no Ollama required)")
    class UnitTests {

        @Test
        @DisplayName("Provider name includes model")
        void providerNameIncludesModel() {
            OllamaClient client = OllamaClient.builder()
                    .baseUrl("http://localhost:11434")
                    .model("mistral")
                    .timeout(Duration.ofSeconds(30))
                    .build();

            assertEquals("Ollama/mistral", client.getProviderName());
        }

        @Test
        @DisplayName("createDefault uses llama3.2")
        void createDefault() {
            assertEquals("Ollama/llama3.2", OllamaClient.createDefault().getProviderName());
        }
    }

    @Nested
    @DisplayName("HTTP exchange")
    @ExtendWith(MockitoExtension.class)
    class HttpExchange {

        @Mock
        private HttpClient httpClient;

        @Mock
        private HttpResponse<String> response;

        private OllamaClient client;

        @BeforeEach
        void setUp() {
            client = OllamaClient.builder().baseUrl("http://ollama:11434").httpClient(httpClient).build();
        }

        @Test
        @DisplayName("Should return the response text and ask for JSON when requested")
        void generateJson() throws Exception {
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("{\"model\":\"llama3.2\",\"response\":\"{}\",\"done\":true}");
            doReturn(response).when(httpClient).send(any(), any());

            assertEquals("{}", client.generateJson("prompt"));

            ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(request.capture(), any());
            assertEquals("http://ollama:11434/api/generate", request.getValue().uri().toString());
            assertEquals("POST", request.getValue().method());
        }

        @Test
        @DisplayName("Non-200 status is an LLMException")
        void errorStatus() throws Exception {
            when(response.statusCode()).thenReturn(500);
            when(response.body()).thenReturn("model not found");
            doReturn(response).when(httpClient).send(any(), any());

            LLMException e = assertThrows(LLMException.class, () -> client.generate("prompt"));
            assertTrue(e.getMessage().contains("500"));
        }

        @Test
        @DisplayName("Transport failures are LLMExceptions")
        void transportFailure() throws Exception {
            doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

            assertThrows(LLMException.class, () -> client.generate("prompt"));
            assertFalse(client.isAvailable());
        }

        @Test
        @DisplayName("A response without text is an LLMException")
        void missingText() throws Exception {
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("{\"done\":true}");
            doReturn(response).when(httpClient).send(any(), any());

            assertThrows(LLMException.class, () -> client.generate("prompt"));
        }
    }
}
