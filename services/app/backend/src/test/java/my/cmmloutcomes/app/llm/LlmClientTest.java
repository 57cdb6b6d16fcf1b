package my.cmmloutcomes.app.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmClientTest {
	@Test
	void noopClientReportsDisabled() {
		NoopLlmClient client = new NoopLlmClient();

		assertThatThrownBy(() -> client.runJsonPrompt("prompt", 100))
				.isInstanceOf(LlmRequestException.class)
				.hasMessageContaining("disabled");
	}

	@Test
	void openAiClientSendsJsonModeRequestAndReturnsContent() throws IOException {
		ObjectMapper mapper = new ObjectMapper();
		AtomicReference<Map<String, Object>> captured = new AtomicReference<>();
		AtomicReference<String> authorization = new AtomicReference<>();
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/chat/completions", exchange -> {
			authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
			captured.set(mapper.readValue(exchange.getRequestBody().readAllBytes(), Map.class));
			respond(exchange, 200, """
					{"model": "gpt-test-2024", "choices": [{"message": {"role": "assistant", "content": "{\\"has_evidence\\": true}"}}]}
					""");
		});
		server.start();
		int port = server.getAddress().getPort();

		try {
			OpenAiLlmClient client = new OpenAiLlmClient("http://localhost:" + port, "test-key", "gpt-test");
			LlmResponse response = client.runJsonPrompt("extract", 2048);

			assertThat(response.output()).isEqualTo("{\"has_evidence\": true}");
			assertThat(response.model()).isEqualTo("gpt-test-2024");
			assertThat(authorization.get()).isEqualTo("Bearer test-key");
			assertThat(captured.get())
					.containsEntry("model", "gpt-test")
					.containsEntry("max_tokens", 2048)
					.containsEntry("temperature", 0.1)
					.containsEntry("response_format", Map.of("type", "json_object"));
		} finally {
			server.stop(0);
		}
	}

	@Test
	void openAiClientReturnsEmptyOutputWhenNoChoices() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/chat/completions", exchange -> respond(exchange, 200, "{\"choices\": []}"));
		server.start();
		int port = server.getAddress().getPort();

		try {
			OpenAiLlmClient client = new OpenAiLlmClient("http://localhost:" + port, "test-key", "gpt-test");
			LlmResponse response = client.runJsonPrompt("extract", 100);

			assertThat(response.output()).isEmpty();
			assertThat(response.model()).isEqualTo("gpt-test");
		} finally {
			server.stop(0);
		}
	}

	@Test
	void openAiClientMapsRateLimitToQuotaError() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/chat/completions", exchange -> respond(exchange, 429,
				"{\"error\": {\"message\": \"Rate limit reached\"}}"));
		server.start();
		int port = server.getAddress().getPort();

		try {
			OpenAiLlmClient client = new OpenAiLlmClient("http://localhost:" + port, "test-key", "gpt-test");

			assertThatThrownBy(() -> client.runJsonPrompt("extract", 100))
					.isInstanceOfSatisfying(LlmRequestException.class, ex -> {
						assertThat(ex.getStatusCode()).isEqualTo(429);
						assertThat(ex.isRetryable()).isTrue();
						assertThat(ex.isQuotaExceeded()).isTrue();
					});
		} finally {
			server.stop(0);
		}
	}

	@Test
	void openAiClientMapsForbiddenToAuthFailure() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/chat/completions", exchange -> respond(exchange, 403,
				"{\"error\": {\"message\": \"Permission denied for this project\"}}"));
		server.start();
		int port = server.getAddress().getPort();

		try {
			OpenAiLlmClient client = new OpenAiLlmClient("http://localhost:" + port, "bad-key", "gpt-test");

			assertThatThrownBy(() -> client.runJsonPrompt("extract", 100))
					.isInstanceOfSatisfying(LlmRequestException.class, ex -> {
						assertThat(ex.isRetryable()).isFalse();
						assertThat(ex.isAuthenticationFailure()).isTrue();
						assertThat(ex.isQuotaExceeded()).isFalse();
					});
		} finally {
			server.stop(0);
		}
	}

	private static void respond(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().add("Content-Type", "application/json");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream os = exchange.getResponseBody()) {
			os.write(bytes);
		}
	}
}
