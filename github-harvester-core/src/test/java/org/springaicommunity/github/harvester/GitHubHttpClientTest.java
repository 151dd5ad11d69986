package org.springaicommunity.github.harvester;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests {@link GitHubHttpClient} against an in-process HTTP server on a loopback port.
 */
@DisplayName("GitHubHttpClient Tests")
class GitHubHttpClientTest {

	private HttpServer server;

	private final Map<String, String> received = new ConcurrentHashMap<>();

	private String baseUrl;

	private boolean stopped;

	@BeforeEach
	void setUp() throws Exception {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/search/repositories", exchange -> {
			received.put("authorization", exchange.getRequestHeaders().getFirst("Authorization"));
			received.put("accept", exchange.getRequestHeaders().getFirst("Accept"));
			received.put("query", exchange.getRequestURI().getRawQuery());
			byte[] body = "{\"total_count\":0,\"items\":[]}".getBytes(StandardCharsets.UTF_8);
			exchange.getResponseHeaders().add("X-RateLimit-Limit", "30");
			exchange.getResponseHeaders().add("X-RateLimit-Remaining", "3");
			exchange.getResponseHeaders().add("X-RateLimit-Reset", "1700000060");
			exchange.getResponseHeaders().add("X-RateLimit-Used", "27");
			exchange.sendResponseHeaders(200, body.length);
			try (OutputStream out = exchange.getResponseBody()) {
				out.write(body);
			}
		});
		server.createContext("/missing", exchange -> {
			byte[] body = "{\"message\":\"Not Found\"}".getBytes(StandardCharsets.UTF_8);
			exchange.sendResponseHeaders(404, body.length);
			try (OutputStream out = exchange.getResponseBody()) {
				out.write(body);
			}
		});
		server.start();
		baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
	}

	@AfterEach
	void tearDown() {
		if (!stopped) {
			server.stop(0);
		}
	}

	@Test
	@DisplayName("Should send the token and parse every rate limit header")
	void shouldSendTokenAndParseRateLimit() {
		GitHubHttpClient client = new GitHubHttpClient("test-token", baseUrl + "/", Duration.ofSeconds(5));

		GitHubResponse response = client.getWithQuery("/search/repositories", "q=is%3Apublic&page=1");

		assertThat(response.isSuccessful()).isTrue();
		assertThat(response.url()).isEqualTo(baseUrl + "/search/repositories?q=is%3Apublic&page=1");
		assertThat(response.body()).contains("\"items\":[]");
		assertThat(response.rateLimit()).isEqualTo(new RateLimitInfo(30, 3, 1_700_000_060L, 27));
		assertThat(received).containsEntry("authorization", "token test-token")
			.containsEntry("accept", "application/vnd.github.v3+json")
			.containsEntry("query", "q=is%3Apublic&page=1");
	}

	@Test
	@DisplayName("Should return error statuses instead of throwing")
	void shouldReturnErrorStatus() {
		GitHubHttpClient client = new GitHubHttpClient("test-token", baseUrl, Duration.ofSeconds(5));

		GitHubResponse response = client.getWithQuery("/missing", "");

		assertThat(response.statusCode()).isEqualTo(404);
		assertThat(response.isSuccessful()).isFalse();
		assertThat(response.rateLimit().hasRemaining()).isFalse();
		assertThat(response.rateLimit().hasReset()).isFalse();
	}

	@Test
	@DisplayName("Should raise GitHubApiException when the server is unreachable")
	void shouldRaiseOnConnectionFailure() {
		int port = server.getAddress().getPort();
		server.stop(0);
		stopped = true;
		GitHubHttpClient client = new GitHubHttpClient("test-token", "http://127.0.0.1:" + port,
				Duration.ofSeconds(5));

		assertThatThrownBy(() -> client.getWithQuery("/search/repositories", "q=x"))
			.isInstanceOf(GitHubApiException.class)
			.hasMessageContaining("failed")
			.hasMessageContaining("Exception")
			.hasMessageNotContaining(": null");
	}

}
