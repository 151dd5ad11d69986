package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Simple HTTP client wrapper for GitHub API calls using Java 11+ HttpClient.
 *
 * <p>
 * Attaches the static credential to every request and extracts the rate limit headers
 * from every response, successful or not. Non-2xx statuses are returned, not thrown; only
 * network-level failures raise {@link GitHubApiException}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	public static final String GITHUB_API_BASE = "https://api.github.com";

	private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	private final String token;

	private final String apiBase;

	private final Duration requestTimeout;

	public GitHubHttpClient(String token) {
		this(token, GITHUB_API_BASE, Duration.ofSeconds(30));
	}

	public GitHubHttpClient(String token, String apiBase, Duration requestTimeout) {
		this.token = token;
		this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(CONNECT_TIMEOUT)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public GitHubResponse getWithQuery(String path, String queryString) {
		String url = apiBase + path;
		if (!queryString.isEmpty()) {
			url += "?" + queryString;
		}
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Authorization", "token " + token)
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", "github-harvester")
			.GET()
			.build();

		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			RateLimitInfo rateLimit = extractRateLimit(response);
			logger.debug("GET {} completed in {}ms with status {} ({} bytes, {}/{} remaining)", url,
					System.currentTimeMillis() - start, response.statusCode(), response.body().length(),
					rateLimit.remaining(), rateLimit.limit());
			return new GitHubResponse(url, response.statusCode(), response.body(), rateLimit);
		}
		catch (IOException e) {
			logger.error("Error making request to {}: {}", url, e.toString());
			throw new GitHubApiException("HTTP request to " + url + " failed: " + e, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request to " + url + " interrupted", e);
		}
	}

	private static RateLimitInfo extractRateLimit(HttpResponse<?> response) {
		int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
		int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
		long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
		int used = parseIntHeader(response, "X-RateLimit-Used", -1);
		return new RateLimitInfo(limit, remaining, reset, used);
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
