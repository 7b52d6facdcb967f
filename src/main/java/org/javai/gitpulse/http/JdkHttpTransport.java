package org.javai.gitpulse.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * {@link HttpTransport} over {@link java.net.http.HttpClient}.
 *
 * <p>Every request carries {@code Accept: application/vnd.github.v3+json}, the configured
 * {@code User-Agent} and, when a token is present, {@code Authorization: token <token>}.
 * Each request has its own timeout; redirects are followed.
 */
public class JdkHttpTransport implements HttpTransport {

	static final String ACCEPT = "application/vnd.github.v3+json";

	private final String baseUrl;
	private final String token;
	private final String userAgent;
	private final Duration timeout;
	private final HttpClient httpClient;

	/**
	 * @param baseUrl API root, e.g. {@code https://api.github.com}
	 * @param token credential, or null to send anonymous requests
	 * @param userAgent value of the User-Agent header
	 * @param timeout connect and per-request timeout
	 */
	public JdkHttpTransport(String baseUrl, String token, String userAgent, Duration timeout) {
		this(baseUrl, token, userAgent, timeout, HttpClient.newBuilder()
				.connectTimeout(timeout)
				.followRedirects(HttpClient.Redirect.NORMAL)
				.build());
	}

	JdkHttpTransport(String baseUrl, String token, String userAgent, Duration timeout, HttpClient httpClient) {
		Objects.requireNonNull(baseUrl, "baseUrl must not be null");
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.token = token == null || token.isBlank() ? null : token;
		this.userAgent = Objects.requireNonNull(userAgent, "userAgent must not be null");
		this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
	}

	@Override
	public ApiResponse send(ApiRequest request) throws IOException, InterruptedException {
		HttpRequest.Builder builder = HttpRequest.newBuilder()
				.uri(uriFor(request))
				.timeout(timeout)
				.header("Accept", ACCEPT)
				.header("User-Agent", userAgent)
				.method(request.method(), HttpRequest.BodyPublishers.noBody());
		if (token != null) {
			builder.header("Authorization", "token " + token);
		}

		HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
		return new ApiResponse(response.statusCode(), response.headers().map(), response.body());
	}

	URI uriFor(ApiRequest request) {
		StringBuilder uri = new StringBuilder(baseUrl).append(request.path());
		if (!request.query().isEmpty()) {
			StringJoiner query = new StringJoiner("&");
			for (Map.Entry<String, String> param : request.query().entrySet()) {
				query.add(encode(param.getKey()) + "=" + encode(param.getValue()));
			}
			uri.append('?').append(query);
		}
		return URI.create(uri.toString());
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}
}
