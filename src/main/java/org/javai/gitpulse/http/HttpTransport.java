package org.javai.gitpulse.http;

import java.io.IOException;

/**
 * Sends one request and returns whatever the upstream answered, whatever the status.
 * Timeouts and connection problems surface as {@link IOException}s; classifying them
 * is the caller's job.
 */
@FunctionalInterface
public interface HttpTransport {

    ApiResponse send(ApiRequest request) throws IOException, InterruptedException;
}
