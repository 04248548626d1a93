package fr.lapetina.resilienthttp.infrastructure.http;

import fr.lapetina.resilienthttp.domain.body.CompressionFilters;
import fr.lapetina.resilienthttp.domain.body.EntityBody;
import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import fr.lapetina.resilienthttp.domain.model.TransferResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Transport backed by {@link java.net.http.HttpClient}.
 *
 * The entity body is sent as-is, with its {@code Content-Encoding} and
 * {@code Content-Type} unless the request sets them. A gzip response body is
 * marked with its encoding but left compressed.
 */
public final class JdkHttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    // Managed by HttpClient itself; setting them throws
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade"
    );

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkHttpTransport(Duration connectTimeout, Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    public JdkHttpTransport() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(30));
    }

    @Override
    public TransferResponse send(TransferRequest request) throws IOException, InterruptedException {
        HttpRequest httpRequest = buildHttpRequest(request);
        log.debug("Sending request: requestId={}, method={}, uri={}",
                request.getId(), request.getMethod(), request.getUri());
        HttpResponse<byte[]> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        return toTransferResponse(request, response);
    }

    @Override
    public CompletableFuture<TransferResponse> sendAsync(TransferRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request);
        } catch (RuntimeException e) {
            log.error("Failed to build request: requestId={}", request.getId(), e);
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Sending request asynchronously: requestId={}, method={}, uri={}",
                request.getId(), request.getMethod(), request.getUri());
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> toTransferResponse(request, response));
    }

    private HttpRequest buildHttpRequest(TransferRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.getUri())
                .timeout(requestTimeout);

        request.getHeaders().forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                builder.header(name, value);
            }
        });

        Optional<EntityBody> body = request.getBody();
        HttpRequest.BodyPublisher publisher = body
                .map(b -> HttpRequest.BodyPublishers.ofByteArray(b.getBytes()))
                .orElse(HttpRequest.BodyPublishers.noBody());

        body.ifPresent(b -> {
            if (!request.getHeaders().containsKey("Content-Type")) {
                builder.header("Content-Type", b.getContentType());
            }
            b.getContentEncoding().ifPresent(encoding -> {
                if (!request.getHeaders().containsKey("Content-Encoding")) {
                    builder.header("Content-Encoding", encoding);
                }
            });
        });

        return builder.method(request.getMethod(), publisher).build();
    }

    private TransferResponse toTransferResponse(TransferRequest request, HttpResponse<byte[]> response) {
        EntityBody body = EntityBody.factory(response.body());
        response.headers().firstValue("Content-Encoding")
                .filter(encoding -> encoding.equalsIgnoreCase("gzip"))
                .ifPresent(encoding -> body.setContentEncodingFromFilter(CompressionFilters.GZIP_ENCODE));

        log.debug("Response received: requestId={}, status={}, contentLength={}",
                request.getId(), response.statusCode(), body.getContentLength());
        return new TransferResponse(response.statusCode(), response.headers().map(), body);
    }
}
