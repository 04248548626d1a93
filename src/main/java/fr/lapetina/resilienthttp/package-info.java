/**
 * Resilient HTTP - retrying HTTP client core with a codec-aware entity body.
 *
 * <p>Failed requests (by default status 500 or 503) are resent with truncated
 * exponential backoff. Requests sent on their own wait on the caller's thread;
 * requests sent through the LMAX Disruptor batch pool are retried through
 * deferred observers and never block the pool.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilienthttp.ResilientClientFactory} - Main entry point, wired from YAML configuration</li>
 *   <li>{@link fr.lapetina.resilienthttp.retry.ExponentialBackoffCoordinator} - Retry decisions</li>
 *   <li>{@link fr.lapetina.resilienthttp.disruptor.BatchPool} - Non-blocking batch dispatch</li>
 *   <li>{@link fr.lapetina.resilienthttp.domain.body.EntityBody} - Payload with compression and chunked framing</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ResilientClientFactory client = ResilientClientFactory.create("resilient-http.yaml").start()) {
 *     TransferRequest request = client.newRequest()
 *             .method("POST")
 *             .uri("http://localhost:8080/upload")
 *             .body("hello")
 *             .build();
 *     request.getBody().ifPresent(EntityBody::compress);
 *
 *     TransferResponse response = client.submit(request).get();
 *     System.out.println(response.statusCode());
 * }
 * }</pre>
 *
 * @see fr.lapetina.resilienthttp.ResilientClientFactory
 */
package fr.lapetina.resilienthttp;
