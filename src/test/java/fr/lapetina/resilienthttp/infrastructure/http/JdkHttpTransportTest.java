package fr.lapetina.resilienthttp.infrastructure.http;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.resilienthttp.domain.body.EntityBody;
import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import fr.lapetina.resilienthttp.domain.model.TransferResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdkHttpTransportTest {

    private HttpServer server;
    private JdkHttpTransport transport;
    private final AtomicReference<String> receivedEncoding = new AtomicReference<>();
    private final AtomicReference<String> receivedMethod = new AtomicReference<>();
    private final AtomicReference<byte[]> receivedBody = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/echo", exchange -> {
            receivedMethod.set(exchange.getRequestMethod());
            receivedEncoding.set(exchange.getRequestHeaders().getFirst("Content-Encoding"));
            try (InputStream in = exchange.getRequestBody()) {
                receivedBody.set(in.readAllBytes());
            }
            byte[] reply = "accepted".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(201, reply.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply);
            }
        });
        server.createContext("/unavailable", exchange -> {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.createContext("/gzip", exchange -> {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
                gzip.write("compressed reply".getBytes(StandardCharsets.UTF_8));
            }
            byte[] reply = buffer.toByteArray();
            exchange.getResponseHeaders().add("Content-Encoding", "gzip");
            exchange.sendResponseHeaders(200, reply.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply);
            }
        });
        server.start();
        transport = new JdkHttpTransport(Duration.ofSeconds(2), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    @Test
    @DisplayName("should send the body with its content encoding")
    void shouldSendCompressedBody() throws Exception {
        EntityBody body = EntityBody.factory("payload ".repeat(64));
        assertThat(body.compress()).isTrue();
        TransferRequest request = TransferRequest.builder()
                .method("POST")
                .uri(url("/echo"))
                .body(body)
                .build();

        TransferResponse response = transport.send(request);

        assertThat(response.statusCode()).isEqualTo(201);
        assertThat(new String(response.body().getBytes(), StandardCharsets.UTF_8)).isEqualTo("accepted");
        assertThat(receivedMethod.get()).isEqualTo("POST");
        assertThat(receivedEncoding.get()).isEqualTo("gzip");
        assertThat(receivedBody.get()).isEqualTo(body.getBytes());
    }

    @Test
    @DisplayName("should return failure statuses as responses")
    void shouldReturnFailureStatus() throws Exception {
        TransferRequest request = TransferRequest.builder().uri(url("/unavailable")).build();

        TransferResponse response = transport.send(request);

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(response.isServerError()).isTrue();
        assertThat(response.body().getContentLength()).isZero();
    }

    @Test
    @DisplayName("should send asynchronously")
    void shouldSendAsync() throws Exception {
        TransferRequest request = TransferRequest.builder()
                .method("PUT")
                .uri(url("/echo"))
                .body("async body")
                .build();

        TransferResponse response = transport.sendAsync(request).get(5, TimeUnit.SECONDS);

        assertThat(response.statusCode()).isEqualTo(201);
        assertThat(new String(receivedBody.get(), StandardCharsets.UTF_8)).isEqualTo("async body");
        assertThat(receivedEncoding.get()).isNull();
    }

    @Test
    @DisplayName("should mark a gzip response body without decoding it")
    void shouldMarkGzipResponse() throws Exception {
        TransferRequest request = TransferRequest.builder().uri(url("/gzip")).build();

        TransferResponse response = transport.send(request);

        assertThat(response.header("content-encoding")).contains("gzip");
        assertThat(response.body().getContentEncoding()).contains("gzip");
        assertThat(response.body().uncompress()).isTrue();
        assertThat(new String(response.body().getBytes(), StandardCharsets.UTF_8)).isEqualTo("compressed reply");
    }

    @Test
    @DisplayName("should throw when the server is gone")
    void shouldThrowWhenServerStopped() {
        String target = url("/echo");
        server.stop(0);
        server = null;
        TransferRequest request = TransferRequest.builder().uri(target).build();

        assertThatThrownBy(() -> transport.send(request)).isInstanceOf(IOException.class);
    }
}
