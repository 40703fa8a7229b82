package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.model.FetchFailureType;
import com.plazaintel.comparisons.model.FetchedPayload;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpByteFetchClientTest {

    private static final byte[] CSV = "Año,Cve-mes\n2023,5\n".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private ExecutorService executor;
    private String baseUrl;
    private final HttpByteFetchClient client = new HttpByteFetchClient(Duration.ofSeconds(2));

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/files/2023-05.csv", exchange -> respond(exchange, 200, CSV));
        server.createContext("/share/2023-05", exchange -> {
            exchange.getResponseHeaders().add("Location", "/files/2023-05.csv");
            respond(exchange, 302, new byte[0]);
        });
        server.createContext("/missing.csv", exchange -> respond(exchange, 404, new byte[0]));
        server.createContext("/slow.csv", exchange -> {
            try {
                Thread.sleep(1_500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, CSV);
        });
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    @Test
    @DisplayName("a 200 response returns the body and content type")
    void downloadsBytes() {
        FetchedPayload payload = client.fetch("2023-05", baseUrl + "/files/2023-05.csv", Duration.ofSeconds(5));

        assertThat(payload.bytes()).isEqualTo(CSV);
        assertThat(payload.contentType()).isEqualTo("text/csv");
    }

    @Test
    @DisplayName("share links are followed through redirects")
    void followsRedirects() {
        FetchedPayload payload = client.fetch("2023-05", baseUrl + "/share/2023-05", Duration.ofSeconds(5));

        assertThat(payload.bytes()).isEqualTo(CSV);
    }

    @Test
    @DisplayName("a non-200 status becomes a retryable HTTP_ERROR carrying the code")
    void httpError() {
        assertThatThrownBy(() -> client.fetch("2023-05", baseUrl + "/missing.csv", Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(FetchFailedException.class, e -> {
                    assertThat(e.getFailure().type()).isEqualTo(FetchFailureType.HTTP_ERROR);
                    assertThat(e.getFailure().httpStatus()).isEqualTo(404);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    @DisplayName("no response within the timeout becomes TIMEOUT")
    void timeout() {
        assertThatThrownBy(() -> client.fetch("2023-05", baseUrl + "/slow.csv", Duration.ofMillis(200)))
                .isInstanceOfSatisfying(FetchFailedException.class,
                        e -> assertThat(e.getFailure().type()).isEqualTo(FetchFailureType.TIMEOUT));
    }

    @Test
    @DisplayName("a refused connection becomes NETWORK_ERROR")
    void connectionRefused() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = socket.getLocalPort();
        }
        String deadUrl = "http://127.0.0.1:" + closedPort + "/files/2023-05.csv";

        assertThatThrownBy(() -> client.fetch("2023-05", deadUrl, Duration.ofSeconds(2)))
                .isInstanceOfSatisfying(FetchFailedException.class, e -> {
                    assertThat(e.getFailure().type()).isEqualTo(FetchFailureType.NETWORK_ERROR);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    @DisplayName("relative paths and non-http schemes fail as NO_LOCATOR without a request")
    void unusableLocators() {
        for (String locator : new String[]{"files/2023-05.csv", "ftp://files.example/2023-05.csv",
                "file:///data/2023-05.csv", "http://", "not a uri"}) {
            assertThatThrownBy(() -> client.fetch("2023-05", locator, Duration.ofSeconds(1)))
                    .as(locator)
                    .isInstanceOfSatisfying(FetchFailedException.class, e -> {
                        assertThat(e.getFailure().type()).isEqualTo(FetchFailureType.NO_LOCATOR);
                        assertThat(e.isRetryable()).isFalse();
                    });
        }
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "text/csv");
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }
}
