package com.bulkload.zero;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.Gson;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@DisplayName("HttpZeroClient")
class HttpZeroClientTest {

  @Nested
  @DisplayName("Against a running zero")
  class LiveTests {

    private HttpServer server;
    private final AtomicLong next = new AtomicLong(10);
    private final AtomicInteger nullReplies = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
      server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
      server.createContext("/health", ex -> reply(ex, 200, "OK"));
      server.createContext("/assign", ex -> {
        if (nullReplies.getAndDecrement() > 0) {
          reply(ex, 200, "{\"startId\": null, \"endId\": null}");
          return;
        }
        String query = ex.getRequestURI().getQuery();
        long num = Long.parseLong(query.replaceAll(".*num=(\\d+).*", "$1"));
        long start = next.getAndAdd(num);
        reply(
          ex,
          200,
          "{\"startId\": \"" + start + "\", \"endId\": " + (start + num - 1) + "}"
        );
      });
      server.start();
    }

    @AfterEach
    void tearDown() {
      server.stop(0);
    }

    private String addr() {
      return "127.0.0.1:" + server.getAddress().getPort();
    }

    @Test
    @DisplayName("should lease consecutive blocks")
    void shouldLeaseBlocks() throws IOException {
      try (HttpZeroClient zero = HttpZeroClient.connect(addr())) {
        AssignedIds ts = zero.timestamps(1, Duration.ofSeconds(1));
        AssignedIds uids = zero.assignUids(100, Duration.ofSeconds(1));

        assertEquals(10, ts.getStartId());
        assertEquals(10, ts.getEndId());
        assertEquals(11, uids.getStartId());
        assertEquals(110, uids.getEndId());
        assertEquals(100, uids.size());
      }
    }

    @Test
    @DisplayName("should keep retrying the write timestamp past null ids")
    @Timeout(10)
    void shouldRetryPastNullIds() throws Exception {
      nullReplies.set(1);
      try (HttpZeroClient zero = HttpZeroClient.connect(addr())) {
        assertThrows(
          IOException.class,
          () -> zero.timestamps(1, Duration.ofSeconds(1))
        );
        nullReplies.set(1);

        assertEquals(10L, WriteTimestamp.obtain(zero));
      }
    }
  }

  @Test
  @DisplayName("should fail immediately when nothing listens")
  void shouldFailWhenUnreachable() throws IOException {
    int port;
    try (ServerSocket s = new ServerSocket(0)) {
      port = s.getLocalPort();
    }
    ZeroUnavailableException e = assertThrows(
      ZeroUnavailableException.class,
      () -> HttpZeroClient.connect("127.0.0.1:" + port)
    );
    assertTrue(e.getMessage().contains("is it running at 127.0.0.1:" + port));
  }

  @Test
  @DisplayName("should reject replies without an id range")
  void shouldRejectBadReply() {
    Gson gson = new Gson();
    assertThrows(
      IOException.class,
      () -> HttpZeroClient.parseAssigned(gson, "{\"startId\": 1}")
    );
    assertThrows(
      IOException.class,
      () -> HttpZeroClient.parseAssigned(gson, "not json {")
    );
  }

  @Test
  @DisplayName("should turn null or inverted ids into I/O errors")
  void shouldWrapBadIds() {
    Gson gson = new Gson();
    IOException nullId = assertThrows(
      IOException.class,
      () -> HttpZeroClient.parseAssigned(gson, "{\"startId\": null, \"endId\": 3}")
    );
    assertTrue(nullId.getMessage().contains("unparseable reply"));

    IOException inverted = assertThrows(
      IOException.class,
      () -> HttpZeroClient.parseAssigned(gson, "{\"startId\": 5, \"endId\": 3}")
    );
    assertInstanceOf(IllegalArgumentException.class, inverted.getCause());

    assertThrows(
      IOException.class,
      () -> HttpZeroClient.parseAssigned(gson, "{\"startId\": \"x1\", \"endId\": 3}")
    );
  }

  private static void reply(HttpExchange ex, int status, String body)
    throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.sendResponseHeaders(status, b.length);
    try (OutputStream out = ex.getResponseBody()) {
      out.write(b);
    }
  }
}
