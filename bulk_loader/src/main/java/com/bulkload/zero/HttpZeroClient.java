package com.bulkload.zero;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Talks to zero's plain-HTTP admin endpoint.
 *
 * <pre>
 *   GET /health                          reachability check at connect
 *   GET /assign?what=timestamps&amp;num=N  {"startId":"..","endId":".."}
 *   GET /assign?what=uids&amp;num=N
 * </pre>
 */
public class HttpZeroClient implements ZeroClient {

  private static final Logger LOG = LoggerFactory.getLogger(HttpZeroClient.class);

  /** How long {@link #connect} waits for zero before giving up. */
  public static final Duration DIAL_TIMEOUT = Duration.ofMinutes(1);

  private final Gson gson = new Gson();
  private final HttpClient http;
  private final String baseUrl;

  HttpZeroClient(HttpClient http, String baseUrl) {
    this.http = http;
    this.baseUrl = baseUrl;
  }

  /**
   * Connects, blocking until zero answers its health check or the dial
   * timeout passes. Not retried.
   */
  public static HttpZeroClient connect(String addr) throws IOException {
    LOG.info("Connecting to zero at {}", addr);
    HttpClient http = HttpClient.newBuilder()
      .connectTimeout(DIAL_TIMEOUT)
      .build();
    String baseUrl = addr.startsWith("http://") ? addr : "http://" + addr;
    HttpRequest health = HttpRequest.newBuilder(URI.create(baseUrl + "/health"))
      .timeout(DIAL_TIMEOUT)
      .GET()
      .build();
    try {
      HttpResponse<String> resp = http.send(
        health,
        HttpResponse.BodyHandlers.ofString()
      );
      if (resp.statusCode() != 200) {
        throw new IOException("health check returned HTTP " + resp.statusCode());
      }
    } catch (IOException e) {
      throw new ZeroUnavailableException(
        "Unable to connect to zero, is it running at " + addr + "?",
        e
      );
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ZeroUnavailableException("interrupted connecting to " + addr, e);
    }
    return new HttpZeroClient(http, baseUrl);
  }

  @Override
  public AssignedIds timestamps(long num, Duration timeout) throws IOException {
    return assign("timestamps", num, timeout);
  }

  @Override
  public AssignedIds assignUids(long num, Duration timeout) throws IOException {
    return assign("uids", num, timeout);
  }

  private AssignedIds assign(String what, long num, Duration timeout)
    throws IOException {
    URI uri = URI.create(baseUrl + "/assign?what=" + what + "&num=" + num);
    HttpRequest req = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
    HttpResponse<String> resp;
    try {
      resp = http.send(req, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted calling " + uri, e);
    }
    if (resp.statusCode() != 200) {
      throw new IOException(
        "zero returned HTTP " + resp.statusCode() + " for " + uri + ": " + resp.body()
      );
    }
    return parseAssigned(gson, resp.body());
  }

  /**
   * Parses zero's reply; ids may be JSON numbers or decimal strings. Any
   * malformed reply, including null or inverted ids, becomes an
   * {@link IOException} so callers that retry on I/O errors keep retrying.
   */
  static AssignedIds parseAssigned(Gson gson, String body) throws IOException {
    try {
      JsonObject obj = gson.fromJson(body, JsonObject.class);
      if (obj == null || !obj.has("startId") || !obj.has("endId")) {
        throw new IOException("unexpected reply from zero: " + body);
      }
      return new AssignedIds(
        obj.get("startId").getAsLong(),
        obj.get("endId").getAsLong()
      );
    } catch (RuntimeException e) {
      // gson syntax errors as well as getAsLong and AssignedIds range checks
      throw new IOException("unparseable reply from zero: " + body, e);
    }
  }

  @Override
  public void close() {
    // java.net.http.HttpClient holds no resources that need closing on 17
  }
}
