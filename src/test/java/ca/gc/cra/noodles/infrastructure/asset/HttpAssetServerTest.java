package ca.gc.cra.noodles.infrastructure.asset;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.noodles.application.port.AssetHost;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpAssetServerTest {
  private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).connectTimeout(Duration.ofSeconds(5)).build();
  private HttpAssetServer server;

  @BeforeEach
  void setUp() throws Exception {
    server = new HttpAssetServer(new InetSocketAddress("127.0.0.1", 0), null);
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void installedAssetIsServedWithCorsHeader() throws Exception {
    byte[] bytes = {10, 20, 30};
    AssetHost.AssetReference reference = server.install("mesh-1", bytes);

    HttpResponse<byte[]> response = get(reference.path());

    assertEquals(server.port(), reference.port());
    assertEquals(200, response.statusCode());
    assertArrayEquals(bytes, response.body());
    assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(""));
    assertEquals("application/octet-stream", response.headers().firstValue("Content-Type").orElse(""));
  }

  @Test
  void unknownOrRemovedAssetIs404() throws Exception {
    server.install("gone", new byte[] {1});
    server.remove("gone");

    assertEquals(404, get("gone").statusCode());
    assertEquals(404, get("never-installed").statusCode());
    assertEquals(0, server.assetCount());
  }

  @Test
  void preflightIsAnswered() throws Exception {
    HttpRequest request = HttpRequest.newBuilder(uri("anything"))
        .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
        .timeout(Duration.ofSeconds(5))
        .build();

    HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());

    assertEquals(200, response.statusCode());
    assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(""));
    assertTrue(response.headers().firstValue("Access-Control-Max-Age").isPresent());
  }

  @Test
  void identityMustBeOnePathSegment() {
    assertThrows(IllegalArgumentException.class, () -> server.install("a/b", new byte[1]));
    assertThrows(IllegalArgumentException.class, () -> server.install("", new byte[1]));
  }

  @Test
  void identityStripsLeadingSlash() {
    assertEquals("abc", HttpAssetServer.identityOf("/abc"));
    assertEquals("", HttpAssetServer.identityOf(null));
  }

  private HttpResponse<byte[]> get(String path) throws Exception {
    HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().timeout(Duration.ofSeconds(5)).build();
    return client.send(request, HttpResponse.BodyHandlers.ofByteArray());
  }

  private URI uri(String path) {
    return URI.create("http://127.0.0.1:" + server.port() + "/" + path);
  }
}
