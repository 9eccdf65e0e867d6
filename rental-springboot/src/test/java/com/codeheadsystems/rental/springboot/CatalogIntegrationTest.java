package com.codeheadsystems.rental.springboot;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.rental.model.auth.AuthResponse;
import com.codeheadsystems.rental.model.catalog.CatalogItem;
import com.codeheadsystems.rental.model.photo.Photo;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CatalogIntegrationTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @LocalServerPort
  private int port;

  private HttpClient httpClient;
  private AuthResponse auth;

  @BeforeEach
  void setUp() throws Exception {
    httpClient = HttpClient.newHttpClient();
    String body = MAPPER.createObjectNode()
        .put("username", "owner-" + UUID.randomUUID())
        .put("password", "pw")
        .toString();
    HttpResponse<String> register = send("POST", "/rental/api/auth/register", body);
    auth = MAPPER.readValue(register.body(), AuthResponse.class);
  }

  @Test
  void itemLifecycle() throws Exception {
    String title = "Alien " + UUID.randomUUID();
    CatalogItem draft = new CatalogItem(null, title, "1979", 2.5, 8, "sci-fi", null, null, 0);

    HttpResponse<String> created = send("POST", "/rental/api/items", MAPPER.writeValueAsString(draft));
    assertThat(created.statusCode()).isEqualTo(201);
    CatalogItem item = MAPPER.readValue(created.body(), CatalogItem.class);
    assertThat(item.version()).isEqualTo(1);

    HttpResponse<String> duplicate = send("POST", "/rental/api/items", MAPPER.writeValueAsString(draft));
    assertThat(duplicate.statusCode()).isEqualTo(409);

    CatalogItem change = new CatalogItem(item.id(), title, "1979", 3.0, 9, "sci-fi", null, null, 0);
    HttpResponse<String> updated = send("PUT", "/rental/api/items", MAPPER.writeValueAsString(change));
    assertThat(updated.statusCode()).isEqualTo(200);
    assertThat(MAPPER.readValue(updated.body(), CatalogItem.class).version()).isEqualTo(2);

    HttpResponse<String> unchanged = send("PUT", "/rental/api/items", MAPPER.writeValueAsString(change));
    assertThat(unchanged.statusCode()).isEqualTo(400);

    HttpResponse<String> fetched = send("GET", "/rental/api/items/" + item.id(), null);
    assertThat(MAPPER.readValue(fetched.body(), CatalogItem.class).rating()).isEqualTo(9);

    assertThat(send("DELETE", "/rental/api/items/" + item.id(), null).statusCode()).isEqualTo(200);
    assertThat(send("DELETE", "/rental/api/items/" + item.id(), null).statusCode()).isEqualTo(400);
  }

  @Test
  void list_onlyReturnsCallersItems() throws Exception {
    CatalogItem draft = new CatalogItem(null, "Heat " + UUID.randomUUID(), "1995", 1.0, 7, "crime", null, null, 0);
    send("POST", "/rental/api/items", MAPPER.writeValueAsString(draft));

    HttpResponse<String> response = send("GET", "/rental/api/items", null);

    CatalogItem[] items = MAPPER.readValue(response.body(), CatalogItem[].class);
    assertThat(items).extracting(CatalogItem::title).containsExactly(draft.title());
  }

  @Test
  void invalidBody_returns400() throws Exception {
    assertThat(send("POST", "/rental/api/items", "{not json").statusCode()).isEqualTo(400);
  }

  @Test
  void photoLifecycle() throws Exception {
    String filepath = "/photos/" + UUID.randomUUID() + ".jpg";
    Photo photo = new Photo(null, auth.userId(), filepath, null);

    assertThat(send("POST", "/rental/api/photos", MAPPER.writeValueAsString(photo)).statusCode()).isEqualTo(201);

    HttpResponse<String> listed = send("GET", "/rental/api/photos/" + auth.userId(), null);
    assertThat(MAPPER.readValue(listed.body(), Photo[].class)).extracting(Photo::filepath).containsExactly(filepath);

    String query = "?filepath=" + URLEncoder.encode(filepath, StandardCharsets.UTF_8);
    assertThat(send("DELETE", "/rental/api/photos" + query, null).statusCode()).isEqualTo(200);
    assertThat(send("GET", "/rental/api/photos/" + auth.userId(), null).body()).isEqualTo("[]");
  }

  private HttpResponse<String> send(String method, String path, String body) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://localhost:%d%s", port, path)))
        .header("Content-Type", "application/json")
        .method(method, body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body));
    if (auth != null) {
      builder.header("Authorization", "Bearer " + auth.token());
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }
}
