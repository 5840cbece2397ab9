package de.bsommerfeld.socialnetwork.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import de.bsommerfeld.socialnetwork.core.config.ApplicationMode;
import de.bsommerfeld.socialnetwork.core.config.ServerConfig;
import de.bsommerfeld.socialnetwork.server.config.ServerModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the real server, bound to an ephemeral port, against a fresh SQLite
 * store in a temporary directory.
 */
class ApiServerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = JsonMapping.create();
    private final HttpClient http = HttpClient.newHttpClient();

    private Path databaseFile;
    private ApiServer server;

    @BeforeEach
    void setUp() {
        databaseFile = tempDir.resolve("social_network.db");
        server = startServer();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private ApiServer startServer() {
        ServerConfig config = new ServerConfig("127.0.0.1", 0, databaseFile);
        ApiServer started = Guice.createInjector(new ServerModule(config, ApplicationMode.PROD))
                .getInstance(ApiServer.class);
        started.start();
        return started;
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return http.send(request(path).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws IOException, InterruptedException {
        HttpRequest req = request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path));
    }

    private JsonNode json(HttpResponse<String> response) throws IOException {
        return mapper.readTree(response.body());
    }

    @Test
    void health_shouldReportRunning() throws Exception {
        HttpResponse<String> response = get("/");

        assertEquals(200, response.statusCode());
        assertEquals("Social Network API is running!", json(response).get("message").asText());
        assertEquals("ok", json(response).get("status").asText());
    }

    @Test
    void users_shouldServeSeededUsersOnFreshStore() throws Exception {
        JsonNode users = json(get("/users"));

        assertEquals(3, users.size());
        for (JsonNode user : users) {
            String expectedRole = user.get("username").asText().equals("maria_admin") ? "admin" : "user";
            assertEquals(expectedRole, user.get("role").asText());
            assertTrue(user.hasNonNull("created_at"));
        }
    }

    @Test
    void posts_shouldCarryAuthorUsernames() throws Exception {
        JsonNode posts = json(get("/posts"));

        assertEquals(3, posts.size());
        for (JsonNode post : posts) {
            String expected = switch (post.get("user_id").asInt()) {
                case 1 -> "juan_dev";
                case 2 -> "maria_admin";
                case 3 -> "carlos_student";
                default -> fail("unexpected author " + post.get("user_id"));
            };
            assertEquals(expected, post.get("username").asText());
        }
    }

    @Test
    void follows_shouldServeSeededEdgesInPairOrder() throws Exception {
        JsonNode follows = json(get("/follows"));

        assertEquals(3, follows.size());
        assertEquals(1, follows.get(0).get("following_user_id").asInt());
        assertEquals(2, follows.get(0).get("followed_user_id").asInt());
        assertEquals(2, follows.get(2).get("following_user_id").asInt());
        assertEquals(3, follows.get(2).get("followed_user_id").asInt());
    }

    @Test
    void createUser_shouldDefaultRoleAndRejectDuplicate() throws Exception {
        HttpResponse<String> created = post("/users", "{\"username\":\"new_guy\"}");

        assertEquals(200, created.statusCode());
        assertEquals(4, json(created).get("id").asInt());
        assertEquals("new_guy", json(created).get("username").asText());
        assertEquals("user", json(created).get("role").asText());

        HttpResponse<String> duplicate = post("/users", "{\"username\":\"new_guy\"}");

        assertEquals(400, duplicate.statusCode());
        assertEquals("Username already exists", json(duplicate).get("detail").asText());
        assertEquals(4, json(get("/users")).size());
    }

    @Test
    void users_shouldListNewestFirst() throws Exception {
        post("/users", "{\"username\":\"first\"}");
        post("/users", "{\"username\":\"second\",\"role\":\"admin\"}");

        JsonNode users = json(get("/users"));

        assertEquals("second", users.get(0).get("username").asText());
        assertEquals("admin", users.get(0).get("role").asText());
        assertEquals("first", users.get(1).get("username").asText());
    }

    @Test
    void createPost_shouldReturnPostWithAuthor() throws Exception {
        HttpResponse<String> response = post("/posts",
                "{\"title\":\"Nuevo\",\"body\":\"Contenido\",\"user_id\":1}");

        assertEquals(200, response.statusCode());
        JsonNode post = json(response);
        assertEquals("Nuevo", post.get("title").asText());
        assertEquals("juan_dev", post.get("username").asText());
        assertEquals("Nuevo", json(get("/posts")).get(0).get("title").asText());
    }

    @Test
    void createPost_shouldRejectUnknownUserAndPersistNothing() throws Exception {
        HttpResponse<String> response = post("/posts", "{\"title\":\"T\",\"body\":\"B\",\"user_id\":999}");

        assertEquals(400, response.statusCode());
        assertEquals("User does not exist", json(response).get("detail").asText());
        assertEquals(3, json(get("/posts")).size());
    }

    @Test
    void createPost_shouldNameMissingField() throws Exception {
        HttpResponse<String> response = post("/posts", "{\"title\":\"T\",\"body\":\"B\"}");

        assertEquals(400, response.statusCode());
        assertEquals("user_id is required", json(response).get("detail").asText());
    }

    @Test
    void createPost_shouldRejectFractionalUserIdAndPersistNothing() throws Exception {
        HttpResponse<String> response = post("/posts", "{\"title\":\"T\",\"body\":\"B\",\"user_id\":2.9}");

        assertEquals(400, response.statusCode());
        assertEquals("Invalid value for user_id", json(response).get("detail").asText());
        assertEquals(3, json(get("/posts")).size());
    }

    @Test
    void createUser_shouldRejectOverlongUsername() throws Exception {
        HttpResponse<String> response = post("/users", "{\"username\":\"" + "x".repeat(80) + "\"}");

        assertEquals(400, response.statusCode());
        assertEquals("username is too long", json(response).get("detail").asText());
        assertEquals(3, json(get("/users")).size());
    }

    @Test
    void createUser_shouldRejectMalformedJson() throws Exception {
        HttpResponse<String> response = post("/users", "{\"username\":");

        assertEquals(400, response.statusCode());
        assertEquals("Malformed JSON body", json(response).get("detail").asText());
    }

    @Test
    void unknownRoute_shouldAnswerNotFoundDetail() throws Exception {
        HttpResponse<String> response = get("/nope");

        assertEquals(404, response.statusCode());
        assertEquals("Not Found", json(response).get("detail").asText());
    }

    @Test
    void cors_shouldAllowAnyOrigin() throws Exception {
        String origin = "http://localhost:3000";
        HttpResponse<String> response = http.send(request("/users").header("Origin", origin).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        Optional<String> allowed = response.headers().firstValue("Access-Control-Allow-Origin");
        assertTrue(allowed.isPresent());
        assertTrue(allowed.get().equals("*") || allowed.get().equals(origin));
    }

    @Test
    void cors_shouldAnswerPreflightWithRequestedMethodAndHeaders() throws Exception {
        HttpRequest preflight = request("/users")
                .header("Origin", "http://localhost:3000")
                .header("Access-Control-Request-Method", "POST")
                .header("Access-Control-Request-Headers", "content-type,x-custom")
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .build();

        HttpResponse<String> response = http.send(preflight, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Access-Control-Allow-Origin").isPresent());
        String methods = response.headers().firstValue("Access-Control-Allow-Methods").orElse("");
        String headers = response.headers().firstValue("Access-Control-Allow-Headers").orElse("").toLowerCase();
        assertTrue(methods.contains("POST"), methods);
        assertTrue(headers.contains("content-type") && headers.contains("x-custom"), headers);
    }

    @Test
    void restart_shouldKeepExistingDataWithoutReseeding() throws Exception {
        post("/users", "{\"username\":\"survivor\"}");
        server.stop();

        server = startServer();

        JsonNode users = json(get("/users"));
        assertEquals(4, users.size());
        assertEquals("survivor", users.get(0).get("username").asText());
    }
}
