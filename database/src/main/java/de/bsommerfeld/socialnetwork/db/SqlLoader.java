package de.bsommerfeld.socialnetwork.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL from classpath resources.
 *
 * <p>
 * Single statements live under {@code sql/} and follow the naming convention
 * {@code sql/<operation>-<entity>.sql}, e.g. {@code insert-user.sql} or
 * {@code select-all-posts.sql}. Multi-statement scripts such as
 * {@code schema.sql} sit at the classpath root and are split into individual
 * statements by {@link #script(String)}.
 *
 * <p>
 * Every resource is read once and cached for the lifetime of the JVM.
 *
 * @see SqlDatabaseService
 * @see StoreInitializer
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> STATEMENTS = new ConcurrentHashMap<>();
    private static final ConcurrentHashMap<String, List<String>> SCRIPTS = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement from {@code sql/<name>.sql}, trimmed.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return STATEMENTS.computeIfAbsent(name, n -> readResource("sql/" + n + ".sql"));
    }

    /**
     * Returns the statements of the script at {@code resource}, in file order.
     * Statements are separated by a semicolon at the end of a line; whole-line
     * comments and blank fragments are dropped.
     *
     * @param resource classpath location, e.g. {@code schema.sql}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> script(String resource) {
        return SCRIPTS.computeIfAbsent(resource, r -> split(readResource(r)));
    }

    static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        for (String fragment : script.split(";\\s*(\\r?\\n|$)")) {
            String sql = stripCommentLines(fragment);
            if (!sql.isEmpty())
                statements.add(sql);
        }
        return Collections.unmodifiableList(statements);
    }

    /** Drops whole-line {@code --} comments; trailing comments are left to SQLite. */
    private static String stripCommentLines(String fragment) {
        StringBuilder sb = new StringBuilder();
        for (String line : fragment.split("\\r?\\n")) {
            if (line.trim().startsWith("--"))
                continue;
            if (sb.length() > 0)
                sb.append('\n');
            sb.append(line);
        }
        return sb.toString().trim();
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
