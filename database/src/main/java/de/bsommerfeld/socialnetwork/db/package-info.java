/**
 * Persistence for users, posts and follow edges: SQLite-backed in
 * production, in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [HTTP handlers]
 *        │
 *        ▼
 *   DatabaseService           ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴──────────┐
 *    │              │
 *  SqlDB         InMemoryDB
 *    │
 *    ├── StoreInitializer        ← creates + seeds a missing store file once
 *    └── SqliteConnectionFactory ← one connection per operation, FKs on
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * users    (id PK AUTOINCREMENT, username UNIQUE NOT NULL, role DEFAULT 'user', created_at)
 * posts    (id PK AUTOINCREMENT, title NOT NULL, body NOT NULL, user_id → users.id, created_at)
 * follows  (following_user_id → users.id, followed_user_id → users.id, created_at,
 *           PK (following_user_id, followed_user_id))
 * </pre>
 *
 * {@code created_at} is SQLite's {@code CURRENT_TIMESTAMP}: UTC text with
 * one-second resolution. User and post lists therefore order by
 * {@code created_at DESC, id DESC}.
 *
 * <h2>SQL File Inventory</h2>
 * <ul>
 * <li>{@code schema.sql}: DDL for all three tables</li>
 * <li>{@code insert-user.sql}, {@code insert-post.sql},
 * {@code insert-follow.sql}</li>
 * <li>{@code select-last-insert-id.sql}: id of the row just written on this
 * connection</li>
 * <li>{@code select-user.sql}, {@code select-all-users.sql}</li>
 * <li>{@code select-post.sql}, {@code select-all-posts.sql}: JOIN users for
 * the author's username</li>
 * <li>{@code select-all-follows.sql}</li>
 * </ul>
 */
package de.bsommerfeld.socialnetwork.db;
