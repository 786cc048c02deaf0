/**
 * Persistence of per-message user state: SQLite-backed in production,
 * in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   ReaderSession
 *        │
 *        ▼
 *   DatabaseService    ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴───┐
 *    │       │
 *  SqlDB   TestDB
 * </pre>
 *
 * <h2>Schema</h2>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │ messages                                                     │
 * ├──────────────┬───────────────────────────────────────────────┤
 * │ msg_id (PK)  │ {sourceId}@{provider}, e.g. 8863@hn           │
 * │ thread_id    │ msg_id of the thread root                     │
 * │ date         │ message date, epoch seconds                   │
 * │ flags        │ JSON: {"read":bool,"starred":bool}            │
 * └──────────────┴───────────────────────────────────────────────┘
 *   index messages_starred_date (JSON_EXTRACT(flags,'$.starred'), date)
 *   index messages_thread       (thread_id)
 * </pre>
 *
 * Only messages the user touched are stored. A message absent from the table
 * is unread and unstarred.
 */
package de.bsommerfeld.retronews.db;
