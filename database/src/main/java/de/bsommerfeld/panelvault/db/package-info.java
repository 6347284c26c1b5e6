/**
 * Persistent catalog of comic sources: SQLite-backed in production, in-memory
 * in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Crawler / Downloader / Service]
 *        │
 *        ▼
 *   WriteGate          ← commit windows (core module)
 *        │
 *        ▼
 *   CatalogStore       ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴──────┐
 *    │          │
 *  SqlCatalog  InMemoryCatalog
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * sources  (id, name, author, description, url, first_page_url,
 *           selector_image, selector_title, selector_next, cover_image,
 *           page_count, image_count, downloaded_image_count, created_at)
 *
 * pages    (id, source_id → sources, page_index, title, url, fetched_at)
 *           UNIQUE (source_id, page_index)
 *
 * images   (id, page_id → pages, source_id → sources, image_index,
 *           page_url, image_url, download_path, downloaded_at)
 *           UNIQUE (page_id, image_index)
 * </pre>
 *
 * The counters on {@code sources} are denormalized and maintained inside the
 * same transaction as the rows they count. {@code images.page_url} and
 * {@code images.source_id} duplicate what the join would give, so the dedup
 * window and download queries never need more than one join.
 *
 * <h2>Page indices</h2>
 * Page indices are 1-based, assigned by the crawler's commit batcher from
 * {@code MAX(page_index) + 1} and never reused. The unique constraint turns an
 * accidental reuse into a failed (and fully rolled back) batch instead of a
 * silently duplicated page.
 *
 * <h2>SQL File Inventory</h2>
 * All statements live in {@code sql/*.sql} and are loaded via
 * {@link de.bsommerfeld.panelvault.db.SqlLoader}. Names follow
 * {@code <operation>-<entity>.sql}.
 */
package de.bsommerfeld.panelvault.db;
