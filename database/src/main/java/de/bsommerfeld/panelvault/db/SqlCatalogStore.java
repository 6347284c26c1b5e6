package de.bsommerfeld.panelvault.db;

import com.google.inject.Singleton;
import de.bsommerfeld.panelvault.core.domain.CatalogImage;
import de.bsommerfeld.panelvault.core.domain.DedupKey;
import de.bsommerfeld.panelvault.core.domain.DownloadUpdate;
import de.bsommerfeld.panelvault.core.domain.NewPage;
import de.bsommerfeld.panelvault.core.domain.Page;
import de.bsommerfeld.panelvault.core.domain.PageImage;
import de.bsommerfeld.panelvault.core.domain.Source;
import de.bsommerfeld.panelvault.core.domain.SourceInput;
import de.bsommerfeld.panelvault.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * SQLite-backed {@link CatalogStore} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup. Every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level anyway, and the busy
 * timeout lets a reader wait out a commit instead of failing with
 * {@code SQLITE_BUSY}.
 *
 * <h3>Transaction boundaries</h3>
 * Multi-statement operations ({@link #commitPages}, {@link #commitDownloads},
 * {@link #deleteSource}) use explicit transactions with rollback-on-failure.
 * Single-statement operations use auto-commit.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlCatalogStore implements CatalogStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlCatalogStore.class);
    private static final String DB_FILE = "panelvault.db";
    private static final int BUSY_TIMEOUT_MILLIS = 10_000;

    private final String dbUrl;

    public SqlCatalogStore() {
        this(defaultDatabaseFile());
    }

    public SqlCatalogStore(Path dbFile) {
        this.dbUrl = "jdbc:sqlite:" + dbFile.toAbsolutePath();
        initialize();
    }

    private static Path defaultDatabaseFile() {
        Path appData = StorageUtils.getAppDataDir(StorageUtils.APP_NAME);
        try {
            Files.createDirectories(appData);
        } catch (IOException e) {
            throw new CatalogException("Failed to create app data directory " + appData, e);
        }
        return appData.resolve(DB_FILE);
    }

    Connection getConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("foreign_keys", "true");
        props.setProperty("busy_timeout", String.valueOf(BUSY_TIMEOUT_MILLIS));
        return DriverManager.getConnection(dbUrl, props);
    }

    private void initialize() {
        LOG.info("Initializing catalog at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new CatalogException("Catalog initialization failed", e);
        }
    }

    /**
     * Applies the full DDL from {@code schema.sql}. Splits on semicolons at line
     * ends and executes each statement individually inside one transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql");
                Statement stmt = conn.createStatement()) {

            if (schemaStream == null) {
                throw new SQLException("schema.sql not found on classpath");
            }

            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.debug("Catalog schema applied.");
        } catch (IOException | SQLException e) {
            if (!conn.getAutoCommit()) {
                conn.rollback();
            }
            throw new SQLException("Schema application failed", e);
        }
    }

    // =====================================================================
    // Sources
    // =====================================================================

    @Override
    public long createSource(SourceInput input) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-source"))) {
            bindSourceInput(ps, input);
            ps.setLong(9, Instant.now().toEpochMilli());
            ps.executeUpdate();
            long id = lastInsertId(conn);
            LOG.info("Created source {} '{}'", id, input.name());
            return id;
        } catch (SQLException e) {
            throw new CatalogException("Failed to create source '" + input.name() + "'", e);
        }
    }

    @Override
    public Source getSource(long sourceId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-source"))) {
            ps.setLong(1, sourceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapSource(rs) : null;
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load source " + sourceId, e);
        }
    }

    @Override
    public List<Source> getAllSources() {
        List<Source> sources = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-sources"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                sources.add(mapSource(rs));
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to list sources", e);
        }
        return sources;
    }

    @Override
    public void updateSource(long sourceId, SourceInput input) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-source"))) {
            bindSourceInput(ps, input);
            ps.setLong(9, sourceId);
            if (ps.executeUpdate() == 0) {
                throw new CatalogException("Source " + sourceId + " does not exist");
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to update source " + sourceId, e);
        }
    }

    @Override
    public void deleteSource(long sourceId) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                // Explicit order so deletion does not depend on the foreign_keys pragma
                executeForSource(conn, "delete-source-images", sourceId);
                executeForSource(conn, "delete-source-pages", sourceId);
                executeForSource(conn, "delete-source", sourceId);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            LOG.info("Deleted source {}", sourceId);
        } catch (SQLException e) {
            throw new CatalogException("Failed to delete source " + sourceId, e);
        }
    }

    @Override
    public boolean setCoverIfAbsent(long sourceId, byte[] cover) {
        if (cover == null || cover.length == 0)
            return false;
        try (Connection conn = getConnection()) {
            return updateCoverIfAbsent(conn, sourceId, cover);
        } catch (SQLException e) {
            throw new CatalogException("Failed to store cover for source " + sourceId, e);
        }
    }

    // =====================================================================
    // Pages
    // =====================================================================

    @Override
    public Page getLastPage(long sourceId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-last-page"))) {
            ps.setLong(1, sourceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapPage(rs) : null;
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load last page of source " + sourceId, e);
        }
    }

    @Override
    public Page getPageBefore(long sourceId, int pageIndex) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-page-before"))) {
            ps.setLong(1, sourceId);
            ps.setInt(2, pageIndex);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapPage(rs) : null;
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load page before " + pageIndex + " of source " + sourceId, e);
        }
    }

    @Override
    public int getMaxPageIndex(long sourceId) {
        try (Connection conn = getConnection()) {
            return queryMaxPageIndex(conn, sourceId);
        } catch (SQLException e) {
            throw new CatalogException("Failed to read max page index of source " + sourceId, e);
        }
    }

    @Override
    public Set<DedupKey> getDedupKeysFrom(long sourceId, int fromPageIndex) {
        Set<DedupKey> keys = new HashSet<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-dedup-keys"))) {
            ps.setLong(1, sourceId);
            ps.setInt(2, fromPageIndex);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(new DedupKey(rs.getString(1), rs.getString(2)));
                }
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load dedup keys of source " + sourceId, e);
        }
        return keys;
    }

    @Override
    public void commitPages(long sourceId, List<NewPage> pages) {
        if (pages == null || pages.isEmpty())
            return;

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                int imageCount = insertPages(conn, sourceId, pages);
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-source-counters"))) {
                    ps.setInt(1, pages.size());
                    ps.setInt(2, imageCount);
                    ps.setLong(3, sourceId);
                    if (ps.executeUpdate() == 0) {
                        throw new SQLException("Source " + sourceId + " does not exist");
                    }
                }
                conn.commit();
                LOG.debug("Committed {} pages ({} images) for source {}", pages.size(), imageCount, sourceId);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to commit " + pages.size() + " pages for source " + sourceId, e);
        }
    }

    /**
     * Inserts pages and their images. Images are numbered from 0 in list order.
     *
     * @return number of inserted images
     */
    private int insertPages(Connection conn, long sourceId, List<NewPage> pages) throws SQLException {
        long now = Instant.now().toEpochMilli();
        int imageCount = 0;
        try (PreparedStatement pagePs = conn.prepareStatement(SqlLoader.load("insert-page"));
                PreparedStatement imagePs = conn.prepareStatement(SqlLoader.load("insert-image"))) {
            for (NewPage page : pages) {
                pagePs.setLong(1, sourceId);
                pagePs.setInt(2, page.index());
                pagePs.setString(3, page.title() != null ? page.title() : "");
                pagePs.setString(4, page.url());
                pagePs.setLong(5, now);
                pagePs.executeUpdate();
                long pageId = lastInsertId(conn);

                List<String> imageUrls = page.imageUrls();
                for (int i = 0; i < imageUrls.size(); i++) {
                    imagePs.setLong(1, pageId);
                    imagePs.setLong(2, sourceId);
                    imagePs.setInt(3, i);
                    imagePs.setString(4, page.url());
                    imagePs.setString(5, imageUrls.get(i));
                    imagePs.addBatch();
                }
                imageCount += imageUrls.size();
            }
            imagePs.executeBatch();
        }
        return imageCount;
    }

    @Override
    public List<Page> getPages(long sourceId) {
        List<Page> pages = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-pages"))) {
            ps.setLong(1, sourceId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    pages.add(mapPage(rs));
                }
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load pages of source " + sourceId, e);
        }
        return pages;
    }

    @Override
    public List<PageImage> getImages(long pageId) {
        List<PageImage> images = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-images-for-page"))) {
            ps.setLong(1, pageId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long downloadedAt = rs.getLong(7);
                    Instant downloaded = rs.wasNull() ? null : Instant.ofEpochMilli(downloadedAt);
                    images.add(new PageImage(rs.getLong(1), rs.getLong(2), rs.getInt(3), rs.getString(4),
                            rs.getString(5), rs.getString(6), downloaded));
                }
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load images of page " + pageId, e);
        }
        return images;
    }

    // =====================================================================
    // Downloads
    // =====================================================================

    @Override
    public List<CatalogImage> getUndownloadedImages(long sourceId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-undownloaded-images"))) {
            ps.setLong(1, sourceId);
            return readCatalogImages(ps);
        } catch (SQLException e) {
            throw new CatalogException("Failed to load pending images of source " + sourceId, e);
        }
    }

    @Override
    public List<CatalogImage> getDownloadedImages(long sourceId, int offset, int limit) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-downloaded-images"))) {
            ps.setLong(1, sourceId);
            ps.setInt(2, limit);
            ps.setInt(3, offset);
            return readCatalogImages(ps);
        } catch (SQLException e) {
            throw new CatalogException("Failed to load downloaded images of source " + sourceId, e);
        }
    }

    @Override
    public void commitDownloads(long sourceId, List<DownloadUpdate> updates, int downloadedDelta, byte[] cover) {
        boolean hasUpdates = updates != null && !updates.isEmpty();
        boolean hasCover = cover != null && cover.length > 0;
        if (!hasUpdates && downloadedDelta == 0 && !hasCover)
            return;

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (hasUpdates) {
                    long now = Instant.now().toEpochMilli();
                    try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-image-download"))) {
                        for (DownloadUpdate update : updates) {
                            if (update.isReset()) {
                                ps.setString(1, "");
                                ps.setNull(2, Types.INTEGER);
                            } else {
                                ps.setString(1, update.downloadPath());
                                ps.setLong(2, now);
                            }
                            ps.setLong(3, update.imageId());
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                }
                if (downloadedDelta != 0) {
                    try (PreparedStatement ps = conn
                            .prepareStatement(SqlLoader.load("update-source-downloaded-count"))) {
                        ps.setInt(1, downloadedDelta);
                        ps.setLong(2, sourceId);
                        ps.executeUpdate();
                    }
                }
                if (hasCover) {
                    updateCoverIfAbsent(conn, sourceId, cover);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to commit downloads for source " + sourceId, e);
        }
    }

    @Override
    public int rewriteDownloadPaths(long sourceId, String oldPrefix, String newPrefix) {
        if (oldPrefix == null || oldPrefix.isEmpty() || oldPrefix.equals(newPrefix))
            return 0;
        // SQLite's substr counts characters, not UTF-16 units
        int prefixLength = oldPrefix.codePointCount(0, oldPrefix.length());
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("rewrite-download-paths"))) {
            ps.setString(1, newPrefix);
            ps.setInt(2, prefixLength + 1);
            ps.setLong(3, sourceId);
            ps.setInt(4, prefixLength);
            ps.setString(5, oldPrefix);
            int rewritten = ps.executeUpdate();
            LOG.info("Rewrote {} download paths of source {}", rewritten, sourceId);
            return rewritten;
        } catch (SQLException e) {
            throw new CatalogException("Failed to rewrite download paths of source " + sourceId, e);
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static void bindSourceInput(PreparedStatement ps, SourceInput input) throws SQLException {
        ps.setString(1, input.name());
        ps.setString(2, nullToEmpty(input.author()));
        ps.setString(3, nullToEmpty(input.description()));
        ps.setString(4, nullToEmpty(input.url()));
        ps.setString(5, nullToEmpty(input.firstPageUrl()));
        ps.setString(6, nullToEmpty(input.selectorImage()));
        ps.setString(7, nullToEmpty(input.selectorTitle()));
        ps.setString(8, nullToEmpty(input.selectorNext()));
    }

    private static boolean updateCoverIfAbsent(Connection conn, long sourceId, byte[] cover) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-source-cover-if-absent"))) {
            ps.setBytes(1, cover);
            ps.setLong(2, sourceId);
            return ps.executeUpdate() > 0;
        }
    }

    private static int queryMaxPageIndex(Connection conn, long sourceId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-max-page-index"))) {
            ps.setLong(1, sourceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static void executeForSource(Connection conn, String sqlName, long sourceId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            ps.setLong(1, sourceId);
            ps.executeUpdate();
        }
    }

    private static long lastInsertId(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("select-last-insert-id"))) {
            if (!rs.next()) {
                throw new SQLException("No row id after insert");
            }
            return rs.getLong(1);
        }
    }

    private static List<CatalogImage> readCatalogImages(PreparedStatement ps) throws SQLException {
        List<CatalogImage> images = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                images.add(new CatalogImage(
                        rs.getLong(1),
                        rs.getInt(2),
                        rs.getInt(3),
                        rs.getInt(4),
                        rs.getString(5),
                        rs.getString(6),
                        rs.getString(7),
                        rs.getString(8)));
            }
        }
        return images;
    }

    private static Source mapSource(ResultSet rs) throws SQLException {
        return new Source(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("author"),
                rs.getString("description"),
                rs.getString("url"),
                rs.getString("first_page_url"),
                rs.getString("selector_image"),
                rs.getString("selector_title"),
                rs.getString("selector_next"),
                rs.getBytes("cover_image"),
                rs.getInt("page_count"),
                rs.getInt("image_count"),
                rs.getInt("downloaded_image_count"));
    }

    private static Page mapPage(ResultSet rs) throws SQLException {
        return new Page(
                rs.getLong("id"),
                rs.getLong("source_id"),
                rs.getInt("page_index"),
                rs.getString("title"),
                rs.getString("url"),
                Instant.ofEpochMilli(rs.getLong("fetched_at")));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
