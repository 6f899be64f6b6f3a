package com.mediavault.repository;

import com.mediavault.model.Disposition;
import com.mediavault.model.MediaAsset;
import com.mediavault.model.MediaType;
import com.mediavault.model.TrashEntry;
import com.mediavault.util.LibraryLogger;
import com.mediavault.util.LibrarySettings;

import java.io.File;
import java.nio.file.Path;
import java.sql.*;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Manages the library database (library.sqlite).
 * This database is located inside the .mediavault folder of the library root.
 * It stores the active assets and the trash entries of that library.
 */
public class LibraryDatabaseManager implements AssetStore {
    private static final String DB_NAME = "library.sqlite";
    private static final int CURRENT_DB_VERSION = 1;

    private static final String SQL_CREATE_METADATA = """
            CREATE TABLE IF NOT EXISTS metadata (
            version integer PRIMARY KEY
            );""";

    private static final String SQL_CREATE_ASSETS = """
            CREATE TABLE IF NOT EXISTS media_assets (
             id integer PRIMARY KEY AUTOINCREMENT,
             content_hash text NOT NULL UNIQUE,
             current_path text NOT NULL UNIQUE,
             original_filename text,
             captured_at text,
             file_type text,
             width integer,
             height integer,
             byte_size integer,
             imported_at text
            );""";

    private static final String SQL_CREATE_TRASH = """
            CREATE TABLE IF NOT EXISTS trash_entries (
             id integer PRIMARY KEY AUTOINCREMENT,
             original_path text NOT NULL,
             trash_path text,
             category text NOT NULL,
             message text,
             created_at text
            );""";

    private static final String SQL_INDEX_TRASH_CATEGORY = "CREATE INDEX IF NOT EXISTS idx_trash_category ON trash_entries(category);";

    private static final String ASSET_COLUMNS =
            "id, content_hash, current_path, original_filename, captured_at, file_type, width, height, byte_size";

    private final String connectionUrl;
    private final Path libraryRoot;

    public LibraryDatabaseManager(Path libraryRoot) {
        File dbFolder = libraryRoot.resolve(LibrarySettings.INTERNAL_DIR).toFile();
        if (!dbFolder.exists()) {
            if (!dbFolder.mkdirs()) {
                throw new DatabaseException("Could not create library database directory: " + dbFolder.getAbsolutePath());
            }
        }
        File dbFile = new File(dbFolder, DB_NAME);
        this.libraryRoot = libraryRoot;
        this.connectionUrl = "jdbc:sqlite:" + dbFile.getAbsolutePath();
        initialize();
    }

    // Constructor for testing purposes
    public LibraryDatabaseManager(String connectionUrl, boolean isTest) {
        this.connectionUrl = connectionUrl;
        this.libraryRoot = null;
        if (isTest) {
            initialize();
        }
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(connectionUrl);
    }

    /**
     * Initializes the schema and handles migrations.
     * Uses a transaction so a failed migration leaves the previous schema intact.
     */
    private void initialize() {
        try (Connection conn = connect()) {
            // WAL is not supported for in-memory databases
            if (!connectionUrl.contains("memory")) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("PRAGMA journal_mode=WAL;");
                    stmt.execute("PRAGMA synchronous=NORMAL;");
                }
            }

            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                int version = readVersion(stmt);
                if (version < CURRENT_DB_VERSION) {
                    migrate(conn, version);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Library database initialization failed", e);
        }
    }

    private int readVersion(Statement stmt) throws SQLException {
        boolean hasMetadata;
        try (ResultSet rs = stmt.executeQuery(
                "SELECT name FROM sqlite_master WHERE type = 'table' AND name = 'metadata'")) {
            hasMetadata = rs.next();
        }
        if (!hasMetadata) {
            return 0;
        }
        try (ResultSet rs = stmt.executeQuery("SELECT version FROM metadata ORDER BY version DESC LIMIT 1")) {
            return rs.next() ? rs.getInt("version") : 0;
        }
    }

    private void migrate(Connection conn, int currentVersion) throws SQLException {
        LibraryLogger.logInfo(libraryRoot, "LibraryDatabaseManager",
                "Migrating database from version " + currentVersion + " to " + CURRENT_DB_VERSION);

        Map<String, Map<String, String>> expectedSchema = new LinkedHashMap<>();

        Map<String, String> assetsCols = new LinkedHashMap<>();
        assetsCols.put("id", "integer PRIMARY KEY AUTOINCREMENT");
        assetsCols.put("content_hash", "text NOT NULL UNIQUE");
        assetsCols.put("current_path", "text NOT NULL UNIQUE");
        assetsCols.put("original_filename", "text");
        assetsCols.put("captured_at", "text");
        assetsCols.put("file_type", "text");
        assetsCols.put("width", "integer");
        assetsCols.put("height", "integer");
        assetsCols.put("byte_size", "integer");
        assetsCols.put("imported_at", "text");
        expectedSchema.put("media_assets", assetsCols);

        Map<String, String> trashCols = new LinkedHashMap<>();
        trashCols.put("id", "integer PRIMARY KEY AUTOINCREMENT");
        trashCols.put("original_path", "text NOT NULL");
        trashCols.put("trash_path", "text");
        trashCols.put("category", "text NOT NULL");
        trashCols.put("message", "text");
        trashCols.put("created_at", "text");
        expectedSchema.put("trash_entries", trashCols);

        try (Statement stmt = conn.createStatement()) {
            // 1. Create tables if they don't exist
            stmt.execute(SQL_CREATE_METADATA);
            stmt.execute(SQL_CREATE_ASSETS);
            stmt.execute(SQL_CREATE_TRASH);
            stmt.execute(SQL_INDEX_TRASH_CATEGORY);

            // 2. Add columns missing from tables created by an older version
            for (Map.Entry<String, Map<String, String>> entry : expectedSchema.entrySet()) {
                String tableName = entry.getKey();
                Set<String> existingColumns = getExistingColumns(conn, tableName);

                for (Map.Entry<String, String> colEntry : entry.getValue().entrySet()) {
                    if (!existingColumns.contains(colEntry.getKey())) {
                        LibraryLogger.logInfo(libraryRoot, "LibraryDatabaseManager",
                                "Adding missing column " + colEntry.getKey() + " to table " + tableName);
                        addColumn(stmt, tableName, colEntry.getKey(), colEntry.getValue());
                    }
                }
            }

            // 3. Update version
            stmt.execute("INSERT OR REPLACE INTO metadata (version) VALUES (" + CURRENT_DB_VERSION + ");");
        }
    }

    private Set<String> getExistingColumns(Connection conn, String tableName) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (ResultSet rs = conn.getMetaData().getColumns(null, null, tableName, null)) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME"));
            }
        }
        return columns;
    }

    private void addColumn(Statement stmt, String tableName, String columnName, String columnDefinition) throws SQLException {
        // SQLite cannot add key, unique or non-null columns to an existing table
        String safeDefinition = columnDefinition
                .replaceAll("(?i)PRIMARY KEY", "")
                .replaceAll("(?i)AUTOINCREMENT", "")
                .replaceAll("(?i)NOT NULL", "")
                .replaceAll("(?i)UNIQUE", "")
                .trim();

        stmt.execute("ALTER TABLE " + tableName + " ADD COLUMN " + columnName + " " + safeDefinition);
    }

    @Override
    public MediaAsset findByHash(String contentHash) {
        return findOne("SELECT " + ASSET_COLUMNS + " FROM media_assets WHERE content_hash = ?", contentHash);
    }

    @Override
    public MediaAsset findByPath(String currentPath) {
        return findOne("SELECT " + ASSET_COLUMNS + " FROM media_assets WHERE current_path = ?", currentPath);
    }

    @Override
    public MediaAsset findById(long id) {
        String sql = "SELECT " + ASSET_COLUMNS + " FROM media_assets WHERE id = ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setLong(1, id);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToAsset(rs);
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to get asset by id: " + id, e);
        }
        return null;
    }

    private MediaAsset findOne(String sql, String value) {
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, value);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToAsset(rs);
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to look up asset: " + value, e);
        }
        return null;
    }

    @Override
    public List<MediaAsset> findAll() {
        List<MediaAsset> assets = new ArrayList<>();
        String sql = "SELECT " + ASSET_COLUMNS + " FROM media_assets ORDER BY id ASC";
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                assets.add(mapResultSetToAsset(rs));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to get all assets", e);
        }
        return assets;
    }

    @Override
    public int countAssets() {
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM media_assets")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to count assets", e);
        }
    }

    @Override
    public MediaAsset insert(MediaAsset asset) {
        String sql = "INSERT INTO media_assets(content_hash, current_path, original_filename, captured_at, file_type, " +
                     "width, height, byte_size, imported_at) VALUES(?,?,?,?,?,?,?,?,?)";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            pstmt.setString(1, asset.getContentHash());
            pstmt.setString(2, asset.getCurrentPath());
            pstmt.setString(3, asset.getOriginalFilename());
            pstmt.setString(4, asset.getCapturedAt() != null ? asset.getCapturedAt().toString() : null);
            pstmt.setString(5, asset.getFileType().name());
            setNullableInt(pstmt, 6, asset.getWidth());
            setNullableInt(pstmt, 7, asset.getHeight());
            pstmt.setLong(8, asset.getByteSize());
            pstmt.setString(9, LocalDateTime.now().toString());
            pstmt.executeUpdate();

            try (ResultSet keys = pstmt.getGeneratedKeys()) {
                if (keys.next()) {
                    asset.setId(keys.getLong(1));
                }
            }
            return asset;
        } catch (SQLException e) {
            throw translate("Failed to insert asset " + asset.getCurrentPath(), asset.getContentHash(), e);
        }
    }

    @Override
    public void update(MediaAsset asset) {
        String sql = "UPDATE media_assets SET content_hash = ?, current_path = ?, captured_at = ?, " +
                     "width = ?, height = ?, byte_size = ? WHERE id = ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, asset.getContentHash());
            pstmt.setString(2, asset.getCurrentPath());
            pstmt.setString(3, asset.getCapturedAt() != null ? asset.getCapturedAt().toString() : null);
            setNullableInt(pstmt, 4, asset.getWidth());
            setNullableInt(pstmt, 5, asset.getHeight());
            pstmt.setLong(6, asset.getByteSize());
            pstmt.setLong(7, asset.getId());
            if (pstmt.executeUpdate() == 0) {
                throw new DatabaseException("No asset with id " + asset.getId());
            }
        } catch (SQLException e) {
            throw translate("Failed to update asset " + asset.getId(), asset.getContentHash(), e);
        }
    }

    @Override
    public void delete(long id) {
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement("DELETE FROM media_assets WHERE id = ?")) {
            pstmt.setLong(1, id);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to delete asset " + id, e);
        }
    }

    @Override
    public TrashEntry recordTrashEntry(TrashEntry entry) {
        String sql = "INSERT INTO trash_entries(original_path, trash_path, category, message, created_at) VALUES(?,?,?,?,?)";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            pstmt.setString(1, entry.getOriginalPath());
            pstmt.setString(2, entry.getTrashPath());
            pstmt.setString(3, entry.getCategory().wireName());
            pstmt.setString(4, entry.getMessage());
            pstmt.setString(5, entry.getTimestamp().toString());
            pstmt.executeUpdate();

            Long id = null;
            try (ResultSet keys = pstmt.getGeneratedKeys()) {
                if (keys.next()) {
                    id = keys.getLong(1);
                }
            }
            return new TrashEntry(id, entry.getOriginalPath(), entry.getTrashPath(), entry.getCategory(),
                    entry.getMessage(), entry.getTimestamp());
        } catch (SQLException e) {
            throw new DatabaseException("Failed to record trash entry for " + entry.getOriginalPath(), e);
        }
    }

    @Override
    public List<TrashEntry> findTrashEntries() {
        return queryTrash("SELECT * FROM trash_entries ORDER BY id ASC", null);
    }

    @Override
    public List<TrashEntry> findTrashEntries(Disposition category) {
        return queryTrash("SELECT * FROM trash_entries WHERE category = ? ORDER BY id ASC", category.wireName());
    }

    private List<TrashEntry> queryTrash(String sql, String parameter) {
        List<TrashEntry> entries = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            if (parameter != null) {
                pstmt.setString(1, parameter);
            }
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(new TrashEntry(
                            rs.getLong("id"),
                            rs.getString("original_path"),
                            rs.getString("trash_path"),
                            Disposition.fromWireName(rs.getString("category")),
                            rs.getString("message"),
                            LocalDateTime.parse(rs.getString("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load trash entries", e);
        }
        return entries;
    }

    private DatabaseException translate(String message, String contentHash, SQLException e) {
        String detail = e.getMessage() != null ? e.getMessage() : "";
        if (detail.contains("UNIQUE") && detail.contains("content_hash")) {
            return new DuplicateHashException(contentHash, e);
        }
        return new DatabaseException(message, e);
    }

    private void setNullableInt(PreparedStatement pstmt, int index, Integer value) throws SQLException {
        if (value != null) {
            pstmt.setInt(index, value);
        } else {
            pstmt.setNull(index, Types.INTEGER);
        }
    }

    private MediaAsset mapResultSetToAsset(ResultSet rs) throws SQLException {
        String dateStr = rs.getString("captured_at");
        MediaAsset asset = new MediaAsset(
                rs.getString("content_hash"),
                rs.getString("current_path"),
                rs.getString("original_filename"),
                dateStr != null ? LocalDateTime.parse(dateStr) : null,
                MediaType.valueOf(rs.getString("file_type")),
                rs.getLong("byte_size"));
        asset.setId(rs.getLong("id"));

        int width = rs.getInt("width");
        Integer w = rs.wasNull() ? null : width;
        int height = rs.getInt("height");
        Integer h = rs.wasNull() ? null : height;
        asset.setDimensions(w, h);
        return asset;
    }
}
