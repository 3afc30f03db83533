package com.filefinder.catalog;

import org.sqlite.Function;

import java.io.File;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 文件/文件夹目录库，外加键值元数据表。
 *
 * 按逻辑操作打开与关闭，不跨进程生命周期持有连接；每条写入都是单行自动提交语句。
 */
public final class FileCatalog implements AutoCloseable {
    private static final String CREATE_FILES_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS files (
                id            INTEGER PRIMARY KEY AUTOINCREMENT,
                name          TEXT,
                path          TEXT UNIQUE,
                type          TEXT,
                extension     TEXT,
                parent        TEXT,
                last_modified INTEGER,
                size          INTEGER
            )
            """;

    private static final String CREATE_META_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS meta (
                key   TEXT PRIMARY KEY,
                value TEXT
            )
            """;

    private static final String CREATE_IDX_NAME_SQL = "CREATE INDEX IF NOT EXISTS idx_name ON files(name)";
    private static final String CREATE_IDX_PATH_SQL = "CREATE INDEX IF NOT EXISTS idx_path ON files(path)";
    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";

    /** SQLite 内置 lower() 只折叠 ASCII，候选粗筛改用与 Java 侧一致的小写函数 */
    private static final String UNICODE_LOWER_FUNCTION = "unicode_lower";

    private static final String SELECT_COLUMNS = "SELECT id, name, path, type, extension, parent, last_modified, size FROM files";

    private final Connection connection;

    /**
     * 打开（必要时创建）目录库并初始化表结构。
     */
    public FileCatalog(Path dbPath) {
        try {
            Path absolutePath = dbPath.toAbsolutePath();
            if (absolutePath.getParent() != null) {
                absolutePath.getParent().toFile().mkdirs();
            }
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + absolutePath);
            initializeSchema();
            registerUnicodeLower();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("初始化目录库失败: " + dbPath, sqlException);
        }
    }

    /**
     * 路径不存在时插入条目，已存在则不做任何修改。
     *
     * @return 是否新插入了一行
     */
    public boolean insertIfAbsent(FileEntry entry) {
        String sql = """
                INSERT OR IGNORE INTO files(name, path, type, extension, parent, last_modified, size)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            bindEntry(preparedStatement, entry);
            return preparedStatement.executeUpdate() > 0;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("插入条目失败, path=" + entry.path(), sqlException);
        }
    }

    /**
     * 插入条目；路径已存在时只刷新修改时间与大小。
     */
    public void upsert(FileEntry entry) {
        String sql = """
                INSERT INTO files(name, path, type, extension, parent, last_modified, size)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(path) DO UPDATE SET
                    last_modified = excluded.last_modified,
                    size = excluded.size
                """;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            bindEntry(preparedStatement, entry);
            preparedStatement.executeUpdate();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("更新条目失败, path=" + entry.path(), sqlException);
        }
    }

    /**
     * 返回根目录之下全部条目的 path → 修改时间（毫秒）。
     * 前缀按分隔符边界、大小写敏感匹配，"/data/docs" 不会命中 "/data/docs2"。
     */
    public Map<String, Long> entriesWithPathPrefix(String root) {
        String prefix = root.endsWith(File.separator) ? root : root + File.separator;
        String sql = "SELECT path, last_modified FROM files WHERE substr(path, 1, ?) = ?";
        Map<String, Long> timestamps = new HashMap<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, prefix.length());
            preparedStatement.setString(2, prefix);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    timestamps.put(resultSet.getString(1), resultSet.getLong(2));
                }
            }
            return timestamps;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按根目录查询条目失败, root=" + root, sqlException);
        }
    }

    /**
     * 按路径删除条目。
     */
    public boolean deleteByPath(String path) {
        try (PreparedStatement preparedStatement = connection.prepareStatement("DELETE FROM files WHERE path = ?")) {
            preparedStatement.setString(1, path);
            return preparedStatement.executeUpdate() > 0;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按路径删除失败, path=" + path, sqlException);
        }
    }

    /**
     * 按路径查找条目。
     */
    public Optional<FileEntry> findByPath(String path) {
        try (PreparedStatement preparedStatement = connection.prepareStatement(SELECT_COLUMNS + " WHERE path = ?")) {
            preparedStatement.setString(1, path);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(readEntry(resultSet));
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按路径查询失败, path=" + path, sqlException);
        }
    }

    /**
     * 粗筛候选：每个词都必须是 name 或 path 的子串（大小写不敏感），按 id 排序并截断到 cap 行。
     */
    public List<FileEntry> queryCandidates(List<String> tokens, int cap) {
        if (tokens == null || tokens.isEmpty() || cap <= 0) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE ");
        for (int index = 0; index < tokens.size(); index++) {
            if (index > 0) {
                sql.append(" AND ");
            }
            sql.append("(instr(" + UNICODE_LOWER_FUNCTION + "(name), ?) > 0 OR instr(" + UNICODE_LOWER_FUNCTION + "(path), ?) > 0)");
        }
        sql.append(" ORDER BY id LIMIT ?");

        List<FileEntry> candidates = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql.toString())) {
            int parameterIndex = 1;
            for (String token : tokens) {
                String lowered = token.toLowerCase(Locale.ROOT);
                preparedStatement.setString(parameterIndex++, lowered);
                preparedStatement.setString(parameterIndex++, lowered);
            }
            preparedStatement.setInt(parameterIndex, cap);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    candidates.add(readEntry(resultSet));
                }
            }
            return candidates;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("候选查询失败, tokens=" + tokens, sqlException);
        }
    }

    public Optional<String> getMeta(String key) {
        try (PreparedStatement preparedStatement = connection.prepareStatement("SELECT value FROM meta WHERE key = ?")) {
            preparedStatement.setString(1, key);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                return resultSet.next() ? Optional.ofNullable(resultSet.getString(1)) : Optional.empty();
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取元数据失败, key=" + key, sqlException);
        }
    }

    public void setMeta(String key, String value) {
        try (PreparedStatement preparedStatement = connection.prepareStatement(
                "INSERT OR REPLACE INTO meta(key, value) VALUES (?, ?)")) {
            preparedStatement.setString(1, key);
            preparedStatement.setString(2, value);
            preparedStatement.executeUpdate();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("写入元数据失败, key=" + key, sqlException);
        }
    }

    /**
     * 获取条目总数。
     */
    public int totalCount() {
        try (PreparedStatement preparedStatement = connection.prepareStatement("SELECT COUNT(*) FROM files");
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.getInt(1);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询条目总数失败", sqlException);
        }
    }

    public int countByKind(EntryKind kind) {
        try (PreparedStatement preparedStatement = connection.prepareStatement("SELECT COUNT(*) FROM files WHERE type = ?")) {
            preparedStatement.setString(1, kind.columnValue());
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                return resultSet.getInt(1);
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按类型统计失败, kind=" + kind, sqlException);
        }
    }

    /**
     * 关闭数据库连接。
     */
    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭数据库连接失败", sqlException);
        }
    }

    private void initializeSchema() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(ENABLE_WAL_SQL);
        }

        connection.setAutoCommit(false);
        try (Statement statement = connection.createStatement()) {
            statement.execute(CREATE_FILES_TABLE_SQL);
            statement.execute(CREATE_META_TABLE_SQL);
            statement.execute(CREATE_IDX_NAME_SQL);
            statement.execute(CREATE_IDX_PATH_SQL);
            connection.commit();
        } catch (SQLException sqlException) {
            connection.rollback();
            throw sqlException;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    private void registerUnicodeLower() throws SQLException {
        Function.create(connection, UNICODE_LOWER_FUNCTION, new Function() {
            @Override
            protected void xFunc() throws SQLException {
                String text = value_text(0);
                result(text == null ? null : text.toLowerCase(Locale.ROOT));
            }
        });
    }

    private void bindEntry(PreparedStatement preparedStatement, FileEntry entry) throws SQLException {
        preparedStatement.setString(1, entry.name());
        preparedStatement.setString(2, entry.path());
        preparedStatement.setString(3, entry.kind().columnValue());
        preparedStatement.setString(4, entry.extension());
        preparedStatement.setString(5, entry.parentDirName());
        preparedStatement.setLong(6, entry.lastModified().toEpochMilli());
        preparedStatement.setLong(7, entry.sizeBytes());
    }

    private FileEntry readEntry(ResultSet resultSet) throws SQLException {
        return new FileEntry(
                resultSet.getLong("id"),
                resultSet.getString("name"),
                resultSet.getString("path"),
                EntryKind.parse(resultSet.getString("type")),
                resultSet.getString("extension"),
                resultSet.getString("parent"),
                Instant.ofEpochMilli(resultSet.getLong("last_modified")),
                resultSet.getLong("size")
        );
    }
}
