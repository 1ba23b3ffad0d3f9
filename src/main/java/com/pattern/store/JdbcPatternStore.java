package com.pattern.store;

import com.pattern.config.StoreConfig;
import com.pattern.core.Pattern;
import com.pattern.exception.StorageException;
import com.pattern.exception.ValidationException;
import com.pattern.sandbox.ScriptValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link PatternStore} on a relational database, SQLite by default.
 * <p>
 * Creates go through a single-writer lock and their own transaction, so ids
 * never collide and a record is visible to {@link #list()} only once committed.
 * Ids come from an AUTOINCREMENT key and are never reused.
 */
public class JdbcPatternStore implements PatternStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPatternStore.class);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS patterns (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                script TEXT NOT NULL,
                description TEXT,
                examples TEXT
            )""";

    private static final String INSERT =
            "INSERT INTO patterns (name, script, description, examples) VALUES (?, ?, ?, ?)";
    private static final String LAST_ID = "SELECT last_insert_rowid()";
    private static final String SELECT_ALL =
            "SELECT id, name, script, description, examples FROM patterns ORDER BY id";
    private static final String SELECT_BY_ID =
            "SELECT id, name, script, description, examples FROM patterns WHERE id = ?";

    private static final RowMapper<Pattern> ROW_MAPPER = (rs, rowNum) -> new Pattern(
            String.valueOf(rs.getLong("id")),
            rs.getString("name"),
            rs.getString("script"),
            rs.getString("description"),
            rs.getString("examples"));

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate writeTx;
    private final ScriptValidator validator;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JdbcPatternStore(DataSource dataSource, ScriptValidator validator) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.writeTx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.validator = validator;
        initSchema();
    }

    /**
     * Open (creating if needed) the SQLite database described by the config.
     */
    public static JdbcPatternStore open(StoreConfig config, ScriptValidator validator) {
        return new JdbcPatternStore(dataSource(config), validator);
    }

    /**
     * SQLite data source in WAL mode, so readers are not blocked by a writer.
     * Parent directories of the database file are created.
     */
    public static DataSource dataSource(StoreConfig config) {
        Path path = Path.of(config.databasePath()).toAbsolutePath();
        Path parent = path.getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new StorageException("Cannot create database directory " + parent, e);
            }
        }

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setBusyTimeout(config.busyTimeoutMs());

        SQLiteDataSource dataSource = new SQLiteDataSource(sqlite);
        dataSource.setUrl("jdbc:sqlite:" + path);
        return dataSource;
    }

    private void initSchema() {
        try {
            jdbcTemplate.execute(CREATE_TABLE);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to initialize pattern schema", e);
        }
        log.info("JdbcPatternStore initialized");
    }

    @Override
    public String create(String name, String script, String description, String examples) {
        requireText("name", name);
        requireText("script", script);
        validator.validate(script);

        writeLock.lock();
        try {
            Long id = writeTx.execute(status -> {
                jdbcTemplate.update(INSERT, name, script, description, examples);
                return jdbcTemplate.queryForObject(LAST_ID, Long.class);
            });
            if (id == null) {
                throw new StorageException("Insert of pattern '" + name + "' returned no id");
            }
            log.info("Created pattern {} ('{}')", id, name);
            return String.valueOf(id);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("Failed to create pattern '" + name + "'", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Pattern> list() {
        try {
            return jdbcTemplate.query(SELECT_ALL, ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list patterns", e);
        }
    }

    @Override
    public Optional<Pattern> findById(String id) {
        long key;
        try {
            key = Long.parseLong(id);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        try {
            return jdbcTemplate.query(SELECT_BY_ID, ROW_MAPPER, key).stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read pattern " + id, e);
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Pattern " + field + " is required");
        }
    }
}
