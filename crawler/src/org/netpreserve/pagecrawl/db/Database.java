package org.netpreserve.pagecrawl.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.config.JdbiConfig;
import org.jdbi.v3.core.generic.GenericType;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.ParsedSql;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.netpreserve.pagecrawl.PageMetadata;
import org.netpreserve.pagecrawl.SchemaMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public interface Database extends AutoCloseable, Transactional<Database> {
    /**
     * Stored in {@code PRAGMA user_version}. Bump whenever schema.sql changes incompatibly.
     */
    int SCHEMA_VERSION = 1;

    static Database newDatabaseInMemory() {
        return open("jdbc:sqlite::memory:");
    }

    static Database open(Path path) {
        return open("jdbc:sqlite:" + path);
    }

    static Database open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setConnectionInitSql("PRAGMA synchronous = NORMAL; PRAGMA foreign_keys = ON; PRAGMA busy_timeout = 60000;");
        config.setMaximumPoolSize(1);
        // an in-memory database lives only as long as its single connection
        config.setMaxLifetime(0);
        var dataSource = new HikariDataSource(config);
        var jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.registerColumnMapper(new GenericType<List<String>>() {
        }, jsonColumnMapper(json -> Json.read(json, Json.STRING_LIST)));
        jdbi.registerColumnMapper(new GenericType<Map<String, Object>>() {
        }, jsonColumnMapper(json -> Json.read(json, Json.OBJECT_MAP)));
        jdbi.registerColumnMapper(PageMetadata.class, jsonColumnMapper(json -> Json.read(json, PageMetadata.class)));
        jdbi.getConfig(DataSourceHolder.class).dataSource = dataSource;
        jdbi.setSqlLogger(new SqlLogger() {
            private static final Logger log = LoggerFactory.getLogger(Database.class);

            @Override
            public void logAfterExecution(StatementContext context) {
                if (context.getExecutionMoment() == null || context.getCompletionMoment() == null) return;
                var duration = Duration.between(context.getExecutionMoment(), context.getCompletionMoment());
                var durationMillis = duration.toMillis();
                if (durationMillis > 100) {
                    ParsedSql parsedSql = context.getParsedSql();
                    String sql = parsedSql != null ? parsedSql.getSql() : "<sql unavailable>";
                    log.warn("[Slow SQL] {}ms {}", durationMillis, sql);
                }
            }
        });
        Database db = jdbi.onDemand(Database.class);
        try {
            db.init();
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
        return db;
    }

    private static <T> ColumnMapper<T> jsonColumnMapper(Function<String, T> reader) {
        return (r, col, ctx) -> {
            String value = r.getString(col);
            return value == null ? null : reader.apply(value);
        };
    }

    /**
     * Creates the schema in a new database, or checks that an existing database has the schema version we expect.
     *
     * @throws SchemaMismatchException if the database was created by an incompatible version
     */
    default void init() {
        int version = withHandle(handle -> handle.createQuery("PRAGMA user_version").mapTo(Integer.class).one());
        if (version == SCHEMA_VERSION) return;
        if (version != 0) {
            throw new SchemaMismatchException("Database schema version is " + version + " but this version of " +
                                              "pagecrawl expects " + SCHEMA_VERSION);
        }
        int tables = withHandle(handle -> handle.createQuery("SELECT COUNT(*) FROM sqlite_master " +
                                                             "WHERE type = 'table' AND name IN ('jobs', 'pages')")
                .mapTo(Integer.class).one());
        if (tables > 0) {
            throw new SchemaMismatchException("Database has tables from an unversioned schema");
        }
        // we can't use @SqlScript because we need to use executeAsSeparateStatements() on sqlite
        try (var stream = Objects.requireNonNull(Database.class.getResourceAsStream("schema.sql"), "missing schema.sql")) {
            var schema = new String(stream.readAllBytes());
            useHandle(handle -> handle.createScript(schema).executeAsSeparateStatements());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @CreateSqlObject
    JobDAO jobs();

    @CreateSqlObject
    PageDAO pages();

    @CreateSqlObject
    ErrorLogDAO errorLog();

    default HikariDataSource dataSource() {
        return withHandle(handle -> handle.getConfig(DataSourceHolder.class).dataSource);
    }

    default void close() {
        dataSource().close();
    }

    static Instant now() {
        return Instant.ofEpochMilli(System.currentTimeMillis());
    }

    class DataSourceHolder implements JdbiConfig<DataSourceHolder> {
        private HikariDataSource dataSource;

        public DataSourceHolder() {
        }

        @Override
        public DataSourceHolder createCopy() {
            var copy = new DataSourceHolder();
            copy.dataSource = dataSource;
            return copy;
        }
    }
}
