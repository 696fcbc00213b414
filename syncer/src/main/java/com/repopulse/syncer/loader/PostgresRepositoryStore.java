package com.repopulse.syncer.loader;

import com.repopulse.syncer.model.DailyActivity;
import com.repopulse.syncer.model.RepositorySnapshot;
import com.repopulse.syncer.model.StoredRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.SqlArrayValue;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Types;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * PostgreSQL writer for repositories, activity and rank snapshots.
 *
 * <p>Every write is conditional so that a run over unchanged remote data
 * writes nothing. Units of work run through a {@link TransactionTemplate};
 * statements issued inside one share its connection. Requires PostgreSQL 15+
 * for {@code MERGE}.</p>
 */
public class PostgresRepositoryStore implements RepositoryStore {

    private static final Logger logger = LoggerFactory.getLogger(PostgresRepositoryStore.class);

    static final String SQL_SNAPSHOT_RANKS = """
            MERGE INTO rank_snapshot AS s
            USING (
                SELECT id, RANK() OVER (ORDER BY stars DESC) AS place
                FROM repositories
            ) AS c
            ON s.repo_id = c.id
            WHEN MATCHED AND s.previous_place <> c.place THEN
                UPDATE SET previous_place = c.place
            WHEN NOT MATCHED THEN
                INSERT (repo_id, previous_place) VALUES (c.id, c.place)""";

    static final String SQL_FIND_REPOSITORIES = """
            SELECT r.id, r.owner, r.name, MAX(a.date) AS last_activity_date
            FROM repositories r
            LEFT JOIN activity a ON a.repo_id = r.id
            WHERE r.id BETWEEN :minId AND :maxId
            GROUP BY r.id, r.owner, r.name
            ORDER BY r.id""";

    static final String SQL_FIND_FULL_NAMES = "SELECT owner, name FROM repositories";

    static final String SQL_HIGH_WATER_MARK = "SELECT MAX(github_id) FROM repositories";

    static final String SQL_UPDATE_REPOSITORY = """
            UPDATE repositories
            SET stars = :stars, watchers = :watchers, forks = :forks,
                open_issues = :openIssues, language = :language
            WHERE id = :id
              AND (stars <> :stars
                   OR watchers <> :watchers
                   OR forks <> :forks
                   OR open_issues <> :openIssues
                   OR language IS DISTINCT FROM :language)""";

    // The driver appends RETURNING for the requested key column.
    static final String SQL_INSERT_REPOSITORY = """
            INSERT INTO repositories (github_id, owner, name, stars, watchers, forks, open_issues, language)
            VALUES (:githubId, :owner, :name, :stars, :watchers, :forks, :openIssues, :language)
            ON CONFLICT DO NOTHING""";

    static final String SQL_UPSERT_ACTIVITY = """
            INSERT INTO activity (repo_id, date, commits, authors)
            VALUES (:repoId, :date, :commits, :authors)
            ON CONFLICT ON CONSTRAINT activity_repo_id_date_key DO UPDATE
            SET commits = EXCLUDED.commits, authors = EXCLUDED.authors
            WHERE activity.commits <> EXCLUDED.commits
               OR activity.authors <> EXCLUDED.authors""";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public PostgresRepositoryStore(DataSource dataSource) {
        this(new NamedParameterJdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    PostgresRepositoryStore(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactions) {
        this.jdbc = jdbc;
        this.transactions = transactions;
    }

    // =========================================================================
    // Schema management
    // =========================================================================

    @Override
    public void ensureSchema() {
        for (String ddl : PostgresSchemas.createStatements()) {
            jdbc.getJdbcTemplate().execute(ddl);
        }
        logger.debug("Schema verified: {}, {}, {}", PostgresSchemas.TABLE_REPOSITORIES,
                PostgresSchemas.TABLE_ACTIVITY, PostgresSchemas.TABLE_RANK_SNAPSHOT);
    }

    // =========================================================================
    // Reads
    // =========================================================================

    @Override
    public List<StoredRepository> findRepositories(long minId, long maxId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("minId", minId)
                .addValue("maxId", maxId);
        return jdbc.query(SQL_FIND_REPOSITORIES, params, (rs, rowNum) -> new StoredRepository(
                rs.getLong("id"),
                rs.getString("owner"),
                rs.getString("name"),
                rs.getObject("last_activity_date", LocalDate.class)));
    }

    @Override
    public Set<String> findAllFullNames() {
        Set<String> names = new HashSet<>();
        jdbc.query(SQL_FIND_FULL_NAMES, new MapSqlParameterSource(),
                rs -> {
                    names.add(rs.getString("owner") + "/" + rs.getString("name"));
                });
        return names;
    }

    @Override
    public OptionalLong findHighWaterMark() {
        Long value = jdbc.getJdbcTemplate().queryForObject(SQL_HIGH_WATER_MARK, Long.class);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    // =========================================================================
    // Writes
    // =========================================================================

    @Override
    public int snapshotRanks() {
        Integer written = transactions.execute(status ->
                jdbc.update(SQL_SNAPSHOT_RANKS, new MapSqlParameterSource()));
        int count = written == null ? 0 : written;
        logger.info("Merged rank snapshot ({} rows written)", count);
        return count;
    }

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        return transactions.execute(status -> work.execute(new JdbcStoreTransaction(jdbc)));
    }

    /**
     * Write primitives. Must be called inside a {@link TransactionTemplate}
     * callback so that they all use the transaction's connection.
     */
    static final class JdbcStoreTransaction implements StoreTransaction {

        private final NamedParameterJdbcTemplate jdbc;

        JdbcStoreTransaction(NamedParameterJdbcTemplate jdbc) {
            this.jdbc = jdbc;
        }

        @Override
        public boolean updateRepositoryIfChanged(long repoId, RepositorySnapshot snapshot) {
            MapSqlParameterSource params = attributes(snapshot).addValue("id", repoId);
            return jdbc.update(SQL_UPDATE_REPOSITORY, params) > 0;
        }

        @Override
        public InsertResult insertRepositoryIfAbsent(RepositorySnapshot snapshot) {
            MapSqlParameterSource params = attributes(snapshot)
                    .addValue("githubId", snapshot.githubId())
                    .addValue("owner", snapshot.owner())
                    .addValue("name", snapshot.name());
            KeyHolder keyHolder = new GeneratedKeyHolder();
            int inserted = jdbc.update(SQL_INSERT_REPOSITORY, params, keyHolder, new String[]{"id"});
            Number id = keyHolder.getKey();
            return inserted > 0 && id != null
                    ? InsertResult.inserted(id.longValue())
                    : InsertResult.alreadyExisted();
        }

        @Override
        public boolean upsertActivity(long repoId, DailyActivity activity) {
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("repoId", repoId)
                    .addValue("date", activity.date())
                    .addValue("commits", activity.commits())
                    .addValue("authors", new SqlArrayValue("varchar", activity.sortedAuthors().toArray()));
            return jdbc.update(SQL_UPSERT_ACTIVITY, params) > 0;
        }

        /**
         * Stars, watchers, forks, open issues and language. A missing language
         * is bound as a typed null.
         */
        private static MapSqlParameterSource attributes(RepositorySnapshot snapshot) {
            return new MapSqlParameterSource()
                    .addValue("stars", snapshot.stars())
                    .addValue("watchers", snapshot.watchers())
                    .addValue("forks", snapshot.forks())
                    .addValue("openIssues", snapshot.openIssues())
                    .addValue("language", snapshot.language(), Types.VARCHAR);
        }
    }
}
