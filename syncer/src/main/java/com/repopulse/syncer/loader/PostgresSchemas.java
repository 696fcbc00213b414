package com.repopulse.syncer.loader;

import java.util.List;

/**
 * Table names and DDL of the PostgreSQL schema. The read-only query service
 * consumes the same tables.
 */
public final class PostgresSchemas {

    private PostgresSchemas() {}

    public static final String TABLE_REPOSITORIES = "repositories";
    public static final String TABLE_ACTIVITY = "activity";
    public static final String TABLE_RANK_SNAPSHOT = "rank_snapshot";

    static final String CREATE_REPOSITORIES = """
            CREATE TABLE IF NOT EXISTS repositories (
                id          BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                github_id   BIGINT UNIQUE,
                owner       VARCHAR(39)  NOT NULL,
                name        VARCHAR(100) NOT NULL,
                stars       INTEGER      NOT NULL,
                watchers    INTEGER      NOT NULL,
                forks       INTEGER      NOT NULL,
                open_issues INTEGER      NOT NULL,
                language    VARCHAR(100),
                CONSTRAINT repositories_owner_name_key UNIQUE (owner, name)
            )""";

    static final String CREATE_ACTIVITY = """
            CREATE TABLE IF NOT EXISTS activity (
                repo_id BIGINT         NOT NULL REFERENCES repositories (id),
                date    DATE           NOT NULL,
                commits INTEGER        NOT NULL CHECK (commits > 0),
                authors VARCHAR(100)[] NOT NULL,
                CONSTRAINT activity_repo_id_date_key UNIQUE (repo_id, date)
            )""";

    static final String CREATE_RANK_SNAPSHOT = """
            CREATE TABLE IF NOT EXISTS rank_snapshot (
                repo_id        BIGINT PRIMARY KEY REFERENCES repositories (id),
                previous_place BIGINT NOT NULL
            )""";

    /**
     * DDL statements in dependency order.
     */
    public static List<String> createStatements() {
        return List.of(CREATE_REPOSITORIES, CREATE_ACTIVITY, CREATE_RANK_SNAPSHOT);
    }
}
