package com.repopulse.syncer.orchestrator;

import com.repopulse.syncer.client.GitHubApiClient;
import com.repopulse.syncer.config.AppConfig;
import com.repopulse.syncer.config.SyncOptions;
import com.repopulse.syncer.loader.PostgresRepositoryStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the RepoPulse synchronizer.
 * Parses CLI arguments, initializes components, runs one synchronization and
 * exits with appropriate status codes.
 *
 * <p>Usage:
 * <pre>
 *   java -jar syncer.jar                      # all phases
 *   java -jar syncer.jar --skip-rank-update   # keep the previous rank snapshot
 *   java -jar syncer.jar --skip-repo-update   # only discover new repositories
 * </pre>
 *
 * <p>Repositories that could not be read from GitHub are reported but do not
 * fail the run; they are retried next time.</p>
 */
public class SyncerApp {

    private static final Logger logger = LoggerFactory.getLogger(SyncerApp.class);

    static final String FLAG_SKIP_RANK_UPDATE = "--skip-rank-update";
    static final String FLAG_SKIP_REPO_UPDATE = "--skip-repo-update";

    public static void main(String[] args) {
        logger.info("Starting RepoPulse Syncer");

        try {
            AppConfig config = new AppConfig();
            SyncOptions options = applyFlags(config.getSyncOptions(), args);

            GitHubApiClient client = new GitHubApiClient(config.getGithubToken(), config.getGithubApiUrl(),
                    config.getGithubMaxRetries(), GitHubApiClient.defaultHttpClient());

            SyncSummary summary;
            try (HikariDataSource dataSource = createDataSource(config, options)) {
                SyncOrchestrator orchestrator = new SyncOrchestrator(client, new PostgresRepositoryStore(dataSource));
                summary = orchestrator.run(options);
            }

            printSummary(summary);
            logger.info("RepoPulse Syncer finished.");
            System.exit(0);

        } catch (Exception e) {
            logger.error("Fatal error during synchronization", e);
            System.exit(1);
        }
    }

    /**
     * Applies command-line flags on top of the configured options. Unknown
     * arguments are rejected.
     */
    static SyncOptions applyFlags(SyncOptions options, String[] args) {
        SyncOptions result = options;
        for (String arg : args) {
            if (FLAG_SKIP_RANK_UPDATE.equals(arg)) {
                result = result.withSkipRankUpdate(true);
            } else if (FLAG_SKIP_REPO_UPDATE.equals(arg)) {
                result = result.withSkipRepoUpdate(true);
            } else {
                throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        return result;
    }

    private static HikariDataSource createDataSource(AppConfig config, SyncOptions options) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("repo-pulse");
        hikari.setJdbcUrl(config.getDatabaseUrl());
        if (config.getDatabaseUser() != null) {
            hikari.setUsername(config.getDatabaseUser());
        }
        if (config.getDatabasePassword() != null) {
            hikari.setPassword(config.getDatabasePassword());
        }
        // One connection per refresh worker plus one for the orchestrator's reads.
        hikari.setMaximumPoolSize(options.workers() + 1);
        return new HikariDataSource(hikari);
    }

    private static void printSummary(SyncSummary summary) {
        System.out.println();
        System.out.println("=== RepoPulse Synchronization Summary ===");
        System.out.println("Duration: " + summary.totalDurationMs() + "ms");
        System.out.println("Results:  " + summary.successCount() + " successful, "
                + summary.failureCount() + " failed");

        System.out.println();
        System.out.println("Phase breakdown:");
        printPhaseLine(summary, SyncOrchestrator.PHASE_RANKS);
        printPhaseLine(summary, SyncOrchestrator.PHASE_UPDATE);
        printPhaseLine(summary, SyncOrchestrator.PHASE_DISCOVER);

        if (summary.hasFailures()) {
            System.out.println();
            System.out.println("Failures:");
            summary.results().stream()
                    .filter(r -> !r.success())
                    .forEach(r -> System.out.println("  - " + r.phase()
                            + " [" + r.repoFullName() + "]: " + r.errorMessage()));
        }
        System.out.println();
    }

    private static void printPhaseLine(SyncSummary summary, String phase) {
        System.out.printf("  %-14s written=%-6d ok=%-6d failed=%d%n",
                phase, summary.rowsWrittenForPhase(phase),
                summary.countForPhase(phase, true), summary.countForPhase(phase, false));
    }
}
