package com.identity.reconciliation.cli;

import com.identity.reconciliation.bulk.CsvRowReader;
import com.identity.reconciliation.config.ReconcilerConfig;
import com.identity.reconciliation.core.model.ChangeRow;
import com.identity.reconciliation.dispatch.Dispatcher;
import com.identity.reconciliation.dispatch.PhaseFailedException;
import com.identity.reconciliation.dispatch.RunSummary;
import com.identity.reconciliation.logging.LogContext;
import com.identity.reconciliation.metrics.MicrometerMetricsService;
import com.identity.reconciliation.reconcile.ReconcileOptions;
import com.identity.reconciliation.reconcile.RunContext;
import com.identity.reconciliation.store.DataSourceFactory;
import com.identity.reconciliation.store.SqlExecutor;
import com.identity.reconciliation.store.SqlTrace;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Command-line entry point.
 *
 * <pre>
 * SH_DSN=jdbc:mariadb://db:3306/shdb SH_USR=sh SH_PASS=... NCPUS=8 \
 *     java -jar identity-reconciliation.jar user_identities.csv user_affiliations.csv
 * </pre>
 *
 * <p>Exit status is 0 on success, 1 on any failure and 2 on a usage error.</p>
 */
public class ReconcileCommand {
    private static final Logger log = LoggerFactory.getLogger(ReconcileCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final CsvRowReader reader;
    private final Function<ReconcilerConfig, DataSource> dataSourceFactory;
    private final PrintStream out;

    public ReconcileCommand() {
        this(new CsvRowReader(), DataSourceFactory::create, System.out);
    }

    ReconcileCommand(CsvRowReader reader, Function<ReconcilerConfig, DataSource> dataSourceFactory,
                     PrintStream out) {
        this.reader = reader;
        this.dataSourceFactory = dataSourceFactory;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new ReconcileCommand().run(args, System.getenv(),
                Runtime.getRuntime().availableProcessors()));
    }

    /**
     * Runs a reconciliation and returns the process exit status.
     */
    int run(String[] args, Map<String, String> env, int hostParallelism) {
        if (args.length < 2) {
            out.println("Arguments required: user_identities_YYYYMMDDHHMI.csv user_affiliations_YYYYMMDDHHMI.csv");
            return EXIT_USAGE;
        }
        long started = System.nanoTime();
        String runId = LogContext.generateRunId();
        try (LogContext ignored = LogContext.forRun(runId)) {
            ReconcilerConfig config = ReconcilerConfig.fromEnvironment(env, hostParallelism);
            log.info("run.started files={},{} config={}", args[0], args[1], config);

            List<ChangeRow> identityRows = reader.read(Path.of(args[0]));
            List<ChangeRow> enrollmentRows = reader.read(Path.of(args[1]));

            RunSummary summary = execute(config, identityRows, enrollmentRows);
            report(summary);
            log.info("Time({}): {}", ReconcileCommand.class.getSimpleName(),
                    Duration.ofNanos(System.nanoTime() - started));
            return EXIT_OK;
        } catch (PhaseFailedException e) {
            log.error("run.failed phase={} row={} error={}", e.getPhase().label(), e.getRow(), e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("run.failed error=cannot read input: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("run.failed error={}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    private RunSummary execute(ReconcilerConfig config, List<ChangeRow> identityRows,
                               List<ChangeRow> enrollmentRows) {
        DataSource dataSource = dataSourceFactory.apply(config);
        try {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            SqlExecutor store = new SqlExecutor(dataSource, new SqlTrace(config.debugSql()));
            RunContext context = RunContext.create(store, ReconcileOptions.from(config),
                    new MicrometerMetricsService(registry));
            Dispatcher dispatcher = new Dispatcher(context, (phase, processed, total, completed) ->
                    log.info("progress phase={} {}/{}{}", phase.label(), processed, total,
                            completed ? " completed" : ""));
            RunSummary summary = dispatcher.run(identityRows, enrollmentRows);
            logTimings(registry);
            return summary;
        } finally {
            if (dataSource instanceof HikariDataSource hikari) {
                hikari.close();
            }
        }
    }

    private void report(RunSummary summary) {
        log.info("identities {}", summary.identities());
        log.info("enrollments {}", summary.enrollments());
        for (String name : summary.unresolvedOrganizations()) {
            log.warn("unresolved organization: {}", name);
        }
        for (String slug : summary.unresolvedSlugs()) {
            log.warn("unresolved project slug: {}", slug);
        }
        log.info("lookup cache hitRate={} stats={}", String.format("%.2f", summary.lookupStats().hitRate()),
                summary.lookupStats());
    }

    private static void logTimings(SimpleMeterRegistry registry) {
        for (Timer timer : registry.find("reconcile.row.duration").timers()) {
            log.info("row.timing phase={} rows={} mean={}ms max={}ms",
                    timer.getId().getTag("phase"), timer.count(),
                    String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)),
                    String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        }
    }
}
