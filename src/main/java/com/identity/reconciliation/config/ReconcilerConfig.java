package com.identity.reconciliation.config;

import java.util.Map;

/**
 * Process configuration read from environment variables.
 *
 * <p>Recognized variables:</p>
 * <ul>
 *   <li>{@code ST} - any value forces a single worker</li>
 *   <li>{@code NCPUS} - worker count, capped at the host parallelism</li>
 *   <li>{@code DRY} - any value enables dry-run mode</li>
 *   <li>{@code DEBUG} - any value enables the per-row operation trace</li>
 *   <li>{@code DEBUG_SQL} - any value logs every generated statement</li>
 *   <li>{@code SH_DSN} - full JDBC URL, or a driver-style
 *       {@code user:password@tcp(host:port)/dbname} DSN; when absent the URL is assembled from
 *       {@code SH_HOST}, {@code SH_PORT}, {@code SH_DB} and {@code SH_PARAMS}</li>
 *   <li>{@code SH_USR} / {@code SH_USER}, {@code SH_PASS} - credentials</li>
 * </ul>
 *
 * @param jdbcUrl   store JDBC URL
 * @param user      store user, may be empty
 * @param password  store password, may be empty
 * @param threads   worker pool size, at least 1
 * @param dryRun    preview changes without writing
 * @param debug     per-row operation trace
 * @param debugSql  log every generated statement
 */
public record ReconcilerConfig(
        String jdbcUrl,
        String user,
        String password,
        int threads,
        boolean dryRun,
        boolean debug,
        boolean debugSql
) {
    static final String PREFIX = "SH_";
    static final String DEFAULT_HOST = "localhost";
    static final String DEFAULT_PORT = "3306";
    static final String DEFAULT_PARAMS = "?characterEncoding=utf8";

    public ReconcilerConfig {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl is required");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        user = user != null ? user : "";
        password = password != null ? password : "";
    }

    /**
     * Builds the configuration from the current process environment.
     */
    public static ReconcilerConfig fromEnvironment() {
        return fromEnvironment(System.getenv(), Runtime.getRuntime().availableProcessors());
    }

    /**
     * Builds the configuration from the given variables.
     *
     * @param env            environment variables
     * @param hostParallelism number of processors available on the host
     * @throws IllegalArgumentException if a variable is malformed or the database name is missing
     */
    public static ReconcilerConfig fromEnvironment(Map<String, String> env, int hostParallelism) {
        String dsn = value(env, PREFIX + "DSN");
        DriverDsn driverDsn = !dsn.isEmpty() && !dsn.startsWith("jdbc:") ? DriverDsn.parse(dsn) : null;

        String user = value(env, PREFIX + "USR");
        if (user.isEmpty()) {
            user = value(env, PREFIX + "USER");
        }
        String password = value(env, PREFIX + "PASS");
        if (driverDsn != null) {
            user = user.isEmpty() ? driverDsn.user() : user;
            password = password.isEmpty() ? driverDsn.password() : password;
        }
        return new ReconcilerConfig(
                driverDsn != null ? driverDsn.jdbcUrl() : jdbcUrl(env),
                user,
                password,
                threads(env, hostParallelism),
                isSet(env, "DRY"),
                isSet(env, "DEBUG"),
                isSet(env, "DEBUG_SQL"));
    }

    /**
     * Resolves the worker count: {@code ST} forces 1, a positive {@code NCPUS} is honored up to
     * the host parallelism, anything else defaults to the host parallelism.
     */
    static int threads(Map<String, String> env, int hostParallelism) {
        int host = Math.max(1, hostParallelism);
        if (isSet(env, "ST")) {
            return 1;
        }
        String requested = value(env, "NCPUS");
        if (!requested.isEmpty()) {
            int n;
            try {
                n = Integer.parseInt(requested.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("NCPUS must be an integer, got '" + requested + "'", e);
            }
            if (n > 0) {
                return Math.min(n, host);
            }
        }
        return host;
    }

    static String jdbcUrl(Map<String, String> env) {
        String dsn = value(env, PREFIX + "DSN");
        if (!dsn.isEmpty()) {
            return dsn;
        }
        String db = value(env, PREFIX + "DB");
        if (db.isEmpty()) {
            throw new IllegalArgumentException("please specify database via " + PREFIX + "DB=...");
        }
        String host = value(env, PREFIX + "HOST");
        String port = value(env, PREFIX + "PORT");
        String params = value(env, PREFIX + "PARAMS");
        if (params.isEmpty()) {
            params = DEFAULT_PARAMS;
        } else if (params.equals("-")) {
            params = "";
        }
        return "jdbc:mariadb://" + (host.isEmpty() ? DEFAULT_HOST : host)
                + ":" + (port.isEmpty() ? DEFAULT_PORT : port)
                + "/" + db + params;
    }

    private static String value(Map<String, String> env, String name) {
        String v = env.get(name);
        return v != null ? v : "";
    }

    private static boolean isSet(Map<String, String> env, String name) {
        return !value(env, name).isEmpty();
    }

    @Override
    public String toString() {
        return "ReconcilerConfig{url=" + jdbcUrl +
                ", user=" + user +
                ", threads=" + threads +
                ", dryRun=" + dryRun +
                ", debug=" + debug +
                ", debugSql=" + debugSql + '}';
    }
}
