package com.identity.reconciliation.config;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A MySQL driver-style DSN, {@code [user[:password]@][tcp[(host[:port])]]/dbname[?params]},
 * as accepted by the import scripts, translated to a MariaDB JDBC URL.
 *
 * <p>Driver parameters are specific to the original client and are replaced by the default
 * JDBC parameters.</p>
 */
record DriverDsn(String user, String password, String host, String port, String database) {

    // the last '@' separates credentials, so passwords may contain '@'
    private static final Pattern FORMAT = Pattern.compile(
            "^(?:(?<credentials>.*)@)?(?:(?<protocol>\\w+)(?:\\((?<address>[^)]*)\\))?)?/(?<db>[^/?]*)(?:\\?.*)?$");

    /**
     * @throws IllegalArgumentException if the value is not a TCP driver DSN with a database name
     */
    static DriverDsn parse(String dsn) {
        Matcher m = FORMAT.matcher(dsn);
        if (!m.matches()) {
            throw new IllegalArgumentException(
                    "SH_DSN must be a jdbc: URL or user:password@tcp(host:port)/dbname");
        }
        String protocol = m.group("protocol");
        if (protocol != null && !protocol.equals("tcp")) {
            throw new IllegalArgumentException("SH_DSN protocol '" + protocol + "' is not supported, use tcp");
        }
        String db = m.group("db");
        if (db.isEmpty()) {
            throw new IllegalArgumentException("SH_DSN must name a database");
        }

        String user = "";
        String password = "";
        String credentials = m.group("credentials");
        if (credentials != null) {
            int colon = credentials.indexOf(':');
            user = colon < 0 ? credentials : credentials.substring(0, colon);
            password = colon < 0 ? "" : credentials.substring(colon + 1);
        }

        String host = ReconcilerConfig.DEFAULT_HOST;
        String port = ReconcilerConfig.DEFAULT_PORT;
        String address = m.group("address");
        if (address != null && !address.isEmpty()) {
            int colon = address.lastIndexOf(':');
            if (colon < 0) {
                host = address;
            } else {
                host = colon > 0 ? address.substring(0, colon) : host;
                port = colon < address.length() - 1 ? address.substring(colon + 1) : port;
            }
        }
        return new DriverDsn(user, password, host, port, db);
    }

    String jdbcUrl() {
        return "jdbc:mariadb://" + host + ":" + port + "/" + database + ReconcilerConfig.DEFAULT_PARAMS;
    }

    @Override
    public String toString() {
        return "DriverDsn{user=" + user + ", host=" + host + ", port=" + port + ", database=" + database + '}';
    }
}
