package io.deadlockssh.constant;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class TarpitConstant {

    public static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";
    public static final int DEFAULT_PORT = 2222;
    public static final int DEFAULT_MAX_CONNECTIONS = 100;

    /**
     * Identification string of a stock Ubuntu OpenSSH server. A CRLF is appended on the wire,
     * as RFC 4253 section 4.2 requires of a real server.
     */
    public static final String DEFAULT_SSH_BANNER = "SSH-2.0-OpenSSH_8.9p1 Ubuntu-3ubuntu0.1";
    public static final String BANNER_LINE_END = "\r\n";

    // seconds
    public static final double DEFAULT_BANNER_DELAY = 0.1;
    public static final double DEFAULT_INITIAL_DELAY = 1.0;
    public static final double DEFAULT_DELAY_INCREMENT = 2.0;
    public static final double DEFAULT_MAX_DELAY = 60.0;
    public static final double DEFAULT_CONNECTION_TIMEOUT = 300;
    public static final double DEFAULT_MAX_LISTEN_TIME = 900;
    public static final double DEFAULT_SHUTDOWN_GRACE = 10;
    public static final double DEFAULT_LEDGER_ENTRY_TTL = 0;
    public static final double DEFAULT_LEDGER_SWEEP_INTERVAL = 60;

    public static final int DEFAULT_MAX_INPUT_LENGTH = 1024;
    public static final int READ_CHUNK_SIZE = 1024;
    public static final int ACCEPT_BACKLOG = 1024;

    public static final String DEFAULT_LOG_FILE = "honeypot.log";
    public static final String DEFAULT_LOG_LEVEL = "INFO";
    public static final int DEFAULT_MAX_LOG_SIZE = 10 * 1024 * 1024;
    public static final int DEFAULT_LOG_BACKUP_COUNT = 5;

    public static final int DEFAULT_HTTP_STATS_PORT = 8080;
    public static final int DEFAULT_STATS_TOP_N = 5;
    public static final int STATS_MAX_CONTENT_LENGTH = 64 * 1024;
    public static final String STATS_PATH = "/stats";

    public static final String CONFIG_SECTION = "honeypot";
    public static final String DEFAULT_CONFIG_RESOURCE = "deadlockssh.default.yml";

    public static final String EVENT_LOGGER_NAME = "deadlockssh.events";

    // system properties read by log4j2.xml
    public static final String LOG_FILE_PROPERTY = "deadlockssh.log.file";
    public static final String LOG_LEVEL_PROPERTY = "deadlockssh.log.level";
    public static final String LOG_MAX_SIZE_PROPERTY = "deadlockssh.log.maxSize";
    public static final String LOG_BACKUP_COUNT_PROPERTY = "deadlockssh.log.backupCount";
}
