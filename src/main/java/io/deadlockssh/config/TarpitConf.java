package io.deadlockssh.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.deadlockssh.TarpitException;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.apache.logging.log4j.Level;

import java.time.Duration;

import static io.deadlockssh.TarpitExceptionType.CONFIG_INVALID;
import static io.deadlockssh.constant.TarpitConstant.*;
import static io.deadlockssh.utils.TimeUtils.seconds;
import static java.util.Objects.nonNull;
import static org.apache.commons.lang3.StringUtils.isBlank;
import static org.apache.commons.lang3.StringUtils.isEmpty;

/**
 * Settings of the {@code honeypot} section. Delays and timeouts are in (fractional) seconds.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
public class TarpitConf {

    @JsonProperty("bind_address")
    private String bindAddress = DEFAULT_BIND_ADDRESS;

    @JsonProperty("port")
    private int port = DEFAULT_PORT;

    @JsonProperty("max_connections")
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;

    @JsonProperty("ssh_banner")
    private String sshBanner = DEFAULT_SSH_BANNER;

    @JsonProperty("banner_delay")
    private double bannerDelay = DEFAULT_BANNER_DELAY;

    @JsonProperty("initial_delay")
    private double initialDelay = DEFAULT_INITIAL_DELAY;

    @JsonProperty("delay_increment")
    private double delayIncrement = DEFAULT_DELAY_INCREMENT;

    @JsonProperty("max_delay")
    private double maxDelay = DEFAULT_MAX_DELAY;

    @JsonProperty("connection_timeout")
    private double connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;

    @JsonProperty("max_listen_time")
    private double maxListenTime = DEFAULT_MAX_LISTEN_TIME;

    @JsonProperty("max_input_length")
    private int maxInputLength = DEFAULT_MAX_INPUT_LENGTH;

    @JsonProperty("tcp_keepalive")
    private boolean tcpKeepalive = true;

    @JsonProperty("shutdown_grace")
    private double shutdownGrace = DEFAULT_SHUTDOWN_GRACE;

    @JsonProperty("ledger_entry_ttl")
    private double ledgerEntryTtl = DEFAULT_LEDGER_ENTRY_TTL;

    @JsonProperty("ledger_sweep_interval")
    private double ledgerSweepInterval = DEFAULT_LEDGER_SWEEP_INTERVAL;

    @JsonProperty("log_file")
    private String logFile = DEFAULT_LOG_FILE;

    @JsonProperty("log_level")
    private String logLevel = DEFAULT_LOG_LEVEL;

    @JsonProperty("max_log_size")
    private int maxLogSize = DEFAULT_MAX_LOG_SIZE;

    @JsonProperty("log_backup_count")
    private int logBackupCount = DEFAULT_LOG_BACKUP_COUNT;

    @JsonProperty("enable_http_stats")
    private boolean enableHttpStats = false;

    @JsonProperty("http_stats_port")
    private int httpStatsPort = DEFAULT_HTTP_STATS_PORT;

    @JsonProperty("stats_top_n")
    private int statsTopN = DEFAULT_STATS_TOP_N;

    /**
     * Checks the invariants the engine relies on. Called once, before anything is bound.
     *
     * @throws TarpitException of type {@code CONFIG_INVALID} naming the first offending key
     */
    public TarpitConf validate() throws TarpitException {
        checkPort("port", port);
        checkPort("http_stats_port", httpStatsPort);
        check(maxConnections >= 1, "max_connections must be at least 1 but is " + maxConnections);
        check(!isEmpty(sshBanner), "ssh_banner must not be empty");
        check(!isBlank(bindAddress), "bind_address must not be blank");
        checkNonNegative("banner_delay", bannerDelay);
        checkNonNegative("initial_delay", initialDelay);
        checkNonNegative("delay_increment", delayIncrement);
        check(maxDelay >= initialDelay,
                "max_delay (" + maxDelay + ") must not be lower than initial_delay (" + initialDelay + ")");
        checkTimeout("connection_timeout", connectionTimeout);
        checkTimeout("max_listen_time", maxListenTime);
        checkTimeout("shutdown_grace", shutdownGrace);
        check(maxInputLength > 0, "max_input_length must be positive but is " + maxInputLength);
        checkNonNegative("ledger_entry_ttl", ledgerEntryTtl);
        if (ledgerEntryTtl > 0) {
            checkTimeout("ledger_sweep_interval", ledgerSweepInterval);
        }
        check(statsTopN > 0, "stats_top_n must be positive but is " + statsTopN);
        check(maxLogSize > 0, "max_log_size must be positive but is " + maxLogSize);
        check(logBackupCount >= 0, "log_backup_count must not be negative but is " + logBackupCount);
        check(!isBlank(logLevel) && nonNull(Level.getLevel(logLevel.trim().toUpperCase())),
                "log_level must be a known level name but is " + logLevel);

        return this;
    }

    @JsonIgnore
    public Duration getBannerDelayDuration() {
        return seconds(bannerDelay);
    }

    @JsonIgnore
    public Duration getConnectionTimeoutDuration() {
        return seconds(connectionTimeout);
    }

    @JsonIgnore
    public Duration getMaxListenTimeDuration() {
        return seconds(maxListenTime);
    }

    @JsonIgnore
    public Duration getShutdownGraceDuration() {
        return seconds(shutdownGrace);
    }

    @JsonIgnore
    public Duration getLedgerEntryTtlDuration() {
        return seconds(ledgerEntryTtl);
    }

    @JsonIgnore
    public Duration getLedgerSweepIntervalDuration() {
        return seconds(ledgerSweepInterval);
    }

    private static void checkPort(String key, int value) throws TarpitException {
        check(value >= 0 && value <= 65535, key + " must be within 0..65535 but is " + value);
    }

    private static void checkNonNegative(String key, double value) throws TarpitException {
        check(value >= 0 && Double.isFinite(value), key + " must be a non-negative number but is " + value);
    }

    // durations are used with millisecond precision, and 0 ms would switch the timer off
    private static void checkTimeout(String key, double value) throws TarpitException {
        check(value > 0 && Double.isFinite(value), key + " must be a positive number but is " + value);
        check(!seconds(value).isZero(), key + " must be at least 0.001 seconds but is " + value);
    }

    private static void check(boolean condition, String message) throws TarpitException {
        if (!condition) {
            throw new TarpitException(CONFIG_INVALID, message);
        }
    }
}
