package io.deadlockssh;

import io.deadlockssh.config.ConfigObj;
import io.deadlockssh.config.TarpitConf;
import io.deadlockssh.event.JsonEventSink;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import static io.deadlockssh.constant.TarpitConstant.LOG_BACKUP_COUNT_PROPERTY;
import static io.deadlockssh.constant.TarpitConstant.LOG_FILE_PROPERTY;
import static io.deadlockssh.constant.TarpitConstant.LOG_LEVEL_PROPERTY;
import static io.deadlockssh.constant.TarpitConstant.LOG_MAX_SIZE_PROPERTY;
import static java.util.Objects.isNull;
import static java.util.Objects.nonNull;

/**
 * Command line entry point. Exit status: 0 after a clean shutdown, 1 on a configuration error, 2 when the
 * tarpit port cannot be bound.
 * <p>
 * Holds no logger of its own: the logging backend reads its file name and rotation settings from system
 * properties, which are only known once the configuration has been loaded.
 */
@Command(
        name = "deadlockssh",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = 1,
        version = "deadlockssh 1.0",
        description = "SSH tarpit honeypot: stalls and fingerprints unsolicited SSH connection attempts"
)
public class DeadlockSshCommand implements Callable<Integer> {

    @Option(names = {"-c", "--config"}, description = "Configuration file path (YAML)")
    Path configFile;

    @Option(names = {"-p", "--port"}, description = "Port to listen on (overrides config file)")
    Integer port;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DeadlockSshCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        TarpitConf conf;
        try {
            conf = loadConf();
        } catch (TarpitException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return e.getType().getExitCode();
        }

        configureLogging(conf);
        var honeypot = new DeadlockSsh(conf, new JsonEventSink());
        try {
            honeypot.start();
        } catch (TarpitException e) {
            System.err.println("Fatal error: " + e.getMessage());
            LoggerFactory.getLogger(DeadlockSshCommand.class).error("Failed to start server", e);
            return e.getType().getExitCode();
        }
        honeypot.installSignalHandlers();

        try {
            honeypot.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            honeypot.shutdown();
        }

        return 0;
    }

    TarpitConf loadConf() throws TarpitException {
        var config = isNull(configFile) ? ConfigObj.defaultConfig() : ConfigObj.initConfig(configFile);
        var conf = config.getHoneypot();
        if (nonNull(port)) {
            conf.setPort(port);
        }

        return conf.validate();
    }

    static void configureLogging(TarpitConf conf) {
        System.setProperty(LOG_FILE_PROPERTY, conf.getLogFile());
        System.setProperty(LOG_LEVEL_PROPERTY, conf.getLogLevel().toUpperCase());
        System.setProperty(LOG_MAX_SIZE_PROPERTY, String.valueOf(conf.getMaxLogSize()));
        System.setProperty(LOG_BACKUP_COUNT_PROPERTY, String.valueOf(conf.getLogBackupCount()));
    }
}
