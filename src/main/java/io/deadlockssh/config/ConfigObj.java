package io.deadlockssh.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.deadlockssh.TarpitException;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES;
import static io.deadlockssh.TarpitExceptionType.CONFIG_INVALID;
import static io.deadlockssh.constant.TarpitConstant.CONFIG_SECTION;
import static io.deadlockssh.constant.TarpitConstant.DEFAULT_CONFIG_RESOURCE;
import static java.util.Objects.isNull;

@ToString
@Setter
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ConfigObj {

    private static final YAMLMapper mapper = YAMLMapper.builder()
            .configure(FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    @JsonProperty(CONFIG_SECTION)
    private TarpitConf honeypot;

    /**
     * Reads a configuration file. Keys absent from the file keep their defaults.
     */
    public static ConfigObj initConfig(Path configPath) throws TarpitException {
        if (!Files.isRegularFile(configPath)) {
            throw new TarpitException(CONFIG_INVALID, "Configuration file " + configPath + " does not exist");
        }
        try {
            return withDefaults(mapper.readValue(configPath.toFile(), ConfigObj.class));
        } catch (IOException e) {
            throw new TarpitException(CONFIG_INVALID, "Could not read configuration file " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * The configuration bundled with the application, used when no file is given.
     */
    public static ConfigObj defaultConfig() throws TarpitException {
        try (InputStream is = ConfigObj.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (isNull(is)) {
                return withDefaults(new ConfigObj());
            }
            return withDefaults(mapper.readValue(is, ConfigObj.class));
        } catch (IOException e) {
            throw new TarpitException(CONFIG_INVALID, "Could not read bundled configuration: " + e.getMessage(), e);
        }
    }

    private static ConfigObj withDefaults(ConfigObj config) {
        // an empty document maps to null
        var result = isNull(config) ? new ConfigObj() : config;
        if (isNull(result.honeypot)) {
            result.honeypot = new TarpitConf();
        }

        return result;
    }
}
