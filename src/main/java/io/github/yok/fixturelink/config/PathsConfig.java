package io.github.yok.fixturelink.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code data-path} property from the application root
 * configuration and composes the directory where fixture files are written and repaired.
 *
 * <p>
 * The {@code data-path} must point to the base directory under which this tool keeps its
 * {@code /fixtures} subdirectory.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base path that serves as the application's root data directory
    private String dataPath;

    /**
     * Returns the path of the fixtures directory.
     *
     * @return the path to the fixtures directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public String getFixtures() {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return dataPath.endsWith("/") ? dataPath + "fixtures" : dataPath + "/fixtures";
    }
}
