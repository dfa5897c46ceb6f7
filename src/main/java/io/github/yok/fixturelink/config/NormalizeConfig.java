package io.github.yok.fixturelink.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds settings of the fixture normalization pass.
 *
 * <ul>
 * <li>{@code normalize.booleanFields}: fields whose boolean-like strings are rewritten to real
 * booleans</li>
 * <li>{@code normalize.backupSuffix}: suffix appended to a fixture file's path to name its
 * backup</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "normalize")
@Getter
@Setter
@NoArgsConstructor
public class NormalizeConfig {

    private List<String> booleanFields = ImmutableList.of("is_superuser", "is_staff", "is_active");

    private String backupSuffix = ".bak";
}
