package io.github.yok.fixturelink.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code fixers} section in {@code application.yml}.
 *
 * <pre>
 * fixers:
 *   user-groups:
 *     entity: authman.user
 *     superuser-group-id: 1
 *     role-groups:
 *       team_manager: 2
 *   game-fields:
 *     entity: games.game
 *     default-status: completed
 *     default-location: 1
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "fixers")
@Data
public class FixerConfig {

    private UserGroups userGroups = new UserGroups();

    private GameFields gameFields = new GameFields();

    /**
     * Settings of the fixer that derives group memberships from role flags.
     */
    @Data
    public static class UserGroups {

        // Entity whose records carry the role flags
        private String entity = "authman.user";

        // Group granted to every superuser
        private int superuserGroupId = 1;

        // Role value → group granted to users holding that role
        private Map<String, Integer> roleGroups = new LinkedHashMap<>(Map.of("team_manager", 2));
    }

    /**
     * Settings of the fixer that renames the legacy game fields.
     */
    @Data
    public static class GameFields {

        private String entity = "games.game";

        private String defaultStatus = "completed";

        private int defaultLocation = 1;
    }
}
