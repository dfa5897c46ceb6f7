package io.github.yok.fixturelink.fixer;

import com.google.common.collect.ImmutableMap;
import io.github.yok.fixturelink.config.FixerConfig;
import io.github.yok.fixturelink.core.FixtureRecord;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Moves the legacy game fields to the names used by the current game schema.
 *
 * <ul>
 * <li>{@code start_time → date}, {@code team1 → home_team}, {@code team2 → away_team},
 * {@code team1_score → home_team_score}, {@code team2_score → away_team_score},
 * {@code pool → division_pool}; a legacy field is only moved when the new name is absent</li>
 * <li>{@code game_round} made of digits → integer</li>
 * <li>{@code date} without {@code T} → first space replaced by {@code T}</li>
 * <li>missing {@code status} / {@code location} → configured defaults</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class GameFieldRenameFixer implements FixtureFixer {

    // legacy field → current field
    static final ImmutableMap<String, String> RENAMES = ImmutableMap.<String, String>builder()
            .put("start_time", "date").put("team1", "home_team").put("team2", "away_team")
            .put("team1_score", "home_team_score").put("team2_score", "away_team_score")
            .put("pool", "division_pool").build();

    private final FixerConfig.GameFields config;

    /**
     * Creates the fixer.
     *
     * @param config game field settings
     */
    public GameFieldRenameFixer(FixerConfig.GameFields config) {
        this.config = config;
    }

    @Override
    public String entity() {
        return config.getEntity();
    }

    @Override
    public boolean apply(FixtureRecord record) {
        Map<String, Object> fields = record.getFields();
        boolean changed = false;

        for (Map.Entry<String, String> rename : RENAMES.entrySet()) {
            if (fields.containsKey(rename.getKey()) && !fields.containsKey(rename.getValue())) {
                fields.put(rename.getValue(), fields.remove(rename.getKey()));
                changed = true;
            }
        }

        Object round = fields.get("game_round");
        if (round instanceof String && StringUtils.isNumeric((String) round)) {
            try {
                fields.put("game_round", Integer.valueOf((String) round));
                changed = true;
            } catch (NumberFormatException e) {
                log.debug("{} pk={} game_round [{}] out of range; kept as string",
                        record.getEntity(), record.getPrimaryKey(), round);
            }
        }

        Object date = fields.get("date");
        if (date instanceof String && !((String) date).contains("T")
                && ((String) date).contains(" ")) {
            fields.put("date", StringUtils.replaceOnce((String) date, " ", "T"));
            changed = true;
        }

        if (!fields.containsKey("status")) {
            fields.put("status", config.getDefaultStatus());
            changed = true;
        }
        if (!fields.containsKey("location")) {
            fields.put("location", config.getDefaultLocation());
            changed = true;
        }

        if (changed) {
            log.debug("{} pk={} game fields fixed", record.getEntity(), record.getPrimaryKey());
        }
        return changed;
    }
}
