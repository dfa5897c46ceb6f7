package io.github.yok.fixturelink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

class PathsConfigTest {

    @Test
    void getFixtures_正常ケース_dataPathを指定する_fixturesディレクトリが返ること() {
        PathsConfig config = new PathsConfig();
        config.setDataPath("/var/data");
        assertEquals("/var/data/fixtures", config.getFixtures());

        config.setDataPath("/var/data/");
        assertEquals("/var/data/fixtures", config.getFixtures());
    }

    @Test
    void getFixtures_異常ケース_dataPath未設定_IllegalStateExceptionが送出されること() {
        PathsConfig config = new PathsConfig();
        assertThrows(IllegalStateException.class, config::getFixtures);

        config.setDataPath("  ");
        assertThrows(IllegalStateException.class, config::getFixtures);
    }
}
