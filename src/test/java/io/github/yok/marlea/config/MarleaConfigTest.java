package io.github.yok.marlea.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link MarleaConfig}.
 */
class MarleaConfigTest {

    @Test
    void getSourcePath_正常ケース_デフォルト値を取得する_nullが返ること() {
        MarleaConfig config = new MarleaConfig();
        assertNull(config.getSourcePath());
    }

    @Test
    void isShowNetwork_正常ケース_デフォルト値を取得する_falseが返ること() {
        MarleaConfig config = new MarleaConfig();
        assertFalse(config.isShowNetwork());
    }

    @Test
    void setter_正常ケース_各プロパティを設定して取得する_設定値が返ること() {
        MarleaConfig config = new MarleaConfig();
        config.setSourcePath("networks/counter.csv");
        config.setShowNetwork(true);

        assertEquals("networks/counter.csv", config.getSourcePath());
        assertTrue(config.isShowNetwork());
    }
}
