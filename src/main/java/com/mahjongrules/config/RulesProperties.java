package com.mahjongrules.config;

import com.mahjongrules.model.Tile;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 规则开关（application.yml 中的 mahjong.rules.*）
 */
@ConfigurationProperties(prefix = "mahjong.rules")
public class RulesProperties {

    /** 圈风序号，401..404，默认东风圈 */
    private int roundWind = Tile.EAST;

    /** 七对是否允许四张相同的牌算两对 */
    private boolean sevenPairsAllowQuads = false;

    /** 只有出牌玩家的下家可以吃 */
    private boolean chiFromNextSeatOnly = true;

    public int getRoundWind() {
        return roundWind;
    }

    public void setRoundWind(int roundWind) {
        this.roundWind = roundWind;
    }

    public boolean isSevenPairsAllowQuads() {
        return sevenPairsAllowQuads;
    }

    public void setSevenPairsAllowQuads(boolean sevenPairsAllowQuads) {
        this.sevenPairsAllowQuads = sevenPairsAllowQuads;
    }

    public boolean isChiFromNextSeatOnly() {
        return chiFromNextSeatOnly;
    }

    public void setChiFromNextSeatOnly(boolean chiFromNextSeatOnly) {
        this.chiFromNextSeatOnly = chiFromNextSeatOnly;
    }
}
