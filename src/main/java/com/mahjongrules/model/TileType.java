package com.mahjongrules.model;

/**
 * 麻将牌类型
 * 花色编号即序号的百位：序号 = 花色编号 * 100 + 点数
 */
public enum TileType {
    CHARACTERS(1, 9),   // 万（1-9）
    CIRCLES(2, 9),      // 饼（1-9）
    BAMBOOS(3, 9),      // 条（1-9）
    WIND(4, 4),         // 风牌（东南西北：1-4）
    DRAGON(5, 3),       // 箭牌（中发白：1-3）
    BLUE_BONUS(6, 4),   // 蓝花（1-4）
    RED_BONUS(7, 4);    // 红花（1-4）

    private final int index;
    private final int maxRank;

    TileType(int index, int maxRank) {
        this.index = index;
        this.maxRank = maxRank;
    }

    public int getIndex() {
        return index;
    }

    public int getMaxRank() {
        return maxRank;
    }

    /**
     * 是否为数牌（万饼条），只有数牌可以组成顺子
     */
    public boolean isSuited() {
        return this == CHARACTERS || this == CIRCLES || this == BAMBOOS;
    }

    /**
     * 是否为字牌（风、箭）
     */
    public boolean isHonor() {
        return this == WIND || this == DRAGON;
    }

    /**
     * 是否为花牌，花牌不参与任何牌型
     */
    public boolean isBonus() {
        return this == BLUE_BONUS || this == RED_BONUS;
    }

    /**
     * 根据花色编号查找类型，找不到返回 null
     */
    public static TileType fromIndex(int index) {
        for (TileType type : values()) {
            if (type.index == index) {
                return type;
            }
        }
        return null;
    }
}
