package com.mahjongrules.model;

/**
 * 对别人打出的牌可以做出的反应
 * priority 越大越优先：和 > 杠 = 碰 > 吃 > 过
 */
public enum ReactionType {
    PASS(0),    // 过
    CHI(1),     // 吃
    PON(2),     // 碰
    KONG(2),    // 杠
    RON(3);     // 和（点炮）

    private final int priority;

    ReactionType(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }
}
