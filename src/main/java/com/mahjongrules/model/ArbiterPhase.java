package com.mahjongrules.model;

/**
 * 吃碰杠和裁决阶段
 */
public enum ArbiterPhase {
    IDLE,                   // 没有待裁决的出牌
    AWAITING_REACTIONS,     // 有人出牌，收集其他玩家的表态
    AWAITING_CHI_CHOICE,    // 有人要吃但有多种吃法，等待选定
    RESOLVED                // 已裁决
}
