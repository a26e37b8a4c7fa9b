package com.mahjongrules.model;

/**
 * 和牌牌型（互斥）
 * 计分只看这一个值，避免多个和牌标记同时成立时重复计分
 */
public enum WinShape {
    NONE,                   // 未和牌
    THIRTEEN_ORPHANS,       // 十三幺
    SEVEN_PAIRS,            // 七对
    TRADITIONAL,            // 四组面子 + 一对将
    PURE_SUIT_FALLBACK      // 清一色（不成面子结构时的兜底和法）
}
