package com.mahjongrules.model;

/**
 * 面子类型
 */
public enum MeldType {
    SEQUENCE,   // 顺子（吃）
    TRIPLET,    // 刻子（碰）
    QUAD        // 杠
}
