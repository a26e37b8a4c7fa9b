package com.mahjongrules.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 特殊牌型判断：七对、十三幺
 * 输入为“序号 -> 张数”，已去掉花牌，共 14 张；只在没有任何副露/暗杠时调用
 */
public class SpecialHandDetector {

    private static final Logger log = LoggerFactory.getLogger(SpecialHandDetector.class);

    /**
     * 七对：7 种牌各 2 张，四张相同的牌不算两对
     */
    public static boolean isSevenPairs(Map<Integer, Integer> counts) {
        return isSevenPairs(counts, false);
    }

    /**
     * 七对
     * @param allowQuads 为 true 时四张相同的牌算作两对（部分规则允许）
     */
    public static boolean isSevenPairs(Map<Integer, Integer> counts, boolean allowQuads) {
        if (totalOf(counts) != 14) {
            return false;
        }
        int pairs = 0;
        for (int count : counts.values()) {
            if (count == 2) {
                pairs++;
            } else if (count == 4 && allowQuads) {
                pairs += 2;
            } else {
                // 1 张、3 张直接不成立；不允许时 4 张也不成立
                return false;
            }
        }
        if (pairs != 7) {
            return false;
        }
        log.debug("七对成立：{}", counts);
        return true;
    }

    /**
     * 十三幺：13 种幺九牌中 12 种各 1 张、1 种 2 张，不能有其他牌
     */
    public static boolean isThirteenOrphans(Map<Integer, Integer> counts) {
        int singles = 0;
        int doubles = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (!TileFactory.THIRTEEN_ORPHAN_ORDINALS.contains(entry.getKey())) {
                return false;
            }
            int count = entry.getValue();
            if (count == 1) {
                singles++;
            } else if (count == 2) {
                doubles++;
            } else {
                return false;
            }
        }
        if (singles != 12 || doubles != 1) {
            return false;
        }
        log.debug("十三幺成立：{}", counts);
        return true;
    }

    private static int totalOf(Map<Integer, Integer> counts) {
        int total = 0;
        for (int count : counts.values()) {
            total += count;
        }
        return total;
    }
}
