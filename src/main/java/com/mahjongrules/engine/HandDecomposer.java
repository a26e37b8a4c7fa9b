package com.mahjongrules.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 面子拆解器
 * 回溯搜索：总是从当前最小的一张牌开始，先试刻子再试顺子
 */
public class HandDecomposer {

    private static final Logger log = LoggerFactory.getLogger(HandDecomposer.class);

    /**
     * 先枚举将（按序号升序），剩下的牌拆成 setsNeeded 组面子，第一个成功的拆法即返回
     */
    public static Optional<Decomposition> decomposeWithPair(Map<Integer, Integer> counts, int setsNeeded) {
        checkSetsNeeded(setsNeeded);
        TreeMap<Integer, Integer> sorted = copyOf(counts);
        for (Map.Entry<Integer, Integer> entry : sorted.entrySet()) {
            int ordinal = entry.getKey();
            if (entry.getValue() < 2) {
                continue;
            }
            TreeMap<Integer, Integer> remaining = copyOf(sorted);
            take(remaining, ordinal, 2);

            Optional<Decomposition> result = search(remaining, setsNeeded);
            if (result.isPresent()) {
                log.debug("以 {} 作将拆解成功：{}", ordinal, result.get());
                return Optional.of(result.get().withPair(ordinal));
            }
        }
        return Optional.empty();
    }

    /**
     * 把所有牌恰好拆成 setsNeeded 组面子（不含将）
     */
    public static Optional<Decomposition> decompose(Map<Integer, Integer> counts, int setsNeeded) {
        checkSetsNeeded(setsNeeded);
        return search(copyOf(counts), setsNeeded);
    }

    private static Optional<Decomposition> search(TreeMap<Integer, Integer> counts, int setsNeeded) {
        // 面子凑够了：牌也必须刚好用完
        if (setsNeeded == 0) {
            return counts.isEmpty() ? Optional.of(Decomposition.empty()) : Optional.empty();
        }
        if (counts.isEmpty()) {
            return Optional.empty();
        }

        int first = counts.firstKey();
        int have = counts.get(first);

        // 尝试一：刻子 AAA
        if (have >= 3) {
            TreeMap<Integer, Integer> next = copyOf(counts);
            take(next, first, 3);
            Optional<Decomposition> result = search(next, setsNeeded - 1);
            if (result.isPresent()) {
                return Optional.of(result.get().withTriplet(first));
            }
        }

        // 尝试二：数牌 1-7 起头的顺子 ABC
        if (canStartSequence(first)
                && counts.getOrDefault(first + 1, 0) >= 1
                && counts.getOrDefault(first + 2, 0) >= 1) {
            TreeMap<Integer, Integer> next = copyOf(counts);
            take(next, first, 1);
            take(next, first + 1, 1);
            take(next, first + 2, 1);
            Optional<Decomposition> result = search(next, setsNeeded - 1);
            if (result.isPresent()) {
                return Optional.of(result.get().withSequence(first));
            }
        }

        // 最小的牌无法成组，其他拆法也不可能成立
        return Optional.empty();
    }

    private static boolean canStartSequence(int ordinal) {
        int suit = ordinal / 100;
        int rank = ordinal % 100;
        return suit >= 1 && suit <= 3 && rank >= 1 && rank <= 7;
    }

    private static void take(TreeMap<Integer, Integer> counts, int ordinal, int n) {
        int left = counts.get(ordinal) - n;
        if (left == 0) {
            counts.remove(ordinal);
        } else {
            counts.put(ordinal, left);
        }
    }

    private static TreeMap<Integer, Integer> copyOf(Map<Integer, Integer> counts) {
        TreeMap<Integer, Integer> copy = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > 0) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return copy;
    }

    private static void checkSetsNeeded(int setsNeeded) {
        if (setsNeeded < 0 || setsNeeded > 4) {
            throw new IllegalArgumentException("需要的面子数必须在 0-4 之间：" + setsNeeded);
        }
    }
}
