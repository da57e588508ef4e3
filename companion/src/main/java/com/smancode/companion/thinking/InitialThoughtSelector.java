package com.smancode.companion.thinking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 初始批次选择规则
 * <p>
 * 批次大小在 [minSize, maxSize] 内随机，且不超过候选条数；
 * 始终保留第 0 条（理解问题）和最后一条（准备回答），
 * 其余名额从中间条目随机抽取，并保持原有顺序。
 * 随机源由外部注入，固定种子即可复现。
 */
public class InitialThoughtSelector {

    private final Random random;

    private final int minSize;

    private final int maxSize;

    public InitialThoughtSelector(Random random, int minSize, int maxSize) {
        if (minSize < 2 || maxSize < minSize) {
            throw new IllegalArgumentException("批次大小配置非法: min=" + minSize + ", max=" + maxSize);
        }
        this.random = random;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    public List<String> select(List<String> candidates) {
        if (candidates.size() <= 2) {
            return List.copyOf(candidates);
        }

        int upper = Math.min(maxSize, candidates.size());
        int lower = Math.min(minSize, upper);
        int size = lower + random.nextInt(upper - lower + 1);

        List<Integer> middle = new ArrayList<>();
        for (int i = 1; i < candidates.size() - 1; i++) {
            middle.add(i);
        }
        Collections.shuffle(middle, random);
        List<Integer> picked = new ArrayList<>(middle.subList(0, size - 2));
        Collections.sort(picked);

        List<String> selected = new ArrayList<>(size);
        selected.add(candidates.get(0));
        for (Integer index : picked) {
            selected.add(candidates.get(index));
        }
        selected.add(candidates.get(candidates.size() - 1));
        return selected;
    }
}
