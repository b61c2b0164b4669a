package com.aiinpocket.encounter.service.support;

import java.util.List;
import java.util.Random;

/**
 * 加權隨機抽選（權重總和不必為 1）。
 */
public final class WeightedPicker {

    private WeightedPicker() {}

    /**
     * 依權重抽出一個項目：r = nextDouble() × 總權重，回傳累計權重第一個超過 r 的項目。
     * 總權重 ≤ 0 時改為等機率抽選。
     *
     * @throws IllegalArgumentException 項目為空或與權重數量不符
     */
    public static <T> T pick(List<T> items, double[] weights, Random random) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("候選清單不可為空");
        }
        if (items.size() != weights.length) {
            throw new IllegalArgumentException("候選數量 " + items.size() + " 與權重數量 " + weights.length + " 不符");
        }

        double total = 0;
        for (double w : weights) {
            total += Math.max(0, w);
        }
        if (total <= 0) {
            return items.get(random.nextInt(items.size()));
        }

        double roll = random.nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < items.size(); i++) {
            cumulative += Math.max(0, weights[i]);
            if (roll < cumulative) {
                return items.get(i);
            }
        }
        // 浮點誤差
        return items.get(items.size() - 1);
    }
}
