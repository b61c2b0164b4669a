package com.aiinpocket.encounter.service.support;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 依優先序嘗試一組策略，第一個有結果的勝出。
 * 每個策略自行決定何謂「沒有結果」（回傳 Optional.empty()），不以例外控制流程。
 */
public final class FallbackChain {

    private FallbackChain() {}

    public static <T> Optional<T> firstPresent(List<Supplier<Optional<T>>> strategies) {
        for (Supplier<Optional<T>> strategy : strategies) {
            Optional<T> result = strategy.get();
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /** 非空清單才算有結果 */
    public static <T> Optional<List<T>> nonEmpty(List<T> candidates) {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates);
    }
}
