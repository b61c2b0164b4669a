package com.aiinpocket.encounter.model.dto;

import java.util.List;

/**
 * 內容檔中的組合定義，weight 省略時為 1.0。
 */
public record PackDefinition(
        String id,
        String name,
        int tier,
        List<String> memberArchIds,
        String preferredRoomTag,
        Double weight
) {}
