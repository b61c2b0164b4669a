package com.aiinpocket.encounter.model;

import lombok.*;

import java.util.List;

/**
 * 主題式敵人組合（固定成員，一起出現）。
 * 成員可重複（如 2 隻哥布林斥候 + 1 隻哥布林蠻兵）。
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
@ToString(of = {"id", "tier", "memberArchIds"})
public class EnemyPackTemplate {

    /** 單一原型臨時組合的 ID 前綴 */
    public static final String SINGLE_PREFIX = "_single_";

    @NonNull
    private final String id;

    @Builder.Default
    private final String name = "";

    /** 舊版難度分段，組合選擇時仍以此配對樓層分段 */
    private final int tier;

    @NonNull
    private final List<String> memberArchIds;

    /** 偏好的房間標籤（如 "lair"、"event"），null 表示一般房間 */
    private final String preferredRoomTag;

    @Builder.Default
    private final double weight = 1.0;

    /**
     * 以單一原型包裝成臨時組合（找不到合格組合時的退路）。
     */
    public static EnemyPackTemplate single(EnemyArchetype archetype, String roomTag) {
        return EnemyPackTemplate.builder()
                .id(SINGLE_PREFIX + archetype.getId())
                .name(archetype.getName())
                .tier(archetype.getTier())
                .memberArchIds(List.of(archetype.getId()))
                .preferredRoomTag(roomTag)
                .weight(1.0)
                .build();
    }

    public boolean isSynthesized() {
        return id.startsWith(SINGLE_PREFIX);
    }
}
