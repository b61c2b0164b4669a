package com.aiinpocket.encounter.service;

import com.aiinpocket.encounter.config.EncounterProperties;
import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.EnemyPackTemplate;
import com.aiinpocket.encounter.model.dto.ArchetypeDefinition;
import com.aiinpocket.encounter.model.dto.PackDefinition;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 從 JSON 內容檔讀取原型與組合定義並註冊。
 * 定義省略的欄位依 tier 推導：
 * - 難度等級 1→20, 2→50, 3→80（其他 50）
 * - 最早樓層 1→1, 2→3, 3→5（其他 1）
 * - 最晚樓層 1→3, 2→6, 3→無上限
 * - 沒有標籤時補上 tier 標籤 + 定位標籤
 */
@Service
@Slf4j
public class EncounterContentLoader {

    private static final Map<Integer, Integer> TIER_DIFFICULTY = Map.of(1, 20, 2, 50, 3, 80);
    private static final Map<Integer, Integer> TIER_MIN_FLOOR = Map.of(1, 1, 2, 3, 3, 5);
    private static final Map<Integer, Integer> TIER_MAX_FLOOR = Map.of(1, 3, 2, 6);
    private static final Map<Integer, String> TIER_TAGS = Map.of(1, "early_game", 2, "mid_game", 3, "late_game");

    private static final int DEFAULT_DIFFICULTY = 50;
    private static final int DEFAULT_MIN_FLOOR = 1;

    private final EncounterRegistry registry;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final EncounterProperties.Content content;

    public EncounterContentLoader(EncounterRegistry registry,
                                  ObjectMapper objectMapper,
                                  ResourceLoader resourceLoader,
                                  EncounterProperties properties) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.content = properties.content();
    }

    /**
     * 讀取設定中的原型檔與組合檔並依序註冊（先原型後組合）。
     *
     * @throws IllegalStateException 內容檔不存在或格式錯誤
     */
    public void load() {
        List<ArchetypeDefinition> archetypes = read(content.archetypesLocation(),
                new TypeReference<List<ArchetypeDefinition>>() {});
        for (ArchetypeDefinition definition : archetypes) {
            registry.registerArchetype(toArchetype(definition));
        }

        List<PackDefinition> packs = read(content.packsLocation(),
                new TypeReference<List<PackDefinition>>() {});
        for (PackDefinition definition : packs) {
            registry.registerPack(toPack(definition));
        }

        log.info("[遭遇內容] 載入 {} 個原型（{}）, {} 個組合（{}）",
                archetypes.size(), content.archetypesLocation(), packs.size(), content.packsLocation());
    }

    private <T> List<T> read(String location, TypeReference<List<T>> type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("找不到遭遇內容檔: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            List<T> definitions = objectMapper.readValue(in, type);
            return definitions != null ? definitions : List.of();
        } catch (IOException | JacksonException e) {
            throw new IllegalStateException("無法讀取遭遇內容檔 " + location + ": " + e.getMessage(), e);
        }
    }

    /**
     * 定義 → 原型，套用 tier 推導的預設值。
     */
    public static EnemyArchetype toArchetype(ArchetypeDefinition d) {
        if (d.id() == null || d.name() == null || d.role() == null) {
            throw new IllegalArgumentException("原型定義缺少 id / name / role: " + d.id());
        }
        int tier = d.tier();

        Integer spawnMaxFloor = d.spawnMaxFloor() != null ? d.spawnMaxFloor() : TIER_MAX_FLOOR.get(tier);

        Set<String> tags = new LinkedHashSet<>();
        if (d.tags() != null && !d.tags().isEmpty()) {
            tags.addAll(d.tags());
        } else {
            String tierTag = TIER_TAGS.get(tier);
            if (tierTag != null) {
                tags.add(tierTag);
            }
            tags.add(d.role().tag());
        }

        EnemyArchetype.EnemyArchetypeBuilder builder = EnemyArchetype.builder()
                .id(d.id())
                .name(d.name())
                .role(d.role())
                .tier(tier)
                .aiProfile(d.aiProfile())
                .baseHp(d.baseHp())
                .hpPerFloor(d.hpPerFloor())
                .baseAttack(d.baseAttack())
                .atkPerFloor(d.atkPerFloor())
                .baseDefense(d.baseDefense())
                .defPerFloor(d.defPerFloor())
                .baseXp(d.baseXp())
                .xpPerFloor(d.xpPerFloor())
                .difficultyLevel(d.difficultyLevel() != null
                        ? d.difficultyLevel() : TIER_DIFFICULTY.getOrDefault(tier, DEFAULT_DIFFICULTY))
                .spawnMinFloor(d.spawnMinFloor() != null
                        ? d.spawnMinFloor() : TIER_MIN_FLOOR.getOrDefault(tier, DEFAULT_MIN_FLOOR))
                .spawnMaxFloor(spawnMaxFloor)
                .tags(Collections.unmodifiableSet(tags));

        // 其餘欄位省略時沿用原型的預設值
        if (d.baseInitiative() != null) builder.baseInitiative(d.baseInitiative());
        if (d.initPerFloor() != null) builder.initPerFloor(d.initPerFloor());
        if (d.spawnWeight() != null) builder.spawnWeight(d.spawnWeight());
        if (d.skillIds() != null) builder.skillIds(List.copyOf(d.skillIds()));
        if (d.resistances() != null) builder.resistances(Map.copyOf(d.resistances()));
        if (d.uniqueMechanics() != null) builder.uniqueMechanics(List.copyOf(d.uniqueMechanics()));

        return builder.build();
    }

    public static EnemyPackTemplate toPack(PackDefinition d) {
        return EnemyPackTemplate.builder()
                .id(d.id())
                .name(d.name() != null ? d.name() : "")
                .tier(d.tier())
                .memberArchIds(d.memberArchIds() != null ? List.copyOf(d.memberArchIds()) : List.of())
                .preferredRoomTag(d.preferredRoomTag())
                .weight(d.weight() != null ? d.weight() : 1.0)
                .build();
    }
}
