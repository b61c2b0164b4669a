package com.aiinpocket.encounter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;
import java.util.Set;

@ConfigurationProperties(prefix = "encounter")
public record EncounterProperties(
        Content content,
        Elite elite,
        Spawning spawning,
        Party party,
        RandomParams random
) {
    public record Content(
            String archetypesLocation,
            String packsLocation
    ) {}

    public record Elite(
            double baseChance
    ) {}

    public record Spawning(
            double uniqueChance,
            int maxUniquePerFloor,
            Map<String, List<String>> uniqueRoomEnemies
    ) {}

    public record Party(
            Set<String> swarmTypes,
            Set<String> eliteTypes
    ) {}

    /** seed 為 null 時使用非固定種子 */
    public record RandomParams(
            Long seed
    ) {}

    /**
     * 與 application.yml 相同的預設值（單元測試與工具程式使用）。
     */
    public static EncounterProperties defaults() {
        return new EncounterProperties(
                new Content("classpath:encounters/archetypes.json", "classpath:encounters/packs.json"),
                new Elite(0.15),
                new Spawning(0.15, 2, Map.of(
                        "graveyard", List.of("grave_warden"),
                        "sanctum", List.of("sanctum_guardian"),
                        "lair", List.of("pit_champion"),
                        "treasure", List.of("hoard_mimic"),
                        "library", List.of("arcane_golem"),
                        "armory", List.of("animated_armor"))),
                new Party(
                        Set.of("goblin", "wolf", "monster", "rat"),
                        Set.of("knight", "boss", "guard", "noble")),
                new RandomParams(null));
    }
}
