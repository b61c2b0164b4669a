package com.aiinpocket.encounter.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * 遭遇生成共用的亂數來源。
 * 設定 encounter.random.seed 時以固定種子建立，可完整重現生成序列。
 */
@Configuration
@Slf4j
public class RandomSourceConfig {

    @Bean
    public Random encounterRandom(EncounterProperties properties) {
        Long seed = properties.random() != null ? properties.random().seed() : null;
        if (seed != null) {
            log.info("[遭遇亂數] 使用固定種子 {}", seed);
            return new Random(seed);
        }
        return new Random();
    }
}
