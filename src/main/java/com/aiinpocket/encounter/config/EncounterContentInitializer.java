package com.aiinpocket.encounter.config;

import com.aiinpocket.encounter.model.dto.ValidationReport;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import com.aiinpocket.encounter.service.ContentValidationService;
import com.aiinpocket.encounter.service.EncounterContentLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 啟動時載入遭遇內容。
 * - 讀取原型與組合並註冊（重複 ID 直接中止啟動）
 * - 執行內容檢查，問題以 WARN 輸出
 * - 沒有任何原型時中止啟動，否則封存目錄
 */
@Component
@Order(100)
@RequiredArgsConstructor
@Slf4j
public class EncounterContentInitializer implements ApplicationRunner {

    private final EncounterRegistry registry;
    private final EncounterContentLoader contentLoader;
    private final ContentValidationService validationService;

    @Override
    public void run(ApplicationArguments args) {
        if (registry.isSealed()) {
            log.debug("[遭遇內容] 目錄已封存，略過載入");
            return;
        }

        contentLoader.load();

        if (registry.isEmpty()) {
            throw new IllegalStateException("沒有註冊任何敵人原型，無法生成遭遇");
        }

        logValidation(validationService.validate());
        registry.seal();
    }

    private void logValidation(ValidationReport report) {
        if (report.overallValid()) {
            log.info("[遭遇內容] 內容檢查通過：{} 個原型, {} 個組合",
                    report.totalArchetypes(), report.totalPacks());
        } else {
            log.warn("[遭遇內容] 內容檢查發現 {} 個問題", report.issueCount());
            for (Map.Entry<String, List<String>> entry : report.archetypeIssues().entrySet()) {
                log.warn("[遭遇內容] 原型 {}: {}", entry.getKey(), entry.getValue());
            }
            for (Map.Entry<String, List<String>> entry : report.packIssues().entrySet()) {
                log.warn("[遭遇內容] 組合 {}: {}", entry.getKey(), entry.getValue());
            }
        }
        if (!report.orphanedArchetypes().isEmpty()) {
            log.debug("[遭遇內容] {} 個原型未出現在任何組合: {}",
                    report.orphanedArchetypes().size(), report.orphanedArchetypes());
        }
    }
}
