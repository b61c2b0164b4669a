package com.aiinpocket.encounter.model.dto;

import java.util.List;
import java.util.Map;

/**
 * 內容資料檢查報告。
 * issues 只列出有問題的項目；orphanedArchetypes 為未出現在任何組合中的原型。
 */
public record ValidationReport(
        int totalArchetypes,
        Map<String, List<String>> archetypeIssues,
        int totalPacks,
        Map<String, List<String>> packIssues,
        List<String> orphanedArchetypes
) {
    public int issueCount() {
        int count = 0;
        for (List<String> issues : archetypeIssues.values()) count += issues.size();
        for (List<String> issues : packIssues.values()) count += issues.size();
        return count;
    }

    public boolean overallValid() {
        return issueCount() == 0;
    }
}
