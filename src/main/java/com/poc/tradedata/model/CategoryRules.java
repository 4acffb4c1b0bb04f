package com.poc.tradedata.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Direction-specific rewrites for the "기 타" (miscellaneous) sub-headings of customs item reports.
 */
@Value
@Builder
public class CategoryRules {

    @Singular("exportRelabel")
    Map<String, String> exportRelabels;

    @Singular("importRelabel")
    Map<String, String> importRelabels;

    public Map<String, String> relabels(TradeDirection direction) {
        return direction == TradeDirection.EXPORT ? exportRelabels : importRelabels;
    }

    public static CategoryRules defaults() {
        return CategoryRules.builder()
                .exportRelabel("카. 기 타", "카. 경공업품(기타)")
                .exportRelabel("바. 기 타", "바. 중화학 공업품(기타)")
                .importRelabel("라. 기 타", "라. 자본재(기타)")
                .importRelabel("자. 기 타", "자. 원자재(기타)")
                .build();
    }
}
