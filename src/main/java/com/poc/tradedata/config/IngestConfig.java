package com.poc.tradedata.config;

import com.poc.tradedata.engine.CategoryNormalizer;
import com.poc.tradedata.engine.CellClassifier;
import com.poc.tradedata.engine.HeaderLocator;
import com.poc.tradedata.engine.IndicatorExtractor;
import com.poc.tradedata.engine.StyleTagCellClassifier;
import com.poc.tradedata.engine.TradePartnerAggregator;
import com.poc.tradedata.engine.TradePartnerExtractor;
import com.poc.tradedata.model.CategoryRules;
import com.poc.tradedata.model.IndicatorCatalog;
import com.poc.tradedata.model.TradePartnerSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine wiring. The code catalog and relabel rules are fixed; only markers, windows and
 * labels come from application.yml.
 */
@Slf4j
@Configuration
public class IngestConfig {

    @Value("${ingest.header.scan-rows:20}")
    private int headerScanRows;

    @Value("${ingest.indicator.estimate-style-tag:0000588D}")
    private String estimateStyleTag;

    @Value("${ingest.indicator.missing-marker:–}")
    private String missingMarker;

    @Value("${ingest.indicator.first-year:2001}")
    private int firstYear;

    @Value("${ingest.indicator.last-year:2051}")
    private int lastYear;

    @Value("${ingest.trade-partner.residual-label:기타}")
    private String residualLabel;

    @Bean
    public IndicatorCatalog indicatorCatalog() {
        IndicatorCatalog defaults = IndicatorCatalog.defaults();
        if (firstYear > lastYear) {
            throw new IllegalStateException("ingest.indicator.first-year is after last-year: " + firstYear + " > " + lastYear);
        }
        log.info("Indicator window {}..{}, estimate style {}", firstYear, lastYear, estimateStyleTag);
        return IndicatorCatalog.builder()
                .codes(defaults.getCodes())
                .columnMapping(defaults.getColumnMapping())
                .estimateStyleTag(estimateStyleTag)
                .missingMarker(missingMarker)
                .firstYear(firstYear)
                .lastYear(lastYear)
                .build();
    }

    @Bean
    public TradePartnerSettings tradePartnerSettings() {
        return TradePartnerSettings.builder()
                .residualLabel(residualLabel)
                .missingMarker(missingMarker)
                .build();
    }

    @Bean
    public CategoryRules categoryRules() {
        return CategoryRules.defaults();
    }

    @Bean
    public HeaderLocator headerLocator() {
        return new HeaderLocator(headerScanRows);
    }

    @Bean
    public CellClassifier cellClassifier(IndicatorCatalog indicatorCatalog) {
        return new StyleTagCellClassifier(indicatorCatalog.getEstimateStyleTag());
    }

    @Bean
    public IndicatorExtractor indicatorExtractor(IndicatorCatalog indicatorCatalog, HeaderLocator headerLocator,
                                                 CellClassifier cellClassifier) {
        return new IndicatorExtractor(indicatorCatalog, headerLocator, cellClassifier);
    }

    @Bean
    public TradePartnerExtractor tradePartnerExtractor(HeaderLocator headerLocator, TradePartnerSettings tradePartnerSettings) {
        return new TradePartnerExtractor(headerLocator, tradePartnerSettings);
    }

    @Bean
    public TradePartnerAggregator tradePartnerAggregator(TradePartnerSettings tradePartnerSettings) {
        return new TradePartnerAggregator(tradePartnerSettings);
    }

    @Bean
    public CategoryNormalizer categoryNormalizer(CategoryRules categoryRules) {
        return new CategoryNormalizer(categoryRules);
    }
}
