package com.poc.tradedata.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kind of file a run processes, with the table its result is written to.
 */
@Getter
@RequiredArgsConstructor
public enum JobType {
    ECONOMIC_INDICATOR("tb_rhr100", "eiu_economic_indicator_data"),
    TRADE_PARTNER("tb_rhr150", "eiu_major_trade_partner_data"),
    CUSTOMS_COUNTRY("export_import_stat_by_country", "customs_country_data"),
    CUSTOMS_EXPORT_ITEM("export_import_item_by_country", "customs_type_data"),
    CUSTOMS_IMPORT_ITEM("export_import_item_by_country", "customs_type_data"),
    ECONOMIC_FREEDOM_INDEX("economic_freedom_index", "economic_freedom_index_data"),
    CORRUPTION_PERCEPTION_INDEX("corruption_perception_index", "corruption_perception_index_data"),
    HUMAN_DEVELOPMENT_INDEX("human_development_index", "human_development_index_data"),
    WORLD_COMPETITIVENESS_INDEX("world_competitiveness_index", "world_competitiveness_index_data");

    private final String resultTable;

    /**
     * File name prefix of the CSV snapshot written after a successful run.
     */
    private final String snapshotPrefix;
}
