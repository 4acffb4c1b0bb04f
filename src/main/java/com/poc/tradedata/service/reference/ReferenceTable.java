package com.poc.tradedata.service.reference;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Two-column mapping tables maintained alongside the result tables.
 * std_infrm_ctry_cd is the canonical two-letter country code.
 */
@Getter
@RequiredArgsConstructor
public enum ReferenceTable {
    /** Korea Customs Service country name to code. */
    CUSTOMS_NAME_TO_CODE("country_mapping", "kcs_kor_ctry_nm", "std_infrm_ctry_cd"),
    /** English country name to code. */
    ENGLISH_NAME_TO_CODE("country_mapping", "eng_ctry_nm", "std_infrm_ctry_cd"),
    /** EIU partner name (as written in definitions) to code. */
    PARTNER_NAME_TO_CODE("tb_rhr350", "eng_ctry_nm", "std_infrm_ctry_cd"),
    /** Code to the target system's Korean country name. */
    CODE_TO_NAME("country_info", "std_infrm_ctry_cd", "trgtpsn_nm"),
    /** Code to the target system's English country name. */
    CODE_TO_ENGLISH_NAME("country_info", "std_infrm_ctry_cd", "trgtpsn_eng_nm");

    private final String tableName;
    private final String keyColumn;
    private final String valueColumn;
}
