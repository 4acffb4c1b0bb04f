package com.poc.tradedata.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TradeDirection {
    EXPORT("XPM", "Exports", "수출"),
    IMPORT("MPM", "Imports", "수입");

    /**
     * Sheet-name prefix of the EIU trade-partner series for this direction.
     */
    private final String sheetPrefix;

    /**
     * Leading verb of the free-text definition ("Exports to ...", "Imports from ...").
     */
    private final String definitionVerb;

    /**
     * Value of the customs 수출입구분 column for this direction.
     */
    private final String customsFlag;

    public static TradeDirection ofSheet(String sheetName) {
        if (sheetName == null) return null;
        for (TradeDirection direction : values()) {
            if (sheetName.startsWith(direction.sheetPrefix)) {
                return direction;
            }
        }
        return null;
    }
}
