package com.poc.tradedata.engine;

import com.poc.tradedata.model.CountryTradeProfile;
import com.poc.tradedata.model.PartnerShare;
import com.poc.tradedata.model.ResultTable;
import com.poc.tradedata.model.TradeDirection;
import com.poc.tradedata.model.TradePartnerSettings;
import com.poc.tradedata.model.TradeRelation;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Groups trade relations per country and lays them out as paired export/import rows,
 * closing each direction's share gap with a residual row.
 */
@Slf4j
public class TradePartnerAggregator {

    public static final List<String> COLUMNS = List.of(
            "cont_code", "cont_nm", "maj_exp_cont_nm", "exp_rate", "maj_imp_cont_nm", "imp_rate");

    private static final PartnerShare EMPTY = new PartnerShare(null, 0.0);

    private final TradePartnerSettings settings;

    public TradePartnerAggregator(TradePartnerSettings settings) {
        this.settings = settings;
    }

    /**
     * Drops relations without a partner or with a non-positive share, then groups the
     * rest by country code. Partner order is the read order.
     */
    public Map<String, CountryTradeProfile> aggregate(List<TradeRelation> relations) {
        Map<String, CountryTradeProfile> profiles = new LinkedHashMap<>();
        for (TradeRelation relation : relations) {
            if (relation.getPartnerName() == null || relation.getRate() <= 0) continue;

            String countryCode = relation.getCountryCode() == null ? "" : relation.getCountryCode().trim();
            String partner = relation.getPartnerName().trim().toLowerCase(Locale.ROOT);
            profiles.computeIfAbsent(countryCode, CountryTradeProfile::new)
                    .add(relation.getDirection(), new PartnerShare(partner, relation.getRate()));
        }
        return profiles;
    }

    /**
     * @param countryNames single-hop bridge from country code to display name
     * @param partnerNames two-hop bridge from partner name to display name
     */
    public ResultTable toResultTable(String tableName, Map<String, CountryTradeProfile> profiles,
                                     CountryBridge countryNames, CountryBridge partnerNames) {
        ResultTable table = new ResultTable(tableName, COLUMNS);
        for (CountryTradeProfile profile : profiles.values()) {
            String countryCode = profile.getCountryCode();
            String countryName = orEmpty(countryNames.resolveCode(countryCode));

            List<PartnerShare> exports = profile.getExports();
            List<PartnerShare> imports = profile.getImports();
            int pairs = Math.max(exports.size(), imports.size());
            for (int i = 0; i < pairs; i++) {
                PartnerShare exp = i < exports.size() ? exports.get(i) : EMPTY;
                PartnerShare imp = i < imports.size() ? imports.get(i) : EMPTY;

                Map<String, Object> row = table.newRow();
                row.put("cont_code", countryCode);
                row.put("cont_nm", countryName);
                row.put("maj_exp_cont_nm", partnerName(exp, partnerNames));
                row.put("exp_rate", formatRate(exp.getRate()));
                row.put("maj_imp_cont_nm", partnerName(imp, partnerNames));
                row.put("imp_rate", formatRate(imp.getRate()));
            }

            boolean exportResidual = needsResidual(profile, TradeDirection.EXPORT);
            boolean importResidual = needsResidual(profile, TradeDirection.IMPORT);
            if (exportResidual || importResidual) {
                Map<String, Object> row = table.newRow();
                row.put("cont_code", countryCode);
                row.put("cont_nm", countryName);
                if (exportResidual) {
                    row.put("maj_exp_cont_nm", settings.getResidualLabel());
                    row.put("exp_rate", formatRate(100 - profile.total(TradeDirection.EXPORT)));
                }
                if (importResidual) {
                    row.put("maj_imp_cont_nm", settings.getResidualLabel());
                    row.put("imp_rate", formatRate(100 - profile.total(TradeDirection.IMPORT)));
                }
            }
        }
        return table;
    }

    /**
     * "12.500%" with three decimals; a zero share renders as "0%".
     */
    public static String formatRate(double rate) {
        if (rate == 0) return "0%";
        return String.format(Locale.ROOT, "%.3f%%", rate);
    }

    private static boolean needsResidual(CountryTradeProfile profile, TradeDirection direction) {
        return !profile.partners(direction).isEmpty() && profile.total(direction) < 100;
    }

    private static String partnerName(PartnerShare share, CountryBridge partnerNames) {
        if (share.getPartnerName() == null) return "";
        return orEmpty(partnerNames.resolve(share.getPartnerName()));
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
