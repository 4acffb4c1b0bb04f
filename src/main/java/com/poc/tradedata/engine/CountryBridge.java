package com.poc.tradedata.engine;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a country token of one naming system to the name used by the target system.
 * <p>
 * Two tables can be chained: source name to canonical (ISO) code, then code to target name.
 * A miss on either hop yields {@code null}; callers decide whether that drops the row or
 * renders an empty name. Nothing here throws for an unknown country.
 */
public class CountryBridge {

    private final Map<String, String> sourceToCode;
    private final Map<String, String> codeToTarget;
    private final boolean ignoreSourceCase;

    private CountryBridge(Map<String, String> sourceToCode, Map<String, String> codeToTarget, boolean ignoreSourceCase) {
        this.ignoreSourceCase = ignoreSourceCase;
        this.sourceToCode = sourceToCode == null ? Collections.emptyMap() : normalizeKeys(sourceToCode, ignoreSourceCase);
        this.codeToTarget = codeToTarget == null ? Collections.emptyMap() : upperCaseKeys(codeToTarget);
    }

    public static CountryBridge twoHop(Map<String, String> sourceToCode, Map<String, String> codeToTarget) {
        return new CountryBridge(sourceToCode, codeToTarget, false);
    }

    /**
     * Two-hop bridge whose source lookup ignores case, for free-text partner names.
     */
    public static CountryBridge twoHopIgnoreCase(Map<String, String> sourceToCode, Map<String, String> codeToTarget) {
        return new CountryBridge(sourceToCode, codeToTarget, true);
    }

    public static CountryBridge singleHop(Map<String, String> codeToTarget) {
        return new CountryBridge(null, codeToTarget, false);
    }

    public String resolve(String token) {
        String code = resolveToCode(token);
        return code == null ? null : resolveCode(code);
    }

    public String resolveToCode(String token) {
        if (token == null) return null;
        String key = token.trim();
        if (ignoreSourceCase) key = key.toLowerCase(Locale.ROOT);
        String code = sourceToCode.get(key);
        return code == null || code.isBlank() ? null : code.trim();
    }

    public String resolveCode(String code) {
        if (code == null) return null;
        return codeToTarget.get(code.trim().toUpperCase(Locale.ROOT));
    }

    private static Map<String, String> normalizeKeys(Map<String, String> table, boolean lowerCase) {
        Map<String, String> copy = new HashMap<>();
        table.forEach((key, value) -> {
            if (key == null) return;
            String k = key.trim();
            copy.putIfAbsent(lowerCase ? k.toLowerCase(Locale.ROOT) : k, value);
        });
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, String> upperCaseKeys(Map<String, String> table) {
        Map<String, String> copy = new HashMap<>();
        table.forEach((key, value) -> {
            if (key == null) return;
            copy.putIfAbsent(key.trim().toUpperCase(Locale.ROOT), value);
        });
        return Collections.unmodifiableMap(copy);
    }
}
