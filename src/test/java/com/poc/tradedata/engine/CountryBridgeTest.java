package com.poc.tradedata.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CountryBridgeTest {

    private static final Map<String, String> NAME_TO_CODE = Map.of("Germany", "DEU", "Korea, Rep.", "KOR");
    private static final Map<String, String> CODE_TO_NAME = Map.of("DEU", "독일", "KOR", "대한민국");

    @Test
    void twoHopResolvesThroughCode() {
        CountryBridge bridge = CountryBridge.twoHop(NAME_TO_CODE, CODE_TO_NAME);

        assertThat(bridge.resolve(" Germany ")).isEqualTo("독일");
        assertThat(bridge.resolveToCode("Korea, Rep.")).isEqualTo("KOR");
    }

    @Test
    void missOnEitherHopYieldsNull() {
        CountryBridge bridge = CountryBridge.twoHop(Map.of("Atlantis", "ATL", "Germany", "DEU"), Map.of("DEU", "독일"));

        assertThat(bridge.resolve("Atlantis")).isNull();
        assertThat(bridge.resolve("Narnia")).isNull();
        assertThat(bridge.resolve(null)).isNull();
    }

    @Test
    void sourceLookupIsCaseSensitiveUnlessRequested() {
        assertThat(CountryBridge.twoHop(NAME_TO_CODE, CODE_TO_NAME).resolve("germany")).isNull();
        assertThat(CountryBridge.twoHopIgnoreCase(NAME_TO_CODE, CODE_TO_NAME).resolve("germany")).isEqualTo("독일");
    }

    @Test
    void singleHopNormalizesCode() {
        CountryBridge bridge = CountryBridge.singleHop(CODE_TO_NAME);

        assertThat(bridge.resolveCode(" kor ")).isEqualTo("대한민국");
        assertThat(bridge.resolveToCode("KOR")).isNull();
    }

    @Test
    void nullTablesBehaveAsEmpty() {
        CountryBridge bridge = CountryBridge.twoHop(null, null);

        assertThat(bridge.resolve("Germany")).isNull();
        assertThat(bridge.resolveCode("DEU")).isNull();
    }
}
