package com.poc.tradedata.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.poc.tradedata.model.CategoryClass;
import com.poc.tradedata.model.CategoryRules;
import com.poc.tradedata.model.ClassifiedCategory;
import com.poc.tradedata.model.TradeDirection;
import org.junit.jupiter.api.Test;

class CategoryNormalizerTest {

    private final CategoryNormalizer normalizer = new CategoryNormalizer(CategoryRules.defaults());

    @Test
    void classifiesNumbering() {
        assertThat(normalizer.classify("1. 경공업품")).isEqualTo(CategoryClass.MAJOR_HEADING);
        assertThat(normalizer.classify("2.중화학 공업품")).isEqualTo(CategoryClass.MAJOR_HEADING);
        assertThat(normalizer.classify("가. 식료품")).isEqualTo(CategoryClass.SUB_HEADING);
        assertThat(normalizer.classify("3. 기타")).isEqualTo(CategoryClass.UNCLASSIFIED);
        assertThat(normalizer.classify("총계")).isEqualTo(CategoryClass.UNCLASSIFIED);
        assertThat(normalizer.classify(null)).isEqualTo(CategoryClass.UNCLASSIFIED);
    }

    @Test
    void exportKeepsMajorAndSubHeadings() {
        assertThat(normalizer.normalize("1. 경공업품", TradeDirection.EXPORT))
                .map(ClassifiedCategory::getLabel)
                .hasValue("경공업품");
        assertThat(normalizer.normalize("가. 식료품 ", TradeDirection.EXPORT))
                .map(ClassifiedCategory::getLabel)
                .hasValue("식료품");
    }

    @Test
    void importKeepsSubHeadingsOnly() {
        assertThat(normalizer.normalize("1. 소비재", TradeDirection.IMPORT)).isEmpty();
        assertThat(normalizer.normalize("나. 원자재", TradeDirection.IMPORT))
                .map(ClassifiedCategory::getLabel)
                .hasValue("원자재");
        assertThat(normalizer.normalize("잡품", TradeDirection.IMPORT)).isEmpty();
    }

    @Test
    void relabelsResidualCategoriesPerDirection() {
        assertThat(normalizer.normalize("카. 기 타", TradeDirection.EXPORT))
                .map(ClassifiedCategory::getLabel)
                .hasValue("경공업품(기타)");
        assertThat(normalizer.normalize("자. 기 타", TradeDirection.IMPORT))
                .map(ClassifiedCategory::getLabel)
                .hasValue("원자재(기타)");
        assertThat(normalizer.normalize("자. 기 타", TradeDirection.EXPORT))
                .map(ClassifiedCategory::getLabel)
                .hasValue("기 타");
    }

    @Test
    void keepsRawLabelAlongsideNormalized() {
        ClassifiedCategory category = normalizer.normalize("바. 기 타", TradeDirection.EXPORT).orElseThrow();

        assertThat(category.getRawLabel()).isEqualTo("바. 기 타");
        assertThat(category.getLabel()).isEqualTo("중화학 공업품(기타)");
        assertThat(category.getCategoryClass()).isEqualTo(CategoryClass.SUB_HEADING);
    }
}
