package com.flow.mapper.service.translate;

import com.flow.mapper.service.model.ProcessNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabelSimilarityTest {

    private final LabelSimilarity similarity = new LabelSimilarity();

    @Test
    @DisplayName("Exact match ignores case and extra whitespace")
    void exactMatch() {
        assertThat(similarity.isExactMatch("  Check   Payment ", "check payment")).isTrue();
        assertThat(similarity.isExactMatch("Check payment", "Check payments")).isFalse();
        assertThat(similarity.isExactMatch("", "")).isFalse();
        assertThat(similarity.isExactMatch(null, null)).isFalse();
    }

    @Test
    @DisplayName("Fuzzy match needs three shared words covering most of the shorter label")
    void fuzzyMatch() {
        assertThat(similarity.isFuzzyMatch("send the invoice to customer", "send invoice to the customer by mail"))
                .isTrue();
        // two shared words only
        assertThat(similarity.isFuzzyMatch("send invoice", "send invoice now")).isFalse();
        // three shared words but only half of the shorter label
        assertThat(similarity.isFuzzyMatch("review the order and then archive it",
                "review order and approve shipment quickly")).isFalse();
    }

    @Test
    @DisplayName("Exact matches win over earlier fuzzy candidates")
    void findMatchPrefersExact() {
        var fuzzy = node("n1", "approve the purchase order now");
        var exact = node("n2", "Approve purchase order");

        assertThat(similarity.findMatch("approve purchase order", List.of(fuzzy, exact)))
                .contains(exact);
        assertThat(similarity.findMatch("approve purchase order today", List.of(fuzzy)))
                .contains(fuzzy);
        assertThat(similarity.findMatch("pay supplier", List.of(fuzzy, exact))).isEmpty();
    }

    @Test
    @DisplayName("Thresholds are configurable and checked")
    void customThresholds() {
        var loose = new LabelSimilarity(2, 0.5);

        assertThat(loose.isFuzzyMatch("send invoice", "send invoice now")).isTrue();
        assertThatThrownBy(() -> new LabelSimilarity(0, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LabelSimilarity(3, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    private static ProcessNode node(String id, String label) {
        return ProcessNode.builder().id(id).label(label).build();
    }
}
