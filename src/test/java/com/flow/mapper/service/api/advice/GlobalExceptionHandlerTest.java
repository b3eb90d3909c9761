package com.flow.mapper.service.api.advice;

import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.OperationType;
import com.flow.mapper.service.patch.PatchApplicationException;
import com.flow.mapper.service.topology.DegreeRange;
import com.flow.mapper.service.topology.TopologyViolation;
import com.flow.mapper.service.translate.TranslationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Unrepairable intents carry the open violations next to the detail lines")
    void unrepairableIntentListsViolations() {
        var violation = TopologyViolation.degree("e", NodeType.END, TopologyViolation.Direction.INCOMING,
                DegreeRange.atLeast(1), 0);
        var ex = new TranslationException(TranslationException.Reason.UNREPAIRABLE,
                "1 topology violation(s) left after 0 repair round(s)", List.of(violation));

        var response = handler.handleTranslationException(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        var error = response.getBody().getError();
        assertThat(error.getCode()).isEqualTo("INTENT_REJECTED");
        assertThat(error.getDetails())
                .startsWith("UNREPAIRABLE: 1 topology violation(s)")
                .contains(violation.message());
        assertThat(error.getViolations()).singleElement().satisfies(v -> {
            assertThat(v.getElementId()).isEqualTo("e");
            assertThat(v.getDirection()).isEqualTo("incoming");
            assertThat(v.getActual()).isZero();
        });
        assertThat(error.getOperationIndex()).isNull();
    }

    @Test
    @DisplayName("Refused patches name the operation that stopped them")
    void refusedPatchNamesOperation() {
        var ex = new PatchApplicationException("edge 'e9' not found", 2, OperationType.DELETE_EDGE);

        var response = handler.handlePatchApplicationException(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        var body = response.getBody();
        assertThat(body.isSuccess()).isFalse();
        assertThat(body.getData()).isNull();
        assertThat(body.getError().getCode()).isEqualTo("PATCH_REJECTED");
        assertThat(body.getError().getOperationIndex()).isEqualTo(2);
        assertThat(body.getError().getOperationType()).isEqualTo("delete_edge");
        assertThat(body.getError().getViolations()).isNull();
    }
}
