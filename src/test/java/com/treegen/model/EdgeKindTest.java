package com.treegen.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class EdgeKindTest {

    @ParameterizedTest
    @CsvSource({
        "Maybe, ?, true, false, false",
        "One, 1, true, false, true",
        "Any, *, true, true, false",
        "Many, +, true, true, true",
        "Link, $, false, false, true",
        "OptLink, @, false, false, false"
    })
    void testKindProperties(String container, String tag, boolean owning, boolean multiple, boolean required) {
        EdgeKind kind = EdgeKind.fromContainerName(container);

        assertThat(kind.getWireTag()).isEqualTo(tag);
        assertThat(kind.isOwning()).isEqualTo(owning);
        assertThat(kind.isLink()).isEqualTo(!owning);
        assertThat(kind.isMultiple()).isEqualTo(multiple);
        assertThat(kind.isRequired()).isEqualTo(required);
        assertThat(EdgeKind.fromWireTag(tag)).isSameAs(kind);
    }

    @Test
    void testCounts() {
        assertThat(EdgeKind.MANY.getMinimumCount()).isEqualTo(1);
        assertThat(EdgeKind.MANY.getMaximumCount()).isEqualTo(-1);
        assertThat(EdgeKind.MAYBE.getMinimumCount()).isZero();
        assertThat(EdgeKind.MAYBE.getMaximumCount()).isEqualTo(1);
    }

    @Test
    void testUnknownNames() {
        assertThatThrownBy(() -> EdgeKind.fromContainerName("Some")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EdgeKind.fromWireTag("!")).isInstanceOf(IllegalArgumentException.class);
    }
}
