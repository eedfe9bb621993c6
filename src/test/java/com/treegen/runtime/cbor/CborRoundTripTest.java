package com.treegen.runtime.cbor;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.treegen.runtime.SchemaValidationException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the CBOR writer and reader wrappers.
 */
class CborRoundTripTest {

    @Test
    void testMapValues() {
        CborWriter writer = new CborWriter();
        CborMapWriter map = writer.startMap();
        map.appendNull("nothing");
        map.appendBool("flag", true);
        map.appendInt("count", -42);
        map.appendFloat("ratio", 0.5);
        map.appendString("name", "tree");
        map.appendBinary("blob", new byte[] {1, 2, 3});
        map.close();

        CborMapReader reader = CborReader.parse(writer.toByteArray()).asMap();

        assertThat(reader.keys()).containsExactly("nothing", "flag", "count", "ratio", "name", "blob");
        assertThat(reader.at("nothing").isNull()).isTrue();
        assertThat(reader.at("flag").asBool()).isTrue();
        assertThat(reader.at("count").asInt()).isEqualTo(-42L);
        assertThat(reader.at("ratio").asFloat()).isEqualTo(0.5);
        assertThat(reader.at("name").asString()).isEqualTo("tree");
        assertThat(reader.at("blob").asBinary()).containsExactly(1, 2, 3);
    }

    @Test
    void testNestedContainers() {
        CborWriter writer = new CborWriter();
        CborMapWriter map = writer.startMap();
        CborArrayWriter array = map.appendArray("items");
        array.appendInt(1);
        array.appendString("two");
        CborMapWriter inner = array.appendMap();
        inner.appendBool("three", false);
        inner.close();
        array.close();
        map.close();

        List<CborReader> items = CborReader.parse(writer.toByteArray()).asMap().at("items").asArray();

        assertThat(items).hasSize(3);
        assertThat(items.get(0).isInt()).isTrue();
        assertThat(items.get(1).asString()).isEqualTo("two");
        assertThat(items.get(2).asMap().at("three").asBool()).isFalse();
    }

    @Test
    void testTypeMismatch() {
        CborWriter writer = new CborWriter();
        CborMapWriter map = writer.startMap();
        map.appendString("name", "tree");
        map.close();
        CborMapReader reader = CborReader.parse(writer.toByteArray()).asMap();

        assertThatThrownBy(() -> reader.at("name").asInt())
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageStartingWith("Schema validation failed: expected");
        assertThatThrownBy(() -> reader.at("missing"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessage("Schema validation failed: missing key missing");
        assertThat(reader.find("missing")).isEmpty();
        assertThat(reader.has("name")).isTrue();
    }

    @Test
    void testExpectString() {
        CborWriter writer = new CborWriter();
        CborMapWriter map = writer.startMap();
        map.appendString("@T", "1");
        map.close();
        CborMapReader reader = CborReader.parse(writer.toByteArray()).asMap();

        assertThatCode(() -> reader.expectString("@T", "1")).doesNotThrowAnyException();
        assertThatThrownBy(() -> reader.expectString("@T", "+"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("expected + but found 1");
    }

    @Test
    void testOnlyOneTopLevelItem() {
        CborWriter writer = new CborWriter();
        writer.startMap().close();

        assertThatThrownBy(writer::startArray).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testMapClosedTwice() {
        CborWriter writer = new CborWriter();
        CborMapWriter map = writer.startMap();
        map.close();

        assertThatThrownBy(map::close).isInstanceOf(IllegalStateException.class);
    }
}
