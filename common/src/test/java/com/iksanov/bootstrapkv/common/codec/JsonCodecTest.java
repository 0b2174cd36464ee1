package com.iksanov.bootstrapkv.common.codec;

import com.iksanov.bootstrapkv.common.dto.FetchRequest;
import com.iksanov.bootstrapkv.common.dto.FetchResult;
import com.iksanov.bootstrapkv.common.dto.Modification;
import com.iksanov.bootstrapkv.common.dto.NodeStatus;
import com.iksanov.bootstrapkv.common.exception.SerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link JsonCodec}: exact wire shapes and rejection of malformed input.
 */
class JsonCodecTest {

    private final JsonCodec codec = new JsonCodec();

    private static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Modifications are encoded as externally tagged objects")
    void shouldEncodeTaggedModifications() {
        byte[] encoded = codec.encodeModifications(List.of(Modification.update("a", "1"), Modification.delete("b")));

        assertThat(text(encoded)).isEqualTo("[{\"Update\":[\"a\",\"1\"]},{\"Delete\":\"b\"}]");
    }

    @Test
    @DisplayName("Insert body written by hand decodes in order")
    void shouldDecodeInsertBody() {
        List<Modification> decoded = codec.decodeModifications(json("[{\"Update\":[\"x\",\"10\"]},{\"Delete\":\"y\"},{\"Update\":[\"x\",\"11\"]}]"));

        assertThat(decoded).containsExactly(
                Modification.update("x", "10"),
                Modification.delete("y"),
                Modification.update("x", "11"));
    }

    @Test
    @DisplayName("Empty insert body array is a valid empty batch")
    void shouldDecodeEmptyBatch() {
        assertThat(codec.decodeModifications(json("[]"))).isEmpty();
    }

    @Test
    @DisplayName("Info reply is a two-element array [head, size]")
    void shouldEncodeStatusAsPair() {
        assertThat(text(codec.encodeStatus(new NodeStatus(7, 3)))).isEqualTo("[7,3]");
        assertThat(codec.decodeStatus(json("[4294967295,0]"))).isEqualTo(new NodeStatus(4294967295L, 0));
    }

    @Test
    @DisplayName("Fetch request is a three-element array [begin, end, head]")
    void shouldEncodeFetchRequestAsTriple() {
        assertThat(text(codec.encodeFetchRequest(new FetchRequest(0, 20, 5)))).isEqualTo("[0,20,5]");
        assertThat(codec.decodeFetchRequest(json("[40, 45, 12]"))).isEqualTo(new FetchRequest(40, 45, 12));
    }

    @Test
    @DisplayName("Fetch reply carries head, entries and diff fields")
    void shouldEncodeFetchResultObject() {
        FetchResult result = new FetchResult(9,
                List.of(Modification.update("k", "v")),
                List.of(Modification.delete("k")));

        String encoded = text(codec.encodeFetchResult(result));

        assertThat(encoded).isEqualTo("{\"head\":9,\"entries\":[{\"Update\":[\"k\",\"v\"]}],\"diff\":[{\"Delete\":\"k\"}]}");
        assertThat(codec.decodeFetchResult(json(encoded))).isEqualTo(result);
    }

    @Test
    @DisplayName("Field order of a fetch reply does not matter")
    void shouldDecodeFetchResultRegardlessOfFieldOrder() {
        FetchResult decoded = codec.decodeFetchResult(json("{\"diff\":[],\"entries\":[],\"head\":0}"));

        assertThat(decoded.head()).isZero();
        assertThat(decoded.entries()).isEmpty();
        assertThat(decoded.diff()).isEmpty();
    }

    @Test
    @DisplayName("Keys and values keep non-ASCII characters")
    void shouldPreserveUnicode() {
        List<Modification> batch = List.of(Modification.update("ключ", "値 ✓"));

        assertThat(codec.decodeModifications(codec.encodeModifications(batch))).isEqualTo(batch);
    }

    @Test
    @DisplayName("Malformed JSON is rejected with SerializationException")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> codec.decodeModifications(json("[{\"Update\":")))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("Malformed JSON");
        assertThatThrownBy(() -> codec.decodeModifications(new byte[0]))
                .isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> codec.decodeModifications(null))
                .isInstanceOf(SerializationException.class);
    }

    @Test
    @DisplayName("Unknown tags and wrong payload shapes are rejected")
    void shouldRejectInvalidModifications() {
        assertThatThrownBy(() -> codec.decodeModifications(json("[{\"Upsert\":[\"a\",\"b\"]}]")))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("Unknown modification tag");
        assertThatThrownBy(() -> codec.decodeModifications(json("[{\"Update\":[\"a\"]}]")))
                .isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> codec.decodeModifications(json("[{\"Delete\":42}]")))
                .isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> codec.decodeModifications(json("[{\"Update\":[\"a\",\"b\"],\"Delete\":\"a\"}]")))
                .isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> codec.decodeModifications(json("{\"Delete\":\"a\"}")))
                .isInstanceOf(SerializationException.class);
    }

    @Test
    @DisplayName("Fetch request must have exactly three non-negative integers")
    void shouldRejectInvalidFetchRequest() {
        assertThatThrownBy(() -> codec.decodeFetchRequest(json("[0,20]"))).isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> codec.decodeFetchRequest(json("[-1,20,0]"))).isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> codec.decodeFetchRequest(json("[0,\"20\",0]"))).isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> codec.decodeFetchRequest(json("[0,2.5,0]"))).isInstanceOf(SerializationException.class);
    }

    @Test
    @DisplayName("Replies with out-of-range heads are rejected")
    void shouldRejectHeadBeyondUnsigned32Bits() {
        assertThatThrownBy(() -> codec.decodeStatus(json("[4294967296,0]")))
                .isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> codec.decodeFetchResult(json("{\"head\":4294967296,\"entries\":[],\"diff\":[]}")))
                .isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> codec.decodeFetchResult(json("{\"head\":1,\"entries\":[]}")))
                .isInstanceOf(SerializationException.class);
    }
}
