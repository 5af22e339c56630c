package com.libragraph.vcl.formats.codecs;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class StoreCodecTest {
    private final StoreCodec codec = new StoreCodec();

    @Test
    void shouldStoreBytesUnchanged() {
        byte[] original = "as is".getBytes(StandardCharsets.UTF_8);

        var compressed = codec.compress(original);

        assertThat(compressed.data()).isEqualTo(original).isNotSameAs(original);
        assertThat(compressed.size()).isEqualTo(original.length);
        assertThat(codec.decompress(compressed.data())).isEqualTo(original);
        assertThat(codec.decompressedSizeHint(compressed.data())).hasValue(original.length);
    }
}
