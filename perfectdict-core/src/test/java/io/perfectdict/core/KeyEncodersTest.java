package io.perfectdict.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeyEncodersTest {

    @Test
    void utf8EncodesMultiByteCharacters() {
        KeyEncoder<String> encoder = KeyEncoders.utf8();

        assertThat(encoder.encode("é")).containsExactly((byte) 0xc3, (byte) 0xa9);
    }

    @Test
    void utf8TreatsEqualCharSequencesAlike() {
        KeyEncoder<CharSequence> encoder = KeyEncoders.utf8();

        assertThat(encoder.encode(new StringBuilder("bob"))).containsExactly(encoder.encode("bob"));
    }

    @Test
    void longsAreBigEndian() {
        assertThat(KeyEncoders.longs().encode(0x0102030405060708L))
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
    }

    @Test
    void intsAreBigEndian() {
        assertThat(KeyEncoders.ints().encode(-2))
                .containsExactly((byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xfe);
    }

    @Test
    void bytesArePassedThrough() {
        byte[] key = {9, 8, 7};

        assertThat(KeyEncoders.bytes().encode(key)).isSameAs(key);
    }
}
