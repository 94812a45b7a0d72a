package io.unistr.hash;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MurmurHash2Test {

    @ParameterizedTest
    @CsvSource({
            "'', adc9ba28",
            "a, c2f3bbd2",
            "ab, c2f8f576",
            "abc, 1dcae110",
            "abcd, a2d4fa9c",
            "Firefox, e33c479e",
            "Chrome, 13af5d11",
            "Mobile Safari, 9eeaca3c"
    })
    void fingerprint_matchesReferenceValues(String input, String expectedHex) {
        int expected = Integer.parseUnsignedInt(expectedHex, 16);

        assertThat(MurmurHash2.fingerprint(input.getBytes(StandardCharsets.US_ASCII))).isEqualTo(expected);
    }

    @Test
    void emptyInputWithZeroSeed_isZero() {
        assertThat(MurmurHash2.hash(new byte[0], 0, 0, 0)).isZero();
    }

    @Test
    void seedChangesResult() {
        byte[] data = "abcd".getBytes(StandardCharsets.US_ASCII);

        assertThat(MurmurHash2.hash(data, 0, 4, 0)).isEqualTo(Integer.parseUnsignedInt("e411e190", 16));
        assertThat(MurmurHash2.hash(data, 0, 4, 0)).isNotEqualTo(MurmurHash2.fingerprint(data));
    }

    @Test
    void hashOfRange_equalsHashOfCopiedRange() {
        byte[] framed = "xxMobile Safariyy".getBytes(StandardCharsets.US_ASCII);
        byte[] exact = "Mobile Safari".getBytes(StandardCharsets.US_ASCII);

        assertThat(MurmurHash2.hash(framed, 2, exact.length, MurmurHash2.FINGERPRINT_SEED))
                .isEqualTo(MurmurHash2.fingerprint(exact));
    }

    @Test
    void highBytesAreTreatedAsUnsigned() {
        byte[] high = {(byte) 0xff, (byte) 0x80, (byte) 0xc3};
        byte[] low = {(byte) 0x7f, (byte) 0x00, (byte) 0x43};

        assertThat(MurmurHash2.fingerprint(high)).isNotEqualTo(MurmurHash2.fingerprint(low));
        assertThat(MurmurHash2.fingerprint(high)).isEqualTo(MurmurHash2.fingerprint(high.clone()));
    }

    @Test
    void shortTokens_rarelyCollide() {
        Set<Integer> fingerprints = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            fingerprints.add(MurmurHash2.fingerprint(("token-" + i).getBytes(StandardCharsets.US_ASCII)));
        }

        assertThat(fingerprints).hasSizeGreaterThan(9_990);
    }

    @Test
    void rangeOutsideArray_isRejected() {
        assertThatThrownBy(() -> MurmurHash2.hash(new byte[4], 2, 3, 0))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> MurmurHash2.hash(new byte[4], -1, 1, 0))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
