package com.psyos.pipeline.infrastructure;

import com.psyos.pipeline.exception.ConfigurationException;
import com.psyos.pipeline.exception.IntegrityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCryptoServiceTest {

    static final String KEK_B64 = Base64.getEncoder().encodeToString(new byte[32]);
    static final byte[] PLAINTEXT =
            "Hoje foi difícil, mas consegui sair de casa e caminhar.".getBytes(StandardCharsets.UTF_8);

    static Stream<Arguments> everyBit() {
        return Stream.of(
                bitsOf("nonce", 12),
                bitsOf("tag", 16),
                bitsOf("ciphertext", PLAINTEXT.length)
        ).flatMap(s -> s);
    }

    private static Stream<Arguments> bitsOf(String segment, int length) {
        return IntStream.range(0, length * 8).mapToObj(bit -> Arguments.of(segment, bit));
    }

    private static byte[] flip(byte[] source, int bit) {
        byte[] copy = source.clone();
        copy[bit / 8] ^= (byte) (1 << (bit % 8));
        return copy;
    }

    private EnvelopeCryptoService crypto;

    @BeforeEach
    void setUp() {
        crypto = new EnvelopeCryptoService(MasterKeyProvider.fromBase64(KEK_B64));
    }

    @Nested
    @DisplayName("Master key configuration")
    class MasterKey {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "not base64 !!", "AAAA"})
        @DisplayName("Should refuse a missing, malformed or short KEK")
        void shouldRejectBadKek(String value) {
            assertThatThrownBy(() -> MasterKeyProvider.fromBase64(value))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Should hand out copies of the KEK")
        void shouldReturnCopies() {
            MasterKeyProvider provider = MasterKeyProvider.fromBase64(KEK_B64);
            byte[] first = provider.masterKey();
            first[0] = 42;
            assertThat(provider.masterKey()[0]).isZero();
        }
    }

    @Nested
    @DisplayName("Conversation keys")
    class ConversationKeys {

        @Test
        @DisplayName("Should pack wrapped keys as nonce.tag.ciphertext")
        void shouldPackWrappedKey() {
            String packed = crypto.newWrappedConversationKey();
            String[] parts = packed.split("\\.");

            assertThat(parts).hasSize(3);
            assertThat(Base64.getDecoder().decode(parts[0])).hasSize(12);
            assertThat(Base64.getDecoder().decode(parts[1])).hasSize(16);
            assertThat(Base64.getDecoder().decode(parts[2])).hasSize(32);
        }

        @Test
        @DisplayName("Should produce a different wrapped key per conversation")
        void shouldGenerateDistinctKeys() {
            assertThat(crypto.newWrappedConversationKey()).isNotEqualTo(crypto.newWrappedConversationKey());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "abc", "a.b", "a..c", ".b.c", "a.b.c.d", "@@@.###.$$$"})
        @DisplayName("Should reject malformed packed keys with an integrity error")
        void shouldRejectMalformedPackedKey(String packed) {
            assertThatThrownBy(() -> crypto.unwrapConversationKey(packed))
                    .isInstanceOf(IntegrityException.class);
        }

        @Test
        @DisplayName("Should fail to unwrap under a different KEK")
        void shouldFailUnderOtherKek() {
            String packed = crypto.newWrappedConversationKey();
            byte[] otherKek = new byte[32];
            otherKek[31] = 1;
            EnvelopeCryptoService other = new EnvelopeCryptoService(
                    MasterKeyProvider.fromBase64(Base64.getEncoder().encodeToString(otherKek)));

            assertThatThrownBy(() -> other.unwrapConversationKey(packed))
                    .isInstanceOf(IntegrityException.class);
        }
    }

    @Nested
    @DisplayName("Tamper detection")
    class TamperDetection {

        @ParameterizedTest(name = "{0} bit {1}")
        @MethodSource("com.psyos.pipeline.infrastructure.EnvelopeCryptoServiceTest#everyBit")
        @DisplayName("Should reject a sealed body with any single bit flipped")
        void shouldRejectFlippedBit(String segment, int bit) {
            byte[] key = crypto.generateDataKey();
            EncryptedPayload sealed = crypto.encrypt(PLAINTEXT, key);
            byte[] nonce = "nonce".equals(segment) ? flip(sealed.getNonce(), bit) : sealed.getNonce();
            byte[] tag = "tag".equals(segment) ? flip(sealed.getTag(), bit) : sealed.getTag();
            byte[] ciphertext = "ciphertext".equals(segment) ? flip(sealed.getCiphertext(), bit) : sealed.getCiphertext();

            assertThatThrownBy(() -> crypto.decrypt(ciphertext, nonce, tag, key))
                    .isInstanceOf(IntegrityException.class);
        }

        @ParameterizedTest(name = "segment {0} bit {1}")
        @CsvSource({"0, 0", "0, 95", "1, 0", "1, 64", "1, 127", "2, 0", "2, 130", "2, 255"})
        @DisplayName("Should reject a wrapped key with a flipped bit in any segment")
        void shouldRejectTamperedWrappedKey(int segment, int bit) {
            byte[] kek = Base64.getDecoder().decode(KEK_B64);
            String[] parts = crypto.wrapKey(crypto.generateDataKey(), kek).split("\\.");
            parts[segment] = Base64.getEncoder().encodeToString(flip(Base64.getDecoder().decode(parts[segment]), bit));
            String tampered = String.join(".", parts);

            assertThatThrownBy(() -> crypto.unwrapKey(tampered, kek))
                    .isInstanceOf(IntegrityException.class);
        }

        @Test
        @DisplayName("Should reject a wrapped key whose segments were reordered")
        void shouldRejectSwappedSegments() {
            byte[] kek = Base64.getDecoder().decode(KEK_B64);
            String[] parts = crypto.wrapKey(crypto.generateDataKey(), kek).split("\\.");
            String swapped = parts[0] + "." + parts[2] + "." + parts[1];

            assertThatThrownBy(() -> crypto.unwrapKey(swapped, kek))
                    .isInstanceOf(IntegrityException.class);
        }
    }

    @Nested
    @DisplayName("Message bodies")
    class MessageBodies {

        @Test
        @DisplayName("Should decrypt what it encrypted under the conversation key")
        void shouldRoundTripText() {
            String packed = crypto.newWrappedConversationKey();
            EncryptedPayload sealed;
            try (DataKey dek = crypto.unwrapConversationKey(packed)) {
                sealed = crypto.encryptText("Olá, tudo bem? ñ", dek);
            }
            try (DataKey dek = crypto.unwrapConversationKey(packed)) {
                String text = crypto.decryptText(sealed.ciphertextBase64(), sealed.nonceBase64(),
                        sealed.tagBase64(), dek);
                assertThat(text).isEqualTo("Olá, tudo bem? ñ");
            }
        }

        @Test
        @DisplayName("Should use a fresh nonce for every encryption")
        void shouldUseFreshNonce() {
            byte[] key = crypto.generateDataKey();
            byte[] plaintext = "same".getBytes(StandardCharsets.UTF_8);

            EncryptedPayload a = crypto.encrypt(plaintext, key);
            EncryptedPayload b = crypto.encrypt(plaintext, key);

            assertThat(a.getNonce()).isNotEqualTo(b.getNonce());
            assertThat(a.getCiphertext()).isNotEqualTo(b.getCiphertext());
        }

        @Test
        @DisplayName("Should detect a tampered ciphertext")
        void shouldDetectTampering() {
            byte[] key = crypto.generateDataKey();
            EncryptedPayload sealed = crypto.encrypt("secret".getBytes(StandardCharsets.UTF_8), key);
            byte[] tampered = sealed.getCiphertext().clone();
            tampered[0] ^= 1;

            assertThatThrownBy(() -> crypto.decrypt(tampered, sealed.getNonce(), sealed.getTag(), key))
                    .isInstanceOf(IntegrityException.class);
        }

        @Test
        @DisplayName("Should detect a tampered tag")
        void shouldDetectTamperedTag() {
            byte[] key = crypto.generateDataKey();
            EncryptedPayload sealed = crypto.encrypt("secret".getBytes(StandardCharsets.UTF_8), key);
            byte[] tag = sealed.getTag().clone();
            tag[15] ^= 1;

            assertThatThrownBy(() -> crypto.decrypt(sealed.getCiphertext(), sealed.getNonce(), tag, key))
                    .isInstanceOf(IntegrityException.class);
        }

        @Test
        @DisplayName("Should fail under the wrong data key")
        void shouldFailWithWrongKey() {
            EncryptedPayload sealed = crypto.encrypt("secret".getBytes(StandardCharsets.UTF_8),
                    crypto.generateDataKey());

            assertThatThrownBy(() -> crypto.decrypt(sealed.getCiphertext(), sealed.getNonce(), sealed.getTag(),
                    crypto.generateDataKey()))
                    .isInstanceOf(IntegrityException.class);
        }

        @Test
        @DisplayName("Should reject nonces and tags of the wrong length")
        void shouldRejectBadLengths() {
            byte[] key = crypto.generateDataKey();
            EncryptedPayload sealed = crypto.encrypt(new byte[]{1, 2, 3}, key);

            assertThatThrownBy(() -> crypto.decrypt(sealed.getCiphertext(), new byte[8], sealed.getTag(), key))
                    .isInstanceOf(IntegrityException.class);
            assertThatThrownBy(() -> crypto.decrypt(sealed.getCiphertext(), sealed.getNonce(), new byte[4], key))
                    .isInstanceOf(IntegrityException.class);
        }

        @Test
        @DisplayName("Should refuse a key that is not 32 bytes")
        void shouldRefuseShortKey() {
            assertThatThrownBy(() -> crypto.encrypt(new byte[]{1}, new byte[16]))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should refuse a closed data key")
        void shouldRefuseClosedKey() {
            DataKey dek = crypto.unwrapConversationKey(crypto.newWrappedConversationKey());
            dek.close();

            assertThatThrownBy(() -> crypto.encryptText("x", dek))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
