package com.binauditor.core.crypto;

import com.binauditor.core.testing.TestKeys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TrustMaterialLoader}.
 */
class TrustMaterialLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_withPemCertificates_readsEach() throws Exception {
        Path ca = TestKeys.copyTo(tempDir, TestKeys.CA);
        Path leaf = TestKeys.copyTo(tempDir, TestKeys.LEAF);

        TrustMaterial trust = TrustMaterialLoader.load(List.of(ca, leaf));

        assertThat(trust.certificates()).containsExactly(TestKeys.ca(), TestKeys.leaf());
        assertThat(trust.publicKeys()).isEmpty();
    }

    @Test
    void load_withPublicKeyBlock_readsBareKey() throws Exception {
        // Given
        String pem = "-----BEGIN PUBLIC KEY-----\n"
            + Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                .encodeToString(TestKeys.rogue().getPublicKey().getEncoded())
            + "\n-----END PUBLIC KEY-----\n"
            + "-----BEGIN EC PARAMETERS-----\nBggqhkjOPQMBBw==\n-----END EC PARAMETERS-----\n";
        Path file = Files.writeString(tempDir.resolve("signer.pub"), pem);

        // When
        TrustMaterial trust = TrustMaterialLoader.load(List.of(file));

        // Then
        assertThat(trust.certificates()).isEmpty();
        assertThat(trust.publicKeys()).hasSize(1);
        assertThat(trust.trustsKey(TestKeys.rogue().getPublicKey())).isTrue();
        assertThat(trust.trustsKey(TestKeys.leaf().getPublicKey())).isFalse();
    }

    @Test
    void load_withDerFile_readsCertificate() throws Exception {
        Path file = Files.write(tempDir.resolve("ca.der"), TestKeys.ca().getEncoded());

        TrustMaterial trust = TrustMaterialLoader.load(List.of(file));

        assertThat(trust.certificates()).containsExactly(TestKeys.ca());
        assertThat(trust.trustsKey(TestKeys.ca().getPublicKey())).isTrue();
    }

    @Test
    void load_withGarbage_throws() throws Exception {
        Path file = Files.writeString(tempDir.resolve("junk.pem"), "not a certificate");

        assertThatThrownBy(() -> TrustMaterialLoader.load(List.of(file)))
            .isInstanceOf(GeneralSecurityException.class);
    }
}
