package com.binauditor.core.crypto;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DerElement}.
 */
class DerElementTest {

    @Test
    void asOid_decodesMultiByteArcs() throws Exception {
        byte[] der = {0x06, 0x09, 0x2A, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xF7, 0x0D, 0x01, 0x07, 0x02};

        assertThat(DerElement.parse(der).asOid()).isEqualTo("1.2.840.113549.1.7.2");
    }

    @Test
    void children_withNestingAtLimit_isAccepted() throws Exception {
        // Given
        DerElement element = DerElement.parse(nestedSequences(DerElement.MAX_DEPTH));

        // When
        for (int i = 0; i < DerElement.MAX_DEPTH - 1; i++) {
            element = element.firstChild();
        }

        // Then
        assertThat(element.depth()).isEqualTo(DerElement.MAX_DEPTH - 1);
        assertThat(element.children()).isEmpty();
    }

    @Test
    void children_withNestingBeyondLimit_throws() throws Exception {
        // Given
        DerElement element = DerElement.parse(nestedSequences(DerElement.MAX_DEPTH + 8));
        for (int i = 0; i < DerElement.MAX_DEPTH; i++) {
            element = element.firstChild();
        }
        DerElement deepest = element;

        // When / Then
        assertThatThrownBy(deepest::children)
            .isInstanceOf(CmsException.class)
            .hasMessageContaining("DER nesting exceeds " + DerElement.MAX_DEPTH + " levels");
    }

    @Test
    void parse_withFourByteLengthPastContainer_throws() {
        byte[] der = {0x30, (byte) 0x84, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xF0, 0x00};

        assertThatThrownBy(() -> DerElement.parse(der))
            .isInstanceOf(CmsException.class)
            .hasMessageContaining("overruns its container");
    }

    @Test
    void parse_withOffsetNearIntLimit_throwsTruncated() {
        byte[] der = {0x30, 0x00};

        assertThatThrownBy(() -> DerElement.parse(der, Integer.MAX_VALUE - 1, der.length))
            .isInstanceOf(CmsException.class)
            .hasMessageContaining("truncated");
    }

    @Test
    void parse_withOversizedLengthField_throws() {
        byte[] der = {0x04, (byte) 0x85, 0x01, 0x00, 0x00, 0x00, 0x00};

        assertThatThrownBy(() -> DerElement.parse(der))
            .isInstanceOf(CmsException.class)
            .hasMessageContaining("Invalid DER length");
    }

    @Test
    void asOid_withUnterminatedArc_throws() {
        byte[] der = {0x06, 0x02, 0x2A, (byte) 0x86};

        assertThatThrownBy(() -> DerElement.parse(der).asOid())
            .isInstanceOf(CmsException.class)
            .hasMessage("Object identifier ends inside an arc");
    }

    @Test
    void asOid_withArcBeyondLongRange_throws() {
        byte[] der = new byte[14];
        der[0] = DerElement.OBJECT_IDENTIFIER;
        der[1] = 12;
        for (int i = 2; i < 13; i++) {
            der[i] = (byte) 0xFF;
        }
        der[13] = 0x01;

        assertThatThrownBy(() -> DerElement.parse(der).asOid())
            .isInstanceOf(CmsException.class)
            .hasMessage("Object identifier arc is too large");
    }

    @Test
    void asInteger_withEmptyContent_throws() {
        assertThatThrownBy(() -> DerElement.parse(new byte[] {0x02, 0x00}).asInteger())
            .isInstanceOf(CmsException.class)
            .hasMessage("Empty DER integer");
    }

    @Test
    void asInteger_readsTwosComplement() throws Exception {
        assertThat(DerElement.parse(new byte[] {0x02, 0x02, 0x00, (byte) 0xFF}).asInteger())
            .isEqualTo(BigInteger.valueOf(255));
    }

    @Test
    void cmsParse_withEmptyEncapsulatedContent_throwsCmsException() {
        // Given: SignedData with version, no digest algorithms, empty content info, no signers
        byte[] der = {
            0x30, 0x18,
            0x06, 0x09, 0x2A, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xF7, 0x0D, 0x01, 0x07, 0x02,
            (byte) 0xA0, 0x0B,
            0x30, 0x09, 0x02, 0x01, 0x01, 0x31, 0x00, 0x30, 0x00, 0x31, 0x00};

        // When / Then
        assertThatThrownBy(() -> CmsSignedData.parse(der))
            .isInstanceOf(CmsException.class)
            .hasMessage("EncapsulatedContentInfo is empty");
    }

    private static byte[] nestedSequences(int levels) {
        byte[] der = {DerElement.SEQUENCE, 0x00};
        for (int i = 1; i < levels; i++) {
            byte[] outer = new byte[der.length + 2];
            outer[0] = DerElement.SEQUENCE;
            outer[1] = (byte) der.length;
            System.arraycopy(der, 0, outer, 2, der.length);
            der = outer;
        }
        return der;
    }
}
