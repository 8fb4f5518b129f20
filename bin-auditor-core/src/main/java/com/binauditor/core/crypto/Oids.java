package com.binauditor.core.crypto;

import java.util.Map;

/**
 * Object identifiers used by CMS signing structures, with their JCA names.
 */
public final class Oids {

    public static final String PKCS7_DATA = "1.2.840.113549.1.7.1";
    public static final String PKCS7_SIGNED_DATA = "1.2.840.113549.1.7.2";
    public static final String MESSAGE_DIGEST = "1.2.840.113549.1.9.4";
    public static final String SPC_INDIRECT_DATA = "1.3.6.1.4.1.311.2.1.4";

    public static final String SHA1 = "1.3.14.3.2.26";
    public static final String SHA256 = "2.16.840.1.101.3.4.2.1";
    public static final String SHA384 = "2.16.840.1.101.3.4.2.2";
    public static final String SHA512 = "2.16.840.1.101.3.4.2.3";

    public static final String RSA_ENCRYPTION = "1.2.840.113549.1.1.1";
    public static final String EC_PUBLIC_KEY = "1.2.840.10045.2.1";

    private static final Map<String, String> DIGESTS = Map.of(
        SHA1, "SHA-1",
        SHA256, "SHA-256",
        SHA384, "SHA-384",
        SHA512, "SHA-512"
    );

    private static final Map<String, String> SIGNATURES = Map.of(
        "1.2.840.113549.1.1.5", "SHA1withRSA",
        "1.2.840.113549.1.1.11", "SHA256withRSA",
        "1.2.840.113549.1.1.12", "SHA384withRSA",
        "1.2.840.113549.1.1.13", "SHA512withRSA",
        "1.2.840.10045.4.1", "SHA1withECDSA",
        "1.2.840.10045.4.3.2", "SHA256withECDSA",
        "1.2.840.10045.4.3.3", "SHA384withECDSA",
        "1.2.840.10045.4.3.4", "SHA512withECDSA"
    );

    private Oids() {
    }

    /**
     * Resolves a digest algorithm OID to its JCA name.
     *
     * @throws CmsException for unknown digests
     */
    public static String digestName(String oid) throws CmsException {
        String name = DIGESTS.get(oid);
        if (name == null) {
            throw new CmsException("Unsupported digest algorithm " + oid);
        }
        return name;
    }

    /**
     * Resolves the JCA signature algorithm for a signer. A bare key algorithm OID
     * ({@code rsaEncryption}) is combined with the signer's digest algorithm.
     */
    public static String signatureName(String signatureOid, String digestOid) throws CmsException {
        String name = SIGNATURES.get(signatureOid);
        if (name != null) {
            return name;
        }
        String digest = digestName(digestOid).replace("-", "");
        if (RSA_ENCRYPTION.equals(signatureOid)) {
            return digest + "withRSA";
        }
        if (EC_PUBLIC_KEY.equals(signatureOid)) {
            return digest + "withECDSA";
        }
        throw new CmsException("Unsupported signature algorithm " + signatureOid);
    }
}
