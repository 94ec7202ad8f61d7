package com.phonepe.cosign.core.crypto;

import com.phonepe.cosign.core.digest.ContentDigest;
import com.phonepe.cosign.core.errors.CryptoError;
import com.phonepe.cosign.core.model.AgentIdentity;
import lombok.experimental.UtilityClass;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * Ed25519 key handling. Keys travel as Base64 of their raw 32 byte form; the JDK wants them wrapped in X.509 /
 * PKCS#8 envelopes, which for Ed25519 are fixed prefixes.
 */
@UtilityClass
public class Ed25519Identities {
    public static final String ALGORITHM = "Ed25519";

    private static final byte[] X509_PREFIX = hex("302a300506032b6570032100");
    private static final byte[] PKCS8_PREFIX = hex("302e020100300506032b657004220420");
    private static final int RAW_KEY_LENGTH = 32;
    private static final int AGENT_ID_LENGTH = 32;

    public static AgentIdentity generate() {
        try {
            final var keyPair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            return new AgentIdentity(deriveAgentId(keyPair.getPublic()), keyPair.getPublic(), keyPair.getPrivate());
        }
        catch (GeneralSecurityException e) {
            throw new CryptoError("Could not generate Ed25519 key pair", e);
        }
    }

    public static AgentIdentity fromEncoded(final String publicKey, final String privateKey) {
        final var pub = decodePublicKey(publicKey);
        return new AgentIdentity(deriveAgentId(pub), pub, decodePrivateKey(privateKey));
    }

    /**
     * Agent ids are the leading hex characters of the SHA-256 of the raw public key, so they can be checked against
     * any key that claims them
     */
    public static String deriveAgentId(final PublicKey publicKey) {
        return ContentDigest.digestBytes(rawPublicKey(publicKey)).substring(0, AGENT_ID_LENGTH);
    }

    public static String encodePublicKey(final PublicKey publicKey) {
        return Base64.getEncoder().encodeToString(rawPublicKey(publicKey));
    }

    public static String encodePrivateKey(final PrivateKey privateKey) {
        return Base64.getEncoder().encodeToString(stripPrefix(privateKey.getEncoded(), PKCS8_PREFIX));
    }

    public static PublicKey decodePublicKey(final String encoded) {
        try {
            final var spec = new X509EncodedKeySpec(withPrefix(X509_PREFIX, decodeRaw(encoded)));
            return KeyFactory.getInstance(ALGORITHM).generatePublic(spec);
        }
        catch (GeneralSecurityException e) {
            throw new CryptoError("Invalid Ed25519 public key", e);
        }
    }

    public static PrivateKey decodePrivateKey(final String encoded) {
        try {
            final var spec = new PKCS8EncodedKeySpec(withPrefix(PKCS8_PREFIX, decodeRaw(encoded)));
            return KeyFactory.getInstance(ALGORITHM).generatePrivate(spec);
        }
        catch (GeneralSecurityException e) {
            throw new CryptoError("Invalid Ed25519 private key", e);
        }
    }

    private static byte[] rawPublicKey(final PublicKey publicKey) {
        return stripPrefix(publicKey.getEncoded(), X509_PREFIX);
    }

    private static byte[] decodeRaw(final String encoded) {
        final byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encoded == null ? "" : encoded);
        }
        catch (IllegalArgumentException e) {
            throw new CryptoError("Key is not valid Base64", e);
        }
        if (raw.length != RAW_KEY_LENGTH) {
            throw new CryptoError("Expected %d byte Ed25519 key, got %d".formatted(RAW_KEY_LENGTH, raw.length));
        }
        return raw;
    }

    private static byte[] stripPrefix(final byte[] encoded, final byte[] prefix) {
        if (encoded == null
                || encoded.length != prefix.length + RAW_KEY_LENGTH
                || !Arrays.equals(prefix, Arrays.copyOf(encoded, prefix.length))) {
            throw new CryptoError("Unsupported key encoding, expected a bare Ed25519 key");
        }
        return Arrays.copyOfRange(encoded, prefix.length, encoded.length);
    }

    private static byte[] withPrefix(final byte[] prefix, final byte[] raw) {
        final var out = Arrays.copyOf(prefix, prefix.length + raw.length);
        System.arraycopy(raw, 0, out, prefix.length, raw.length);
        return out;
    }

    private static byte[] hex(final String value) {
        final var out = new byte[value.length() / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) Integer.parseInt(value.substring(i * 2, i * 2 + 2), 16);
        }
        return out;
    }
}
