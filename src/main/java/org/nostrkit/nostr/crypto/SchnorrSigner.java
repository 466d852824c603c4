package org.nostrkit.nostr.crypto;

import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * BIP-340 Schnorr signatures over secp256k1 using BouncyCastle curve arithmetic.
 * See: https://github.com/bitcoin/bips/blob/master/bip-0340.mediawiki
 */
public final class SchnorrSigner {

    private static final ECNamedCurveParameterSpec CURVE = ECNamedCurveTable.getParameterSpec("secp256k1");
    private static final BigInteger N = CURVE.getN();
    private static final BigInteger P = CURVE.getCurve().getField().getCharacteristic();
    private static final ECPoint G = CURVE.getG();

    /**
     * Derive the x-only public key for a private key.
     *
     * @param privateKey 32-byte private key
     * @return 32-byte x-only public key
     */
    public static byte[] getPublicKey(byte[] privateKey) {
        BigInteger d = scalar(privateKey);
        return xBytes(G.multiply(d).normalize());
    }

    /**
     * Sign a 32-byte message (an event id) with deterministic nonce derivation.
     *
     * @param message 32-byte message
     * @param privateKey 32-byte private key
     * @return 64-byte signature (R.x || s)
     */
    public static byte[] sign(byte[] message, byte[] privateKey) {
        requireLength(message, 32, "Message");
        BigInteger d = scalar(privateKey);

        ECPoint pubPoint = G.multiply(d).normalize();
        if (hasOddY(pubPoint)) {
            d = N.subtract(d);
        }
        byte[] px = xBytes(pubPoint);

        byte[] nonceSeed = taggedHash("BIP0340/nonce", BigIntegers.asUnsignedByteArray(32, d), px, message);
        BigInteger k = new BigInteger(1, nonceSeed).mod(N);
        if (k.signum() == 0) {
            throw new IllegalStateException("Derived nonce is zero");
        }

        ECPoint r = G.multiply(k).normalize();
        if (hasOddY(r)) {
            k = N.subtract(k);
        }
        byte[] rx = xBytes(r);

        BigInteger e = challenge(rx, px, message);
        BigInteger s = k.add(e.multiply(d)).mod(N);

        byte[] signature = new byte[64];
        System.arraycopy(rx, 0, signature, 0, 32);
        System.arraycopy(BigIntegers.asUnsignedByteArray(32, s), 0, signature, 32, 32);
        return signature;
    }

    /**
     * Verify a BIP-340 signature. Malformed input yields false rather than an exception.
     *
     * @param signature 64-byte signature
     * @param message 32-byte message
     * @param publicKey 32-byte x-only public key
     * @return true if the signature is valid
     */
    public static boolean verify(byte[] signature, byte[] message, byte[] publicKey) {
        if (signature == null || signature.length != 64
                || message == null || message.length != 32
                || publicKey == null || publicKey.length != 32) {
            return false;
        }

        byte[] rx = Arrays.copyOfRange(signature, 0, 32);
        BigInteger r = new BigInteger(1, rx);
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        if (r.compareTo(P) >= 0 || s.compareTo(N) >= 0) {
            return false;
        }

        ECPoint pubPoint = liftX(publicKey);
        if (pubPoint == null) {
            return false;
        }

        BigInteger e = challenge(rx, publicKey, message);
        ECPoint computed = G.multiply(s).add(pubPoint.multiply(N.subtract(e))).normalize();
        if (computed.isInfinity() || hasOddY(computed)) {
            return false;
        }
        return computed.getAffineXCoord().toBigInteger().equals(r);
    }

    /**
     * Point with the given x coordinate and even y, or null if x is not on the curve.
     */
    private static ECPoint liftX(byte[] x) {
        byte[] compressed = new byte[33];
        compressed[0] = 0x02;
        System.arraycopy(x, 0, compressed, 1, 32);
        try {
            return CURVE.getCurve().decodePoint(compressed).normalize();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static BigInteger challenge(byte[] rx, byte[] px, byte[] message) {
        return new BigInteger(1, taggedHash("BIP0340/challenge", rx, px, message)).mod(N);
    }

    private static BigInteger scalar(byte[] privateKey) {
        requireLength(privateKey, 32, "Private key");
        BigInteger d = new BigInteger(1, privateKey);
        if (d.signum() == 0 || d.compareTo(N) >= 0) {
            throw new IllegalArgumentException("Private key out of range");
        }
        return d;
    }

    private static boolean hasOddY(ECPoint point) {
        return point.getAffineYCoord().toBigInteger().testBit(0);
    }

    private static byte[] xBytes(ECPoint point) {
        return BigIntegers.asUnsignedByteArray(32, point.getAffineXCoord().toBigInteger());
    }

    private static void requireLength(byte[] bytes, int length, String what) {
        if (bytes == null || bytes.length != length) {
            throw new IllegalArgumentException(what + " must be " + length + " bytes");
        }
    }

    /**
     * BIP-340 tagged hash: SHA256(SHA256(tag) || SHA256(tag) || parts...).
     */
    static byte[] taggedHash(String tag, byte[]... parts) {
        MessageDigest sha256 = sha256();
        byte[] tagHash = sha256.digest(tag.getBytes(StandardCharsets.UTF_8));
        sha256.update(tagHash);
        sha256.update(tagHash);
        for (byte[] part : parts) {
            sha256.update(part);
        }
        return sha256.digest();
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private SchnorrSigner() {
        // Utility class
    }
}
