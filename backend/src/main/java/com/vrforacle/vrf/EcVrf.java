package com.vrforacle.vrf;

import com.vrforacle.common.ByteUtils;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECFieldElement;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * ECVRF over secp256k1 with SHA-256 and try-and-increment hash-to-curve (suite string 0xFE),
 * as in draft-irtf-cfrg-vrf-05. Proofs are {@code Gamma[33] || c[16] || s[32]}; outputs are 32 bytes.
 * <p>
 * Instances hold only immutable curve parameters, so one instance may be shared across threads.
 */
public final class EcVrf {

    public static final int PROOF_LENGTH = 81;
    public static final int HASH_LENGTH = 32;

    private static final byte SUITE = (byte) 0xFE;
    private static final int POINT_LENGTH = 33;
    private static final int C_LENGTH = 16;
    private static final int S_LENGTH = 32;

    private final ECCurve curve;
    private final ECPoint generator;
    private final BigInteger order;

    public EcVrf() {
        X9ECParameters params = CustomNamedCurves.getByName("secp256k1");
        this.curve = params.getCurve();
        this.generator = params.getG();
        this.order = params.getN();
    }

    /**
     * Compressed public key (33 bytes) for the given big-endian secret scalar.
     */
    public byte[] derivePublicKey(byte[] secretKey) {
        return generator.multiply(toScalar(secretKey)).getEncoded(true);
    }

    public byte[] prove(byte[] secretKey, byte[] alpha) {
        BigInteger x = toScalar(secretKey);
        ECPoint publicKey = generator.multiply(x).normalize();
        ECPoint h = hashToCurve(publicKey, alpha);
        byte[] hString = h.getEncoded(true);
        ECPoint gamma = h.multiply(x).normalize();

        BigInteger k = nonce(x, hString);
        ECPoint u = generator.multiply(k);
        ECPoint v = h.multiply(k);
        BigInteger c = hashPoints(h, gamma, u, v);
        BigInteger s = k.add(c.multiply(x)).mod(order);

        return ByteUtils.concat(
                gamma.getEncoded(true),
                ByteUtils.toFixedLength(c, C_LENGTH),
                ByteUtils.toFixedLength(s, S_LENGTH));
    }

    /**
     * VRF output (beta) of a proof. The curve cofactor is 1.
     *
     * @throws IllegalArgumentException if the proof cannot be decoded
     */
    public byte[] proofToHash(byte[] proof) {
        ECPoint gamma = decodeProof(proof).gamma();
        return sha256(new byte[]{SUITE, 0x03}, gamma.getEncoded(true));
    }

    /**
     * @return the VRF output if the proof is valid for {@code publicKey} and {@code alpha}
     * @throws InvalidProofException if verification fails
     */
    public byte[] verify(byte[] publicKey, byte[] proof, byte[] alpha) {
        ECPoint y;
        Proof decoded;
        try {
            y = curve.decodePoint(publicKey);
            decoded = decodeProof(proof);
        } catch (IllegalArgumentException e) {
            throw new InvalidProofException("malformed key or proof: " + e.getMessage(), e);
        }
        ECPoint h = hashToCurve(y, alpha);
        ECPoint u = generator.multiply(decoded.s()).subtract(y.multiply(decoded.c()));
        ECPoint v = h.multiply(decoded.s()).subtract(decoded.gamma().multiply(decoded.c()));
        BigInteger expected = hashPoints(h, decoded.gamma(), u, v);
        if (!expected.equals(decoded.c())) {
            throw new InvalidProofException("proof does not verify");
        }
        return proofToHash(proof);
    }

    private BigInteger toScalar(byte[] secretKey) {
        if (secretKey == null || secretKey.length == 0) {
            throw new IllegalArgumentException("VRF secret key is empty");
        }
        BigInteger x = new BigInteger(1, secretKey);
        if (x.signum() == 0 || x.compareTo(order) >= 0) {
            throw new IllegalArgumentException("VRF secret key is out of range");
        }
        return x;
    }

    /** Try-and-increment: first counter whose hash is the x-coordinate of a curve point; y is taken even. */
    private ECPoint hashToCurve(ECPoint publicKey, byte[] alpha) {
        byte[] prefix = ByteUtils.concat(new byte[]{SUITE, 0x01}, publicKey.getEncoded(true), alpha);
        BigInteger fieldSize = curve.getField().getCharacteristic();
        for (int ctr = 0; ctr < 256; ctr++) {
            BigInteger xValue = new BigInteger(1, sha256(prefix, new byte[]{(byte) ctr}));
            if (xValue.compareTo(fieldSize) >= 0) {
                continue;
            }
            ECFieldElement x = curve.fromBigInteger(xValue);
            ECFieldElement y = x.square().add(curve.getA()).multiply(x).add(curve.getB()).sqrt();
            if (y == null) {
                continue;
            }
            if (y.testBitZero()) {
                y = y.negate();
            }
            return curve.createPoint(x.toBigInteger(), y.toBigInteger());
        }
        throw new IllegalStateException("hash to curve exhausted all counters");
    }

    private BigInteger nonce(BigInteger x, byte[] hString) {
        HMacDSAKCalculator calculator = new HMacDSAKCalculator(new SHA256Digest());
        calculator.init(order, x, sha256(hString));
        return calculator.nextK();
    }

    private BigInteger hashPoints(ECPoint... points) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(SUITE);
        digest.update((byte) 0x02);
        for (ECPoint p : points) {
            byte[] encoded = p.getEncoded(true);
            digest.update(encoded, 0, encoded.length);
        }
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return new BigInteger(1, Arrays.copyOf(out, C_LENGTH));
    }

    private Proof decodeProof(byte[] proof) {
        if (proof == null || proof.length != PROOF_LENGTH) {
            throw new IllegalArgumentException("proof must be " + PROOF_LENGTH + " bytes");
        }
        ECPoint gamma = curve.decodePoint(Arrays.copyOfRange(proof, 0, POINT_LENGTH));
        BigInteger c = new BigInteger(1, Arrays.copyOfRange(proof, POINT_LENGTH, POINT_LENGTH + C_LENGTH));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(proof, POINT_LENGTH + C_LENGTH, PROOF_LENGTH));
        return new Proof(gamma, c, s);
    }

    private static byte[] sha256(byte[]... parts) {
        SHA256Digest digest = new SHA256Digest();
        for (byte[] p : parts) {
            digest.update(p, 0, p.length);
        }
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    private record Proof(ECPoint gamma, BigInteger c, BigInteger s) {
    }
}
