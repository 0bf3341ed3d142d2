package com.vrforacle.ingestion.tx;

import com.vrforacle.common.Base58;
import com.vrforacle.domain.PublicKey;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * A legacy message with all required signatures. The first signature is the transaction id.
 */
public final class SignedTransaction {

    private final LegacyMessage message;
    private final List<byte[]> signatures;

    private SignedTransaction(LegacyMessage message, List<byte[]> signatures) {
        this.message = message;
        this.signatures = signatures;
    }

    /**
     * Signs {@code instructions} with {@code payer} as fee payer and sole signer.
     *
     * @throws MissingSignerException if an instruction requires a signature from another account
     */
    public static SignedTransaction sign(List<Instruction> instructions, Keypair payer, byte[] recentBlockhash) {
        return sign(LegacyMessage.compile(payer.getPublicKey(), instructions, recentBlockhash), payer);
    }

    static SignedTransaction sign(LegacyMessage message, Keypair payer) {
        for (PublicKey signer : message.getSignerKeys()) {
            if (!signer.equals(payer.getPublicKey())) {
                throw new MissingSignerException(signer);
            }
        }
        byte[] serialized = message.serialize();
        List<byte[]> signatures = new ArrayList<>();
        signatures.add(payer.sign(serialized));
        return new SignedTransaction(message, signatures);
    }

    /** Same instructions and payer against a newer blockhash, re-signed. */
    public SignedTransaction withRecentBlockhash(byte[] blockhash, Keypair payer) {
        return sign(message.withRecentBlockhash(blockhash), payer);
    }

    public String getSignature() {
        return Base58.encode(signatures.get(0));
    }

    public byte[] getRecentBlockhash() {
        return message.getRecentBlockhash();
    }

    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ShortVec.writeLength(out, signatures.size());
        for (byte[] sig : signatures) {
            out.writeBytes(sig);
        }
        out.writeBytes(message.serialize());
        return out.toByteArray();
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(serialize());
    }
}
