package com.vrforacle.ingestion.tx;

import com.vrforacle.domain.PublicKey;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Legacy transaction message. Account keys are de-duplicated (flags merged) and ordered: fee payer,
 * writable signers, read-only signers, writable non-signers, read-only non-signers; order of first
 * appearance is kept within each group.
 */
public final class LegacyMessage {

    private final List<PublicKey> accountKeys;
    private final int numRequiredSignatures;
    private final int numReadonlySigned;
    private final int numReadonlyUnsigned;
    private final byte[] recentBlockhash;
    private final List<Instruction> instructions;

    private LegacyMessage(List<PublicKey> accountKeys, int numRequiredSignatures, int numReadonlySigned,
                          int numReadonlyUnsigned, byte[] recentBlockhash, List<Instruction> instructions) {
        this.accountKeys = accountKeys;
        this.numRequiredSignatures = numRequiredSignatures;
        this.numReadonlySigned = numReadonlySigned;
        this.numReadonlyUnsigned = numReadonlyUnsigned;
        this.recentBlockhash = recentBlockhash;
        this.instructions = instructions;
    }

    public static LegacyMessage compile(PublicKey feePayer, List<Instruction> instructions, byte[] recentBlockhash) {
        if (recentBlockhash == null || recentBlockhash.length != 32) {
            throw new IllegalArgumentException("recent blockhash must be 32 bytes");
        }
        Map<PublicKey, boolean[]> flags = new LinkedHashMap<>();
        flags.put(feePayer, new boolean[]{true, true});
        for (Instruction ix : instructions) {
            for (AccountMeta meta : ix.accounts()) {
                boolean[] f = flags.computeIfAbsent(meta.pubkey(), k -> new boolean[2]);
                f[0] |= meta.isSigner();
                f[1] |= meta.isWritable();
            }
            flags.computeIfAbsent(ix.programId(), k -> new boolean[2]);
        }

        List<PublicKey> keys = new ArrayList<>(flags.size());
        int readonlySigned = 0;
        int readonlyUnsigned = 0;
        int signers = 0;
        for (int group = 0; group < 4; group++) {
            boolean signer = group < 2;
            boolean writable = group % 2 == 0;
            for (Map.Entry<PublicKey, boolean[]> e : flags.entrySet()) {
                if (e.getValue()[0] == signer && e.getValue()[1] == writable) {
                    keys.add(e.getKey());
                    if (signer) signers++;
                    if (signer && !writable) readonlySigned++;
                    if (!signer && !writable) readonlyUnsigned++;
                }
            }
        }
        if (keys.size() > 256) {
            throw new IllegalArgumentException("too many accounts in message: " + keys.size());
        }
        return new LegacyMessage(List.copyOf(keys), signers, readonlySigned, readonlyUnsigned,
                recentBlockhash.clone(), List.copyOf(instructions));
    }

    public LegacyMessage withRecentBlockhash(byte[] blockhash) {
        return compile(accountKeys.get(0), instructions, blockhash);
    }

    /** Keys whose signatures the transaction must carry, in signature order. */
    public List<PublicKey> getSignerKeys() {
        return accountKeys.subList(0, numRequiredSignatures);
    }

    public List<PublicKey> getAccountKeys() {
        return accountKeys;
    }

    public byte[] getRecentBlockhash() {
        return recentBlockhash.clone();
    }

    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(numRequiredSignatures);
        out.write(numReadonlySigned);
        out.write(numReadonlyUnsigned);

        ShortVec.writeLength(out, accountKeys.size());
        for (PublicKey key : accountKeys) {
            out.writeBytes(key.toBytes());
        }
        out.writeBytes(recentBlockhash);

        ShortVec.writeLength(out, instructions.size());
        for (Instruction ix : instructions) {
            out.write(accountKeys.indexOf(ix.programId()));
            ShortVec.writeLength(out, ix.accounts().size());
            for (AccountMeta meta : ix.accounts()) {
                out.write(accountKeys.indexOf(meta.pubkey()));
            }
            byte[] data = ix.data();
            ShortVec.writeLength(out, data.length);
            out.writeBytes(data);
        }
        return out.toByteArray();
    }
}
