package com.vrforacle.domain;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed on-chain layout of the randomness request event and record. All integers are little-endian
 * and the record is packed (no padding).
 *
 * <pre>
 * record  := disc[8] result[32] proof[80] seeds[32] request_timestamp:i64 callback buf[1024]
 * callback := program_id[32] (pubkey[32] is_signer:u8 is_writable:u8)[32] accounts_len:u32 ix_data[1024] ix_data_len:u32
 * event   := disc[8] vrf:pubkey[32]
 * </pre>
 */
public final class VrfWireFormat {

    public static final int DISCRIMINATOR_LENGTH = 8;
    public static final int PROOF_LENGTH = 80;
    public static final int SEEDS_LENGTH = 32;
    public static final int MAX_CALLBACK_ACCOUNTS = 32;
    public static final int MAX_IX_DATA_LENGTH = 1024;

    private static final int ACCOUNT_META_LENGTH = PublicKey.LENGTH + 2;
    private static final int CALLBACK_LENGTH = PublicKey.LENGTH
            + MAX_CALLBACK_ACCOUNTS * ACCOUNT_META_LENGTH + 4 + MAX_IX_DATA_LENGTH + 4;

    /** Record bytes needed after the discriminator; the trailing reserved buffer is not read. */
    public static final int RECORD_LENGTH = VrfResult.LENGTH + PROOF_LENGTH + SEEDS_LENGTH + 8 + CALLBACK_LENGTH;

    public static final byte[] ACCOUNT_DISCRIMINATOR = {101, 35, 62, (byte) 239, 103, (byte) 151, 6, 18};
    public static final byte[] REQUEST_EVENT_DISCRIMINATOR = discriminator("event:VrfRequestRandomness");

    private VrfWireFormat() {
    }

    /**
     * First 8 bytes of SHA-256 over the namespaced type name, e.g. {@code account:VrfAccountData}.
     */
    public static byte[] discriminator(String preimage) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(preimage.getBytes(StandardCharsets.UTF_8));
            return Arrays.copyOf(hash, DISCRIMINATOR_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * Address of the request record carried by a randomness-request event payload (discriminator included).
     *
     * @throws IllegalArgumentException if the payload is too short
     */
    public static PublicKey decodeRequestEvent(byte[] payload) {
        if (payload.length < DISCRIMINATOR_LENGTH + PublicKey.LENGTH) {
            throw new IllegalArgumentException("request event payload too short: " + payload.length + " bytes");
        }
        return PublicKey.of(Arrays.copyOfRange(payload, DISCRIMINATOR_LENGTH, DISCRIMINATOR_LENGTH + PublicKey.LENGTH));
    }

    /**
     * Decodes a record from raw account bytes with the discriminator already verified by the caller.
     *
     * @throws IllegalArgumentException if the data is too short or the stored lengths exceed their slots
     */
    public static VrfAccountData decodeAccount(byte[] accountData) {
        if (accountData.length < DISCRIMINATOR_LENGTH + RECORD_LENGTH) {
            throw new IllegalArgumentException("account data too short: " + accountData.length + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(accountData, DISCRIMINATOR_LENGTH, RECORD_LENGTH).order(ByteOrder.LITTLE_ENDIAN);

        VrfResult result = VrfResult.of(read(buf, VrfResult.LENGTH));
        byte[] proof = read(buf, PROOF_LENGTH);
        byte[] seeds = read(buf, SEEDS_LENGTH);
        long requestTimestamp = buf.getLong();

        PublicKey programId = PublicKey.of(read(buf, PublicKey.LENGTH));
        List<AccountMetaPacked> slots = new ArrayList<>(MAX_CALLBACK_ACCOUNTS);
        for (int i = 0; i < MAX_CALLBACK_ACCOUNTS; i++) {
            PublicKey pubkey = PublicKey.of(read(buf, PublicKey.LENGTH));
            boolean isSigner = buf.get() != 0;
            boolean isWritable = buf.get() != 0;
            slots.add(new AccountMetaPacked(pubkey, isSigner, isWritable));
        }
        long accountsLen = Integer.toUnsignedLong(buf.getInt());
        byte[] ixData = read(buf, MAX_IX_DATA_LENGTH);
        long ixDataLen = Integer.toUnsignedLong(buf.getInt());

        if (accountsLen > MAX_CALLBACK_ACCOUNTS) {
            throw new IllegalArgumentException("callback accounts_len out of range: " + accountsLen);
        }
        if (ixDataLen > MAX_IX_DATA_LENGTH) {
            throw new IllegalArgumentException("callback ix_data_len out of range: " + ixDataLen);
        }
        CallbackTemplate callback = new CallbackTemplate(
                programId,
                slots.subList(0, (int) accountsLen),
                Arrays.copyOf(ixData, (int) ixDataLen));
        return new VrfAccountData(result, proof, seeds, requestTimestamp, callback);
    }

    private static byte[] read(ByteBuffer buf, int length) {
        byte[] out = new byte[length];
        buf.get(out);
        return out;
    }
}
