package com.vrforacle.ingestion.callback;

import com.vrforacle.common.ByteUtils;
import com.vrforacle.domain.AccountMetaPacked;
import com.vrforacle.domain.CallbackTemplate;
import com.vrforacle.domain.VrfResult;
import com.vrforacle.fulfillment.FulfillmentException;
import com.vrforacle.ingestion.tx.AccountMeta;
import com.vrforacle.ingestion.tx.Instruction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Completes a stored callback template: the first occurrence of the result placeholder in the
 * instruction data is overwritten with the randomness.
 */
@Component
@Slf4j
public class CallbackInstructionBuilder {

    /** Placeholder offset when the result is the first argument, right after the 8-byte instruction discriminator. */
    public static final int EXPECTED_RESULT_OFFSET = 8;

    public Instruction build(CallbackTemplate template, VrfResult randomness) {
        byte[] data = template.ixData();
        int offset = ByteUtils.indexOf(data, VrfResult.sentinel());
        if (offset < 0) {
            throw new FulfillmentException(FulfillmentException.Reason.PLACEHOLDER_NOT_FOUND,
                    "randomness placeholder not found in callback instruction data");
        }
        if (offset != EXPECTED_RESULT_OFFSET) {
            log.warn("VrfResult maybe not the first parameter of the callback, offset={}", offset);
        }
        System.arraycopy(randomness.toBytes(), 0, data, offset, VrfResult.LENGTH);

        List<AccountMeta> accounts = template.accounts().stream()
                .map(CallbackInstructionBuilder::toAccountMeta)
                .toList();
        return new Instruction(template.programId(), accounts, data);
    }

    private static AccountMeta toAccountMeta(AccountMetaPacked packed) {
        return new AccountMeta(packed.pubkey(), packed.isSigner(), packed.isWritable());
    }
}
