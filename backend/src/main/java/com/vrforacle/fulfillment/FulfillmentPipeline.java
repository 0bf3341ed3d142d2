package com.vrforacle.fulfillment;

import com.vrforacle.common.Base58;
import com.vrforacle.common.ByteUtils;
import com.vrforacle.config.VrfOracleContext;
import com.vrforacle.domain.PublicKey;
import com.vrforacle.domain.VrfAccountData;
import com.vrforacle.domain.VrfWireFormat;
import com.vrforacle.ingestion.adapter.solana.SolanaLedgerClient;
import com.vrforacle.ingestion.callback.CallbackInstructionBuilder;
import com.vrforacle.ingestion.parser.LogParser;
import com.vrforacle.ingestion.parser.ParsedLogs;
import com.vrforacle.ingestion.parser.ProgramEvent;
import com.vrforacle.ingestion.submit.TransactionSubmitter;
import com.vrforacle.ingestion.tx.AccountMeta;
import com.vrforacle.ingestion.tx.Instruction;
import com.vrforacle.vrf.VrfEngine;
import com.vrforacle.vrf.VrfOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * End-to-end handling of one transaction's logs: parse, find the randomness request, load its record,
 * prove, complete the callback and submit it.
 * <p>
 * Holds no per-call state; one instance serves all subscriptions and the backfill concurrently.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FulfillmentPipeline {

    private final LogParser logParser;
    private final SolanaLedgerClient ledgerClient;
    private final VrfEngine vrfEngine;
    private final CallbackInstructionBuilder callbackBuilder;
    private final TransactionSubmitter transactionSubmitter;
    private final VrfOracleContext context;

    /**
     * @param expectedProgram tracked program whose subscription (or backfill) produced {@code logs}
     * @return the outcome, or empty when the logs carry no randomness request
     * @throws FulfillmentException on malformed logs or on-chain data
     */
    public Optional<FulfillmentOutcome> process(PublicKey expectedProgram, List<String> logs) {
        return fulfill(expectedProgram, logParser.parse(logs, context.programIds()));
    }

    public Optional<FulfillmentOutcome> fulfill(PublicKey expectedProgram, ParsedLogs parsed) {
        if (parsed.hasErrors()) {
            throw new FulfillmentException(FulfillmentException.Reason.PARSE_ERRORS, parsed.describeErrors());
        }
        Optional<ProgramEvent> request = parsed.events().stream()
                .filter(e -> e.hasDiscriminator(VrfWireFormat.REQUEST_EVENT_DISCRIMINATOR))
                .findFirst();
        if (request.isEmpty()) {
            log.debug("No randomness request in transaction");
            return Optional.empty();
        }
        ProgramEvent event = request.get();
        if (!event.programId().equals(expectedProgram)) {
            throw new FulfillmentException(FulfillmentException.Reason.PROGRAM_ID_MISMATCH,
                    "program_id not match: event from " + event.programId() + ", expected " + expectedProgram);
        }

        PublicKey requestAccount = decodeEvent(event);
        VrfAccountData record = loadRecord(requestAccount);
        if (record.result().isFulfilled()) {
            throw new FulfillmentException(FulfillmentException.Reason.ALREADY_FULFILLED,
                    "randomness request " + requestAccount + " already fulfilled");
        }

        VrfOutput output = prove(record.seeds());
        log.info("Random value: {} for request {}", Base58.encode(output.randomness().toBytes()), requestAccount);

        Instruction callback = callbackBuilder.build(record.callback(), output.randomness());
        requireOnlyOracleSigner(callback);
        String signature = transactionSubmitter.submit(callback);
        return Optional.of(new FulfillmentOutcome(signature, requestAccount, record.seeds(), output.proof(), output.randomness()));
    }

    private static PublicKey decodeEvent(ProgramEvent event) {
        try {
            return VrfWireFormat.decodeRequestEvent(event.data());
        } catch (IllegalArgumentException e) {
            throw new FulfillmentException(FulfillmentException.Reason.MALFORMED_EVENT,
                    "invalid randomness request event: " + e.getMessage(), e);
        }
    }

    private VrfAccountData loadRecord(PublicKey requestAccount) {
        byte[] data = ledgerClient.getAccountData(requestAccount, context.commitment())
                .orElseThrow(() -> new FulfillmentException(FulfillmentException.Reason.MALFORMED_ACCOUNT,
                        "randomness request account " + requestAccount + " not found"));
        if (!ByteUtils.startsWith(data, VrfWireFormat.ACCOUNT_DISCRIMINATOR)) {
            throw new FulfillmentException(FulfillmentException.Reason.INVALID_DISCRIMINATOR,
                    "account " + requestAccount + " is not a randomness request record");
        }
        try {
            return VrfWireFormat.decodeAccount(data);
        } catch (IllegalArgumentException e) {
            throw new FulfillmentException(FulfillmentException.Reason.MALFORMED_ACCOUNT,
                    "cannot decode randomness request account " + requestAccount + ": " + e.getMessage(), e);
        }
    }

    private VrfOutput prove(byte[] seeds) {
        try {
            return vrfEngine.proveAndHash(seeds);
        } catch (IllegalStateException e) {
            throw new FulfillmentException(FulfillmentException.Reason.RANDOMNESS_UNAVAILABLE, e.getMessage(), e);
        }
    }

    /** The oracle can only sign for itself; any other signer in the callback would fail on submit. */
    private void requireOnlyOracleSigner(Instruction callback) {
        PublicKey oracle = context.signer().getPublicKey();
        for (AccountMeta meta : callback.accounts()) {
            if (meta.isSigner() && !meta.pubkey().equals(oracle)) {
                throw new FulfillmentException(FulfillmentException.Reason.UNSUPPORTED_SIGNER,
                        "callback requires signature of " + meta.pubkey());
            }
        }
    }
}
