package com.vrforacle.ingestion.job;

import com.vrforacle.config.VrfOracleContext;
import com.vrforacle.domain.PublicKey;
import com.vrforacle.fulfillment.FulfillmentException;
import com.vrforacle.ingestion.adapter.RpcException;
import com.vrforacle.ingestion.adapter.solana.Cluster;
import com.vrforacle.ingestion.adapter.solana.Commitment;
import com.vrforacle.ingestion.adapter.solana.SignatureInfo;
import com.vrforacle.ingestion.adapter.solana.SolanaLedgerClient;
import com.vrforacle.ingestion.adapter.solana.TransactionLogs;
import com.vrforacle.ingestion.config.BackfillProperties;
import com.vrforacle.ingestion.tx.Keypair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HistoricalBackfillJobTest {

    private static final PublicKey PROGRAM = PublicKey.fromBase58("DEoxdV1CCWvbeGp8PpwkUifmm3pV5AgtFwFaS4P7qZeZ");
    private static final List<String> LOGS = List.of("Program " + PROGRAM + " invoke [1]", "Program " + PROGRAM + " success");

    @Mock private SolanaLedgerClient ledgerClient;
    @Mock private FulfillmentDispatcher dispatcher;

    private final List<Runnable> submitted = new ArrayList<>();
    private BackfillProperties properties;
    private HistoricalBackfillJob job;

    @BeforeEach
    void setUp() {
        properties = new BackfillProperties();
        properties.setPageSize(2);
        properties.setMaxSignatures(5);
        VrfOracleContext context = new VrfOracleContext(Keypair.fromSeed(new byte[32]), Cluster.parse("localnet"),
                Commitment.CONFIRMED, List.of(PROGRAM));
        job = new HistoricalBackfillJob(ledgerClient, dispatcher, context, properties, submitted::add);
    }

    private static SignatureInfo ok(String signature) {
        return new SignatureInfo(signature, 1, false);
    }

    @Test
    @DisplayName("signatures are paged with the before cursor up to the configured maximum")
    void listSignatures_pagesUntilMax() {
        when(ledgerClient.getSignaturesForAddress(eq(PROGRAM), isNull(), eq(2), eq(Commitment.FINALIZED)))
                .thenReturn(List.of(ok("s1"), ok("s2")));
        when(ledgerClient.getSignaturesForAddress(PROGRAM, "s2", 2, Commitment.FINALIZED))
                .thenReturn(List.of(ok("s3"), ok("s4")));
        when(ledgerClient.getSignaturesForAddress(PROGRAM, "s4", 1, Commitment.FINALIZED))
                .thenReturn(List.of(ok("s5")));

        List<SignatureInfo> all = job.listSignatures(PROGRAM, Commitment.FINALIZED);

        assertThat(all).extracting(SignatureInfo::signature).containsExactly("s1", "s2", "s3", "s4", "s5");
    }

    @Test
    void listSignatures_shortPageEndsListing() {
        when(ledgerClient.getSignaturesForAddress(eq(PROGRAM), isNull(), eq(2), eq(Commitment.FINALIZED)))
                .thenReturn(List.of(ok("s1")));

        assertThat(job.listSignatures(PROGRAM, Commitment.FINALIZED)).hasSize(1);
        verify(ledgerClient, never()).getSignaturesForAddress(eq(PROGRAM), eq("s1"), anyInt(), any());
    }

    @Test
    void backfillProgram_skipsFailedAndContinuesPastErrors() {
        properties.setMaxSignatures(3);
        properties.setPageSize(10);
        when(ledgerClient.getSignaturesForAddress(eq(PROGRAM), isNull(), eq(3), eq(Commitment.FINALIZED)))
                .thenReturn(List.of(ok("s1"), new SignatureInfo("failed", 1, true), ok("s2")));
        when(ledgerClient.getTransactionLogs("s1", Commitment.FINALIZED))
                .thenReturn(Optional.of(new TransactionLogs("s1", false, LOGS)));
        when(ledgerClient.getTransactionLogs("s2", Commitment.FINALIZED))
                .thenReturn(Optional.of(new TransactionLogs("s2", false, LOGS)));
        when(dispatcher.processNow(PROGRAM, "s1", LOGS))
                .thenThrow(new FulfillmentException(FulfillmentException.Reason.ALREADY_FULFILLED, "already fulfilled"));
        when(dispatcher.processNow(PROGRAM, "s2", LOGS)).thenReturn(Optional.empty());

        int processed = job.backfillProgram(PROGRAM, Commitment.FINALIZED);

        assertThat(processed).isEqualTo(1);
        verify(dispatcher).processNow(PROGRAM, "s2", LOGS);
        verify(ledgerClient, never()).getTransactionLogs(eq("failed"), any());
    }

    @Test
    void backfillProgram_missingTransactionSkipped() {
        when(ledgerClient.getSignaturesForAddress(eq(PROGRAM), isNull(), eq(2), eq(Commitment.FINALIZED)))
                .thenReturn(List.of(ok("s1")));
        when(ledgerClient.getTransactionLogs("s1", Commitment.FINALIZED)).thenReturn(Optional.empty());

        assertThat(job.backfillProgram(PROGRAM, Commitment.FINALIZED)).isZero();
        verify(dispatcher, never()).processNow(any(), anyString(), anyList());
    }

    @Test
    void run_listingFailure_doesNotPropagate() {
        when(ledgerClient.getSignaturesForAddress(any(), any(), anyInt(), any())).thenThrow(new RpcException("node down"));

        job.run();

        verify(dispatcher, never()).processNow(any(), anyString(), anyList());
    }

    @Test
    void onApplicationReady_runsOnceOnBackfillExecutor() {
        job.onApplicationReady();
        job.onApplicationReady();

        assertThat(submitted).hasSize(1);
    }

    @Test
    void onApplicationReady_disabled_doesNothing() {
        properties.setEnabled(false);

        job.onApplicationReady();

        assertThat(submitted).isEmpty();
    }
}
