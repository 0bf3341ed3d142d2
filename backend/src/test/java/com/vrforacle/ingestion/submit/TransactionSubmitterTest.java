package com.vrforacle.ingestion.submit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vrforacle.common.Base58;
import com.vrforacle.common.RetryPolicy;
import com.vrforacle.domain.PublicKey;
import com.vrforacle.ingestion.adapter.RpcException;
import com.vrforacle.ingestion.adapter.solana.Commitment;
import com.vrforacle.ingestion.adapter.solana.LatestBlockhash;
import com.vrforacle.ingestion.adapter.solana.SignatureStatus;
import com.vrforacle.ingestion.adapter.solana.SolanaLedgerClient;
import com.vrforacle.ingestion.adapter.solana.SolanaRpcErrorException;
import com.vrforacle.ingestion.tx.AccountMeta;
import com.vrforacle.ingestion.tx.Instruction;
import com.vrforacle.ingestion.tx.Keypair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TransactionSubmitterTest {

    private static final LatestBlockhash BLOCKHASH_1 = new LatestBlockhash("EkSnNWid2cvwEVnVx9aBqawnmiCNiDgp3gUdkDPTKN1N", 100);
    private static final LatestBlockhash BLOCKHASH_2 = new LatestBlockhash("GHtXQBsoZHVnNFa9YevAzFr17DJjgHXk3ycTKD5xD3Zi", 200);
    private static final SignatureStatus CONFIRMED = new SignatureStatus(10, "confirmed", null);

    @Mock private SolanaLedgerClient ledger;

    private Keypair signer;
    private TransactionSubmitter submitter;
    private Instruction instruction;

    @BeforeEach
    void setUp() {
        byte[] seed = new byte[32];
        Arrays.fill(seed, (byte) 3);
        signer = Keypair.fromSeed(seed);
        byte[] program = new byte[32];
        Arrays.fill(program, (byte) 9);
        instruction = new Instruction(PublicKey.of(program),
                List.of(new AccountMeta(signer.getPublicKey(), true, true)), new byte[]{1, 2});
        submitter = new TransactionSubmitter(ledger, signer, Commitment.CONFIRMED, new SubmissionErrorClassifier(),
                new RetryPolicy(0L, 0, 3), new TransactionSubmitter.SubmissionSettings(false, 0L, 5_000L));
    }

    private static SolanaRpcErrorException preflight(String data) throws Exception {
        return new SolanaRpcErrorException("sendTransaction", -32002, "Transaction simulation failed",
                new ObjectMapper().readTree(data));
    }

    @Test
    void submit_confirmedOnFirstAttempt_returnsSignature() {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(BLOCKHASH_1);
        when(ledger.sendTransaction(anyString(), eq(false), eq(Commitment.CONFIRMED))).thenReturn("sig1");
        when(ledger.getSignatureStatus("sig1")).thenReturn(Optional.of(CONFIRMED));

        assertThat(submitter.submit(instruction)).isEqualTo("sig1");
        verify(ledger, times(1)).sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED));
    }

    @Test
    @DisplayName("stale blockhash is retried against a refreshed blockhash with a new signature")
    void submit_blockhashNotFound_retriesWithFreshBlockhash() throws Exception {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(BLOCKHASH_1, BLOCKHASH_2);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED)))
                .thenThrow(preflight("{\"err\":\"BlockhashNotFound\",\"logs\":[]}"))
                .thenReturn("sig2");
        when(ledger.getSignatureStatus("sig2")).thenReturn(Optional.of(CONFIRMED));

        assertThat(submitter.submit(instruction)).isEqualTo("sig2");

        ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
        verify(ledger, times(2)).sendTransaction(sent.capture(), anyBoolean(), eq(Commitment.CONFIRMED));
        assertThat(sent.getAllValues().get(0)).isNotEqualTo(sent.getAllValues().get(1));
    }

    @Test
    void submit_preflightRejection_failsImmediatelyWithLogs() throws Exception {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(BLOCKHASH_1);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED)))
                .thenThrow(preflight("{\"err\":{\"InstructionError\":[0,{\"Custom\":6000}]},\"logs\":[\"Program log: AnchorError\"]}"));

        assertThatThrownBy(() -> submitter.submit(instruction))
                .isInstanceOf(SimulationFailedException.class)
                .hasMessageContaining("Program log: AnchorError");
        verify(ledger, times(1)).sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED));
    }

    @Test
    void submit_transientErrors_exhaustRetryBudget() {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(BLOCKHASH_1);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED)))
                .thenThrow(new RpcException("connection reset"));

        assertThatThrownBy(() -> submitter.submit(instruction))
                .isInstanceOf(SubmissionFailedException.class)
                .hasMessage("Send transaction failed after 3 attempts")
                .hasCauseInstanceOf(RpcException.class);
        verify(ledger, times(3)).sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED));
    }

    @Test
    void submit_nonRetryableRpcError_isTerminal() {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(BLOCKHASH_1);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED)))
                .thenThrow(new SolanaRpcErrorException("sendTransaction", -32602, "invalid params", null));

        assertThatThrownBy(() -> submitter.submit(instruction)).isInstanceOf(SubmissionFailedException.class);
        verify(ledger, times(1)).sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED));
    }

    @Test
    @DisplayName("block height past lastValidBlockHeight without a status counts as an expired blockhash")
    void submit_blockhashExpiresWhileConfirming_resends() {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(BLOCKHASH_1, BLOCKHASH_2);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED))).thenReturn("sigA", "sigB");
        when(ledger.getSignatureStatus("sigA")).thenReturn(Optional.empty());
        when(ledger.getBlockHeight(Commitment.CONFIRMED)).thenReturn(101L);
        when(ledger.getSignatureStatus("sigB")).thenReturn(Optional.of(CONFIRMED));

        assertThat(submitter.submit(instruction)).isEqualTo("sigB");
    }

    @Test
    void submit_failedStatus_isTerminal() {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(BLOCKHASH_1);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED))).thenReturn("sigA");
        when(ledger.getSignatureStatus("sigA")).thenReturn(Optional.of(new SignatureStatus(10, "processed", "InstructionError")));

        assertThatThrownBy(() -> submitter.submit(instruction))
                .isInstanceOf(SubmissionFailedException.class)
                .hasCauseInstanceOf(TransactionFailedException.class);
    }

    @Test
    void submit_blockhashRefreshFailure_isIgnored() throws Exception {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED))
                .thenReturn(BLOCKHASH_1)
                .thenThrow(new RpcException("refresh failed"));
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED)))
                .thenThrow(preflight("{\"err\":\"BlockhashNotFound\",\"logs\":[]}"))
                .thenReturn("sig2");
        when(ledger.getSignatureStatus("sig2")).thenReturn(Optional.of(CONFIRMED));

        assertThat(submitter.submit(instruction)).isEqualTo("sig2");

        ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
        verify(ledger, times(2)).sendTransaction(sent.capture(), anyBoolean(), eq(Commitment.CONFIRMED));
        assertThat(sent.getAllValues().get(0)).isEqualTo(sent.getAllValues().get(1));
    }

    @Test
    @DisplayName("a confirmation timeout while the blockhash is still valid resends the same signed transaction")
    void submit_confirmationTimeoutBeforeExpiry_keepsSameTransaction() {
        TransactionSubmitter impatient = new TransactionSubmitter(ledger, signer, Commitment.CONFIRMED,
                new SubmissionErrorClassifier(), new RetryPolicy(0L, 0, 3),
                new TransactionSubmitter.SubmissionSettings(false, 0L, 0L));
        LatestBlockhash longLived = new LatestBlockhash(BLOCKHASH_1.blockhash(), 1_000);
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(longLived, BLOCKHASH_2);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED))).thenReturn("sigA");
        when(ledger.getSignatureStatus("sigA")).thenReturn(Optional.empty(), Optional.of(CONFIRMED));
        when(ledger.getBlockHeight(Commitment.CONFIRMED)).thenReturn(10L);

        assertThat(impatient.submit(instruction)).isEqualTo("sigA");

        ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
        verify(ledger, times(2)).sendTransaction(sent.capture(), anyBoolean(), eq(Commitment.CONFIRMED));
        assertThat(sent.getAllValues()).containsOnly(sent.getAllValues().get(0));
        verify(ledger, times(1)).getLatestBlockhash(Commitment.CONFIRMED);
    }

    @Test
    void submit_statusPollTransportError_keepsSameTransaction() {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(BLOCKHASH_1, BLOCKHASH_2);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED))).thenReturn("sigA");
        when(ledger.getSignatureStatus("sigA"))
                .thenThrow(new RpcException("connection reset"))
                .thenReturn(Optional.of(CONFIRMED));
        when(ledger.getBlockHeight(Commitment.CONFIRMED)).thenReturn(50L);

        assertThat(submitter.submit(instruction)).isEqualTo("sigA");
        verify(ledger, times(1)).getLatestBlockhash(Commitment.CONFIRMED);
    }

    @Test
    @DisplayName("once the first blockhash has expired the resend is signed against a fresh one")
    void submit_transportErrorAfterExpiry_resignsWithFreshBlockhash() {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(BLOCKHASH_1, BLOCKHASH_2);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED)))
                .thenThrow(new RpcException("connection reset"))
                .thenReturn("sigB");
        when(ledger.getBlockHeight(Commitment.CONFIRMED)).thenReturn(150L);
        when(ledger.getSignatureStatus("sigB")).thenReturn(Optional.of(CONFIRMED));

        assertThat(submitter.submit(instruction)).isEqualTo("sigB");

        ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
        verify(ledger, times(2)).sendTransaction(sent.capture(), anyBoolean(), eq(Commitment.CONFIRMED));
        assertThat(sent.getAllValues().get(0)).isNotEqualTo(sent.getAllValues().get(1));
    }

    @Test
    void submit_resendAlreadyProcessed_confirmsOriginalSignature() throws Exception {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED)).thenReturn(BLOCKHASH_1, BLOCKHASH_2);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED)))
                .thenThrow(new RpcException("connection reset"))
                .thenThrow(preflight("{\"err\":\"AlreadyProcessed\",\"logs\":[]}"));
        when(ledger.getBlockHeight(Commitment.CONFIRMED)).thenReturn(50L);
        when(ledger.getSignatureStatus(anyString())).thenReturn(Optional.of(CONFIRMED));

        String signature = submitter.submit(instruction);

        ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
        verify(ledger, times(2)).sendTransaction(sent.capture(), anyBoolean(), eq(Commitment.CONFIRMED));
        byte[] wire = Base64.getDecoder().decode(sent.getAllValues().get(0));
        assertThat(signature).isEqualTo(Base58.encode(Arrays.copyOfRange(wire, 1, 65)));
        assertThat(sent.getAllValues().get(1)).isEqualTo(sent.getAllValues().get(0));
    }

    @Test
    void submit_initialBlockhashFailure_isRetried() {
        when(ledger.getLatestBlockhash(Commitment.CONFIRMED))
                .thenThrow(new RpcException("unreachable"))
                .thenReturn(BLOCKHASH_1);
        when(ledger.sendTransaction(anyString(), anyBoolean(), eq(Commitment.CONFIRMED))).thenReturn("sig1");
        when(ledger.getSignatureStatus("sig1")).thenReturn(Optional.of(CONFIRMED));

        assertThat(submitter.submit(instruction)).isEqualTo("sig1");
        verify(ledger, never()).getBlockHeight(Commitment.CONFIRMED);
    }
}
