package com.vrforacle.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Oracle identity and cluster. Loaded once at startup and turned into an immutable VrfOracleContext.
 */
@ConfigurationProperties(prefix = "vrf-oracle")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class OracleProperties {

    /** 64-byte ed25519 keypair (solana-keygen byte array) paying for and signing callbacks. */
    @NotEmpty
    private List<Integer> signerPrivateKey = new ArrayList<>();

    /** VRF secret scalar (secp256k1, big-endian bytes). */
    @NotEmpty
    private List<Integer> vrfPrivateKey = new ArrayList<>();

    /** mainnet-beta, testnet, devnet, localnet or an http(s) URL. */
    @NotBlank
    private String cluster = "devnet";

    /** Optional websocket endpoint; derived from cluster when blank. */
    private String wsUrl;

    /** processed, confirmed or finalized. */
    @NotBlank
    private String commitment = "confirmed";

    /** Tracked program ids (base58). */
    @NotEmpty
    private List<String> programIds = new ArrayList<>();
}
