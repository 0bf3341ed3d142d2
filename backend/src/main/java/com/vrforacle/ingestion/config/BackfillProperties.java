package com.vrforacle.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * One-time startup replay of historical transactions.
 */
@ConfigurationProperties(prefix = "vrf-oracle.backfill")
@NoArgsConstructor
@Getter
@Setter
public class BackfillProperties {

    private boolean enabled = true;

    /** Signatures per getSignaturesForAddress page (1-1000). */
    private int pageSize = 1000;

    /** Max signatures examined per program; bounded further by the node's retention. */
    private int maxSignatures = 1000;

    /** Listing and replay commitment; the RPC accepts confirmed or finalized here. */
    private String commitment = "finalized";
}
