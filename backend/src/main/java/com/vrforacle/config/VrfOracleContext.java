package com.vrforacle.config;

import com.vrforacle.domain.PublicKey;
import com.vrforacle.ingestion.adapter.solana.Cluster;
import com.vrforacle.ingestion.adapter.solana.Commitment;
import com.vrforacle.ingestion.config.OracleProperties;
import com.vrforacle.ingestion.tx.Keypair;

import java.util.List;

/**
 * Immutable process-wide settings, validated once at startup and passed to the components that need them.
 */
public record VrfOracleContext(Keypair signer, Cluster cluster, Commitment commitment, List<PublicKey> programIds) {

    public VrfOracleContext {
        programIds = List.copyOf(programIds);
    }

    /**
     * @throws IllegalArgumentException on invalid key material, cluster, commitment or program id
     */
    public static VrfOracleContext from(OracleProperties properties) {
        Keypair signer = Keypair.fromSecretKey(toBytes("signer-private-key", properties.getSignerPrivateKey()));
        Cluster cluster = Cluster.parse(properties.getCluster());
        if (properties.getWsUrl() != null && !properties.getWsUrl().isBlank()) {
            cluster = cluster.withWsUrl(properties.getWsUrl().trim());
        }
        List<PublicKey> programIds = properties.getProgramIds().stream()
                .map(PublicKey::fromBase58)
                .distinct()
                .toList();
        return new VrfOracleContext(signer, cluster, Commitment.parse(properties.getCommitment()), programIds);
    }

    public static byte[] toBytes(String name, List<Integer> values) {
        byte[] out = new byte[values.size()];
        for (int i = 0; i < out.length; i++) {
            Integer v = values.get(i);
            if (v == null || v < 0 || v > 255) {
                throw new IllegalArgumentException(name + "[" + i + "] is not a byte value: " + v);
            }
            out[i] = (byte) v.intValue();
        }
        return out;
    }
}
