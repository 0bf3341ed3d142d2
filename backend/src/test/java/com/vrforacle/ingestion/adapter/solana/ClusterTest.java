package com.vrforacle.ingestion.adapter.solana;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterTest {

    @Test
    void parse_wellKnownNamesAndMonikers() {
        assertThat(Cluster.parse("mainnet-beta").url()).isEqualTo("https://api.mainnet-beta.solana.com");
        assertThat(Cluster.parse("m").wsUrl()).isEqualTo("wss://api.mainnet-beta.solana.com");
        assertThat(Cluster.parse("Devnet").name()).isEqualTo("devnet");
        assertThat(Cluster.parse("l")).isEqualTo(new Cluster("localnet", "http://127.0.0.1:8899", "ws://127.0.0.1:8900"));
    }

    @Test
    void parse_customUrl_derivesWebsocketOnNextPort() {
        Cluster cluster = Cluster.parse("http://10.0.0.5:8899");
        assertThat(cluster.url()).isEqualTo("http://10.0.0.5:8899");
        assertThat(cluster.wsUrl()).isEqualTo("ws://10.0.0.5:8900");

        assertThat(Cluster.parse("https://rpc.example.com/key").wsUrl()).isEqualTo("wss://rpc.example.com/key");
    }

    @Test
    void withWsUrl_overridesOnlyWebsocket() {
        Cluster cluster = Cluster.parse("devnet").withWsUrl("wss://ws.example.com");
        assertThat(cluster.url()).isEqualTo("https://api.devnet.solana.com");
        assertThat(cluster.wsUrl()).isEqualTo("wss://ws.example.com");
    }

    @Test
    void parse_unknown_throws() {
        assertThatThrownBy(() -> Cluster.parse("moonnet")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void commitment_satisfiedByEqualOrStronger() {
        assertThat(Commitment.CONFIRMED.isSatisfiedBy("finalized")).isTrue();
        assertThat(Commitment.CONFIRMED.isSatisfiedBy("confirmed")).isTrue();
        assertThat(Commitment.CONFIRMED.isSatisfiedBy("processed")).isFalse();
        assertThat(Commitment.FINALIZED.isSatisfiedBy(null)).isFalse();
        assertThat(Commitment.parse(" Finalized ")).isEqualTo(Commitment.FINALIZED);
        assertThatThrownBy(() -> Commitment.parse("max")).isInstanceOf(IllegalArgumentException.class);
    }
}
