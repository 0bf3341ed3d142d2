package com.vrforacle.ingestion.adapter.solana;

import java.net.URI;
import java.util.Locale;

/**
 * HTTP and websocket endpoints of a ledger cluster, from a well-known name or an explicit URL.
 * For an explicit URL the websocket endpoint uses the ws scheme and, when a port is given, the next port.
 */
public record Cluster(String name, String url, String wsUrl) {

    public static Cluster parse(String value) {
        String v = value == null ? "" : value.trim();
        return switch (v.toLowerCase(Locale.ROOT)) {
            case "m", "mainnet", "mainnet-beta" -> new Cluster("mainnet-beta",
                    "https://api.mainnet-beta.solana.com", "wss://api.mainnet-beta.solana.com");
            case "t", "testnet" -> new Cluster("testnet",
                    "https://api.testnet.solana.com", "wss://api.testnet.solana.com");
            case "d", "devnet" -> new Cluster("devnet",
                    "https://api.devnet.solana.com", "wss://api.devnet.solana.com");
            case "l", "localnet" -> new Cluster("localnet", "http://127.0.0.1:8899", "ws://127.0.0.1:8900");
            default -> custom(v);
        };
    }

    private static Cluster custom(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown cluster: " + url, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("unknown cluster: " + url);
        }
        String wsScheme = "https".equals(scheme) ? "wss" : "ws";
        String port = uri.getPort() > 0 ? ":" + (uri.getPort() + 1) : "";
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        return new Cluster("custom", url, wsScheme + "://" + uri.getHost() + port + path);
    }

    public Cluster withWsUrl(String wsUrl) {
        return new Cluster(name, url, wsUrl);
    }
}
