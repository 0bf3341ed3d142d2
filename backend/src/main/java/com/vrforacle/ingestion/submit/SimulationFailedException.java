package com.vrforacle.ingestion.submit;

import lombok.Getter;

import java.util.List;

/**
 * Preflight simulation rejected the transaction. Deterministic, so never retried; the simulated
 * log lines are kept for diagnosis.
 */
@Getter
public class SimulationFailedException extends RuntimeException {

    private final List<String> logs;

    public SimulationFailedException(List<String> logs, Throwable cause) {
        super(describe(logs), cause);
        this.logs = List.copyOf(logs);
    }

    private static String describe(List<String> logs) {
        StringBuilder sb = new StringBuilder("Simulation error logs:\n");
        for (String line : logs) {
            sb.append('\t').append(line).append('\n');
        }
        return sb.toString();
    }
}
