package com.openforge.mnemosyne.config;

import com.openforge.mnemosyne.retrieval.RetrievalProperties;
import com.openforge.mnemosyne.summary.SummaryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cross-checks summary and retrieval settings against each other and the
 * host's context window. Runs at bean construction, so a bad value stops
 * the application from starting.
 */
@Slf4j
@Component
public class MemorySettingsValidator {

    public MemorySettingsValidator(SummaryProperties summary, RetrievalProperties retrieval) {
        validate(summary, retrieval);
        log.debug("[Bootstrap] Memory settings validated.");
    }

    static void validate(SummaryProperties summary, RetrievalProperties retrieval) {
        int hostMax = summary.hostMaxContextLength();
        if (hostMax == 0) {
            throw new IllegalArgumentException(
                    "mnemosyne.summary.host-max-context-length must not be 0 (use -1 for unlimited)");
        }
        if (summary.numPairs() <= 0) {
            throw new IllegalArgumentException(
                    "mnemosyne.summary.num-pairs must be positive, got " + summary.numPairs());
        }
        if (hostMax > 0 && summary.numPairs() > 2 * hostMax) {
            throw new IllegalArgumentException(
                    "mnemosyne.summary.num-pairs (%d) exceeds twice the host context length (%d)"
                            .formatted(summary.numPairs(), hostMax));
        }
        if (hostMax > 0 && retrieval.contextsMemoryLen() > hostMax) {
            throw new IllegalArgumentException(
                    "mnemosyne.retrieval.contexts-memory-len (%d) exceeds the host context length (%d)"
                            .formatted(retrieval.contextsMemoryLen(), hostMax));
        }
        if (summary.checkIntervalSeconds() <= 0) {
            throw new IllegalArgumentException(
                    "mnemosyne.summary.check-interval-seconds must be positive, got " + summary.checkIntervalSeconds());
        }
        if (retrieval.topK() <= 0) {
            throw new IllegalArgumentException("mnemosyne.retrieval.top-k must be positive, got " + retrieval.topK());
        }
        if (retrieval.searchTimeoutSeconds() <= 0) {
            throw new IllegalArgumentException(
                    "mnemosyne.retrieval.search-timeout-seconds must be positive, got " + retrieval.searchTimeoutSeconds());
        }
    }
}
