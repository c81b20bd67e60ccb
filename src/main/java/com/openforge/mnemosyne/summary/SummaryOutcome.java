package com.openforge.mnemosyne.summary;

/** How one summarization run ended. Only {@link #STORED} wrote anything. */
public enum SummaryOutcome {
    STORED,
    SKIPPED_PRECONDITION,
    LLM_FAILED,
    EMPTY_SUMMARY,
    EMBEDDING_FAILED,
    STORE_FAILED,
    REJECTED;

    public boolean isStored() {
        return this == STORED;
    }
}
