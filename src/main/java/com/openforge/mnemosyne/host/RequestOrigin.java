package com.openforge.mnemosyne.host;

/**
 * Handle to the host request that produced a conversation turn.
 *
 * The memory layer never looks inside it; it only hands it back to the
 * {@link HostSessionResolver} to find the session and persona later, e.g.
 * from the background summary sweep.
 */
public interface RequestOrigin {

    /** The host's unified origin id (platform + channel + sender). */
    String originId();

    static RequestOrigin of(String originId) {
        return new Simple(originId);
    }

    record Simple(String originId) implements RequestOrigin {}
}
