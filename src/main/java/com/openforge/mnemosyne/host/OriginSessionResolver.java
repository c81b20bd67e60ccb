package com.openforge.mnemosyne.host;

import java.util.Optional;

/**
 * Fallback resolver for hosts without a conversation manager: the origin id
 * doubles as the session id and no persona is ever selected.
 */
public class OriginSessionResolver implements HostSessionResolver {

    @Override
    public Optional<String> currentSessionId(RequestOrigin origin) {
        if (origin == null || origin.originId() == null || origin.originId().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(origin.originId());
    }

    @Override
    public Optional<String> personaId(RequestOrigin origin) {
        return Optional.empty();
    }

    @Override
    public Optional<String> defaultPersona() {
        return Optional.empty();
    }
}
