package com.openforge.mnemosyne.host;

import java.util.Optional;

/**
 * Session and persona lookup supplied by the host's conversation manager.
 */
public interface HostSessionResolver {

    /** Persona id the host reports when no persona is selected. */
    String NO_PERSONA_SENTINEL = "[%None]";

    Optional<String> currentSessionId(RequestOrigin origin);

    Optional<String> personaId(RequestOrigin origin);

    Optional<String> defaultPersona();
}
