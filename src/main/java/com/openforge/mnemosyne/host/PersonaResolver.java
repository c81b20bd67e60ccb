package com.openforge.mnemosyne.host;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Persona lookup: the session's own persona first, then the host default.
 * Blank ids and the "no persona" sentinel count as absent.
 */
@Slf4j
@Component
public class PersonaResolver {

    private final HostSessionResolver hostResolver;

    public PersonaResolver(HostSessionResolver hostResolver) {
        this.hostResolver = hostResolver;
    }

    public Optional<String> resolve(@Nullable RequestOrigin origin) {
        try {
            if (origin != null) {
                Optional<String> session = hostResolver.personaId(origin).filter(PersonaResolver::isSelected);
                if (session.isPresent()) return session;
            }
            return hostResolver.defaultPersona().filter(PersonaResolver::isSelected);
        } catch (RuntimeException e) {
            log.warn("[Persona] Host persona lookup failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> sessionId(@Nullable RequestOrigin origin) {
        if (origin == null) return Optional.empty();
        try {
            return hostResolver.currentSessionId(origin).filter(id -> !id.isBlank());
        } catch (RuntimeException e) {
            log.warn("[Persona] Host session lookup failed for {}: {}", origin.originId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isSelected(String personaId) {
        return personaId != null
                && !personaId.isBlank()
                && !HostSessionResolver.NO_PERSONA_SENTINEL.equals(personaId);
    }
}
