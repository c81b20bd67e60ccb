package com.openforge.mnemosyne.session;

/**
 * One message in a session's in-memory history.
 *
 * @param timestamp ISO-8601 local date-time at which the turn was recorded
 */
public record ChatTurn(
        TurnRole role,
        String content,
        String timestamp
) {}
