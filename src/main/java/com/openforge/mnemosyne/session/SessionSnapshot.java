package com.openforge.mnemosyne.session;

import com.openforge.mnemosyne.host.RequestOrigin;
import org.springframework.lang.Nullable;

import java.util.List;

/** Point-in-time copy of a session's state. */
public record SessionSnapshot(
        String sessionId,
        List<ChatTurn> history,
        double lastSummaryTime,
        @Nullable RequestOrigin origin
) {}
