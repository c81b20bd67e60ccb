package com.openforge.mnemosyne.session;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Location of the SQLite file holding message counters and summary times.
 *
 * application.yml:
 *
 * mnemosyne:
 *   counter:
 *     db-path: mnemosyne_data/message_counters.db
 */
@ConfigurationProperties(prefix = "mnemosyne.counter")
public record CounterStoreProperties(
        @DefaultValue("mnemosyne_data/message_counters.db") String dbPath
) {}
