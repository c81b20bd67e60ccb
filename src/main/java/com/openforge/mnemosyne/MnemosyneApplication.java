package com.openforge.mnemosyne;

import com.openforge.mnemosyne.embedding.EmbeddingProperties;
import com.openforge.mnemosyne.llm.LlmProperties;
import com.openforge.mnemosyne.retrieval.RetrievalProperties;
import com.openforge.mnemosyne.session.CounterStoreProperties;
import com.openforge.mnemosyne.summary.SummaryProperties;
import com.openforge.mnemosyne.vector.VectorStoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// Register every ConfigurationProperties record globally; several beans
// across packages read the same record.
@SpringBootApplication
@EnableConfigurationProperties({
        VectorStoreProperties.class,
        EmbeddingProperties.class,
        LlmProperties.class,
        RetrievalProperties.class,
        SummaryProperties.class,
        CounterStoreProperties.class
})
public class MnemosyneApplication {

    public static void main(String[] args) {
        SpringApplication.run(MnemosyneApplication.class, args);
    }
}
