package com.docvault.config;

import com.docvault.crypto.CryptoService;
import com.docvault.store.CassandraStoreBackend;
import com.docvault.store.EncryptedEntryRepository;
import com.docvault.store.EncryptedStore;
import com.docvault.store.InMemoryStoreBackend;
import com.docvault.store.MasterKeyRepository;
import com.docvault.store.StoreBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class DocVaultConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CryptoService cryptoService(
            @Value("${docvault.crypto.password-iterations:" + CryptoService.DEFAULT_ITERATIONS + "}") int iterations,
            Clock clock) {
        return new CryptoService(iterations, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "docvault.store.backend", havingValue = "cassandra", matchIfMissing = true)
    public StoreBackend cassandraStoreBackend(EncryptedEntryRepository entryRepository,
                                              MasterKeyRepository masterKeyRepository) {
        return new CassandraStoreBackend(entryRepository, masterKeyRepository);
    }

    @Bean
    @ConditionalOnProperty(name = "docvault.store.backend", havingValue = "memory")
    public StoreBackend inMemoryStoreBackend() {
        return new InMemoryStoreBackend();
    }

    @Bean
    public EncryptedStore encryptedStore(StoreProperties properties,
                                         StoreBackend backend,
                                         CryptoService crypto,
                                         ObjectMapper objectMapper,
                                         Clock clock) {
        return new EncryptedStore(properties.namespace(), backend, crypto, objectMapper, clock,
                properties.backupSigningKey());
    }
}
