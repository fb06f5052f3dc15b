package com.docvault.config;

import com.docvault.access.AccessControlService;
import com.docvault.store.EncryptedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Unlocks the store with the configured password and seeds the built-in roles at startup. */
@Component
public class StoreBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StoreBootstrap.class);

    private final EncryptedStore store;
    private final StoreProperties properties;
    private final AccessControlService accessControl;

    public StoreBootstrap(EncryptedStore store, StoreProperties properties, AccessControlService accessControl) {
        this.store = store;
        this.properties = properties;
        this.accessControl = accessControl;
    }

    @Override
    public void run(ApplicationArguments args) {
        String password = properties.password() != null && !properties.password().isBlank()
                ? properties.password() : null;
        Long seeded = store.initialize(password)
                .thenMany(accessControl.seedDefaultRoles())
                .count()
                .block();
        log.info("Store {} ready ({} default roles seeded)", store.namespace(), seeded);
    }
}
