package com.studentregistry.backend.config;

import com.studentregistry.backend.repo.StudentStore;
import com.studentregistry.backend.validation.StudentPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Fills the store with the configured seed records. A seed that breaks a field
 * rule fails startup.
 */
@Component
public class StudentSeedLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StudentSeedLoader.class);

    private final StudentStore store;
    private final StudentApiProperties props;

    public StudentSeedLoader(StudentStore store, StudentApiProperties props) {
        this.store = store;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Starting {} v{}", props.title(), props.version());
        for (StudentApiProperties.Seed seed : props.seed()) {
            store.create(new StudentPayload(seed.name(), seed.age(), seed.classYear()));
        }
        log.info("Seeded {} students", props.seed().size());
    }
}
