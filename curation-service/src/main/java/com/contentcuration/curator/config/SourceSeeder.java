package com.contentcuration.curator.config;

import com.contentcuration.curator.entity.Source;
import com.contentcuration.curator.entity.SourceType;
import com.contentcuration.curator.exception.CuratorConfigurationException;
import com.contentcuration.curator.repository.SourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts configured sources that are not stored yet. Existing sources (matched by name or URL)
 * are left alone, so operator changes to stored rows survive restarts.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
@Slf4j
public class SourceSeeder implements ApplicationRunner {

    private final SourceRepository sourceRepository;
    private final SourceSeedConfig sourceSeedConfig;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!sourceSeedConfig.isEnabled() || sourceSeedConfig.getSources().isEmpty()) {
            log.debug("Source seeding skipped (enabled={}, configured={})",
                    sourceSeedConfig.isEnabled(), sourceSeedConfig.getSources().size());
            return;
        }

        int created = 0;
        int skipped = 0;
        for (SourceSeedConfig.SourceEntry entry : sourceSeedConfig.getSources()) {
            Source desired = toSource(entry);
            boolean exists = sourceRepository.findByName(desired.getName())
                    .or(() -> sourceRepository.findByUrl(desired.getUrl()))
                    .isPresent();

            if (exists) {
                skipped++;
                continue;
            }
            sourceRepository.save(desired);
            created++;
        }

        log.info("Seeded sources. created={}, skipped={}, totalDesired={}",
                created, skipped, sourceSeedConfig.getSources().size());
    }

    private Source toSource(SourceSeedConfig.SourceEntry entry) {
        if (entry.getName() == null || entry.getName().isBlank()
                || entry.getUrl() == null || entry.getUrl().isBlank()) {
            throw new CuratorConfigurationException("Seed source entries need a name and a url: " + entry);
        }
        SourceType type;
        try {
            type = SourceType.fromValue(entry.getType());
        } catch (IllegalArgumentException e) {
            throw new CuratorConfigurationException("Seed source '" + entry.getName() + "': " + e.getMessage());
        }
        return Source.builder()
                .name(entry.getName().trim())
                .url(entry.getUrl().trim())
                .type(type)
                .enabled(entry.isEnabled())
                .build();
    }
}
