package com.notes.ingestion.identity;

import com.notes.ingestion.core.model.EntityKind;
import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.Place;
import com.notes.ingestion.core.model.Values;
import com.notes.ingestion.store.EntityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Random;
import java.util.function.IntFunction;

/**
 * Builds human-readable identifiers for new records.
 *
 * <p>Office ids are {@code country(2) + city(2) + digits}, e.g. {@code UKLD123}. Generated ids are
 * checked against the store; after {@code collisionRetries} clashes the numeric suffix grows by one
 * digit per further attempt.</p>
 */
public class IdentifierSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(IdentifierSynthesizer.class);

    static final int OFFICE_SUFFIX_DIGITS = 3;
    private static final int MAX_EXTRA_DIGITS = 6;

    private final EntityRepository repository;
    private final Random random;
    private final Clock clock;
    private final int collisionRetries;

    public IdentifierSynthesizer(EntityRepository repository, int collisionRetries) {
        this(repository, new Random(), Clock.systemUTC(), collisionRetries);
    }

    public IdentifierSynthesizer(EntityRepository repository, Random random, Clock clock, int collisionRetries) {
        if (collisionRetries < 1) {
            throw new IllegalArgumentException("collisionRetries must be >= 1");
        }
        this.repository = repository;
        this.random = random;
        this.clock = clock;
        this.collisionRetries = collisionRetries;
    }

    public int getCollisionRetries() {
        return collisionRetries;
    }

    /**
     * An oracle-supplied id is kept unless it is blank or carries a placeholder marker.
     */
    public static boolean isUsableId(String id) {
        return Values.hasText(id) && !id.contains("XX") && !id.contains("NO_LOCATION_DATA");
    }

    /**
     * Id for an office about to be created. Keeps a usable supplied id that is still free,
     * otherwise derives one from the headquarters.
     */
    public String officeId(Office candidate) {
        String collection = EntityKind.OFFICE.collection();
        if (isUsableId(candidate.id()) && !repository.exists(collection, candidate.id())) {
            return candidate.id();
        }
        Place hq = candidate.headquarters();
        if (hq == null || !hq.hasCityAndCountry()) {
            return unique(collection, digits -> fallbackOfficeId(candidate.name(), digits));
        }
        String prefix = LocationCodes.countryCode(hq.country()) + LocationCodes.cityCode(hq.city());
        return unique(collection, digits -> prefix + randomDigits(digits));
    }

    /**
     * Last-resort office id, {@code name(2) + "XX" + digits}. Only used for local fallback records.
     */
    public String fallbackOfficeId(String name) {
        return fallbackOfficeId(name, OFFICE_SUFFIX_DIGITS);
    }

    public String localProjectId() {
        return "project-" + clock.millis() + "-" + randomDigits(4);
    }

    public String localRegulationId() {
        return "regulation-" + clock.millis() + "-" + randomDigits(4);
    }

    /**
     * Draws ids from {@code generator} until one is free in {@code collection}. The generator receives the
     * number of random digits to use.
     */
    public String unique(String collection, IntFunction<String> generator) {
        String id = null;
        int maxAttempts = collisionRetries + MAX_EXTRA_DIGITS;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            int extra = Math.max(0, attempt - collisionRetries + 1);
            id = generator.apply(OFFICE_SUFFIX_DIGITS + extra);
            if (!repository.exists(collection, id)) {
                return id;
            }
            log.debug("Identifier {} already taken in {} (attempt {})", id, collection, attempt + 1);
        }
        log.warn("Could not find a free identifier in {} after {} attempts, using {}", collection, maxAttempts, id);
        return id;
    }

    public String randomDigits(int count) {
        StringBuilder digits = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            digits.append(random.nextInt(10));
        }
        return digits.toString();
    }

    public long currentMillis() {
        return clock.millis();
    }

    private String fallbackOfficeId(String name, int digits) {
        return LocationCodes.letters(name, 2) + "XX" + randomDigits(digits);
    }
}
