package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.transformer.EnrollmentCleaner;
import edustats.oecd.pipeline.transformer.GraduationCleaner;
import edustats.oecd.pipeline.transformer.RecordCleaner;
import edustats.oecd.pipeline.transformer.SpendingCleaner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Creates and caches one {@link RecordCleaner} per dataset kind.
 *
 * Cleaners are stateless between calls, so a single instance per kind is
 * shared by every run.
 */
@Service
@Slf4j
public class RecordCleanerFactory {

    private final EnrollmentCleaner enrollmentCleaner;
    private final GraduationCleaner graduationCleaner;
    private final SpendingCleaner spendingCleaner;

    public RecordCleanerFactory(PipelineConfig config, CountryResolver countryResolver, Clock clock) {
        this.enrollmentCleaner = new EnrollmentCleaner(config, countryResolver, clock);
        this.graduationCleaner = new GraduationCleaner(config, countryResolver, clock);
        this.spendingCleaner = new SpendingCleaner(config, countryResolver, clock);
        log.debug("Registered record cleaners for {}, {} and {}",
                enrollmentCleaner.getKind(), graduationCleaner.getKind(), spendingCleaner.getKind());
    }

    public EnrollmentCleaner enrollment() {
        return enrollmentCleaner;
    }

    public GraduationCleaner graduation() {
        return graduationCleaner;
    }

    public SpendingCleaner spending() {
        return spendingCleaner;
    }
}
