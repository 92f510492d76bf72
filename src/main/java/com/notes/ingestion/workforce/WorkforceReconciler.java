package com.notes.ingestion.workforce;

import com.notes.ingestion.core.model.Employee;
import com.notes.ingestion.core.model.EmployeeDistribution;
import com.notes.ingestion.core.model.EntityKind;
import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.OfficeSize;
import com.notes.ingestion.core.model.SizeCategory;
import com.notes.ingestion.core.model.Workforce;
import com.notes.ingestion.metrics.MetricsService;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the per-office employee roster and the office headcount in step.
 *
 * <p>The roster lives in one {@link Workforce} record per office, id {@code WF-{officeId}}, created on
 * the first employee mention. Employees are keyed by their lower-cased trimmed name. After every roster
 * write the office's {@code size.employeeCount} is set to the distinct-name count, and
 * {@code size.sizeCategory} is derived from it when the office has none.</p>
 */
public class WorkforceReconciler {
    private static final Logger log = LoggerFactory.getLogger(WorkforceReconciler.class);

    private final EntityRepository repository;
    private final MetricsService metrics;
    private final int maxRetries;

    public WorkforceReconciler(EntityRepository repository, MetricsService metrics, int maxRetries) {
        this.repository = repository;
        this.metrics = metrics;
        this.maxRetries = maxRetries;
    }

    /**
     * Outcome of one reconciliation: the stored roster and the delta to report.
     */
    public record Reconciled(Workforce workforce, WorkforceUpdate update) {
    }

    /**
     * Adds the employees to the office's roster. Returns empty when there is nothing to add or the roster
     * could not be written.
     */
    public Optional<Reconciled> reconcile(Office office, List<Employee> employees,
                                          EmployeeDistribution distribution) {
        if (office == null || office.id() == null || employees == null || employees.isEmpty()) {
            return Optional.empty();
        }
        String workforceId = Workforce.idFor(office.id());
        StoreResult<Workforce> lookup = repository.findById(EntityKind.WORKFORCE, workforceId, Workforce.class);
        if (!lookup.success()) {
            log.warn("Could not read workforce {}: {}", workforceId, lookup.error());
            return Optional.empty();
        }

        RosterMerge merge = new RosterMerge(employees, distribution);
        StoreResult<Workforce> write = lookup.data() != null
                ? repository.modify(lookup.data(), merge::applyTo, Workforce.class, maxRetries)
                : createRoster(office, merge);
        if (!write.success() || write.data() == null) {
            log.warn("Could not write workforce for office {}: {}", office.id(), write.error());
            metrics.incrementLocalFallback(EntityKind.WORKFORCE);
            return Optional.empty();
        }

        Workforce roster = write.data();
        int total = roster.distinctEmployeeCount();
        refreshOfficeSize(office.id(), total);
        WorkforceUpdate update = new WorkforceUpdate(office.id(), office.name(), merge.added(), merge.updated(), total);
        log.info("Workforce for '{}': {} added, {} updated, {} total", office.name(),
                update.employeesAdded(), update.employeesUpdated(), total);
        return Optional.of(new Reconciled(roster, update));
    }

    /**
     * Distinct-name headcount of the office's roster, 0 when it has none or the store cannot be read.
     */
    public int countEmployees(String officeId) {
        StoreResult<Workforce> lookup = repository.findById(EntityKind.WORKFORCE, Workforce.idFor(officeId),
                Workforce.class);
        return lookup.success() && lookup.data() != null ? lookup.data().distinctEmployeeCount() : 0;
    }

    private StoreResult<Workforce> createRoster(Office office, RosterMerge merge) {
        Workforce roster = merge.applyTo(Workforce.emptyFor(office.id(), office.name()));
        StoreResult<Workforce> created = repository.create(roster, Workforce.class);
        if (created.success() || !created.conflict()) {
            if (created.success()) {
                metrics.incrementEntityCreated(EntityKind.WORKFORCE);
            }
            return created;
        }
        // created concurrently by another note
        StoreResult<Workforce> reread = repository.findById(EntityKind.WORKFORCE, roster.id(), Workforce.class);
        if (!reread.success() || reread.data() == null) {
            return StoreResult.failure("Could not re-read " + roster.id() + " after conflict");
        }
        return repository.modify(reread.data(), merge::applyTo, Workforce.class, maxRetries);
    }

    private void refreshOfficeSize(String officeId, int headcount) {
        StoreResult<Office> lookup = repository.findById(EntityKind.OFFICE, officeId, Office.class);
        if (!lookup.success() || lookup.data() == null) {
            log.warn("Could not refresh employee count of office {}: {}", officeId,
                    lookup.success() ? "not found" : lookup.error());
            return;
        }
        StoreResult<Office> write = repository.modify(lookup.data(),
                office -> office.toBuilder().size(sizedFor(office.size(), headcount)).build(),
                Office.class, maxRetries);
        if (!write.success()) {
            log.warn("Could not refresh employee count of office {}: {}", officeId, write.error());
        }
    }

    static OfficeSize sizedFor(OfficeSize current, int headcount) {
        OfficeSize size = (current != null ? current : new OfficeSize(null, null, null)).withEmployeeCount(headcount);
        if (size.sizeCategory() == null && headcount > 0) {
            size = size.withSizeCategory(SizeCategory.forHeadcount(headcount));
        }
        return size;
    }
}
