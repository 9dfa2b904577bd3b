package com.aera.backend.modules.readiness.application;

import com.aera.backend.modules.household.application.HouseholdMembershipChangedEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Runs after the membership transaction commits. A failed recalculation is logged and left
 * for the next membership change; the committed change stands.
 */
@Component
public class ReadinessRecalculationListener {

    private static final Logger log = LoggerFactory.getLogger(ReadinessRecalculationListener.class);

    private final ReadinessRecalculationService recalculationService;

    public ReadinessRecalculationListener(ReadinessRecalculationService recalculationService) {
        this.recalculationService = recalculationService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onMembershipChanged(HouseholdMembershipChangedEvent event) {
        try {
            recalculationService.recalculate(event.householdId());
        } catch (RuntimeException ex) {
            log.warn("Readiness recalculation failed for household {} after {}", event.householdId(), event.reason(), ex);
        }
    }
}
