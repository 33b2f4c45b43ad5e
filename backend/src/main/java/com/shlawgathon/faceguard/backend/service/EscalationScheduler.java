package com.shlawgathon.faceguard.backend.service;

import com.shlawgathon.faceguard.backend.model.AlertInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic deadline tick for the alert engine.
 */
@Component
public class EscalationScheduler {

    private static final Logger log = LoggerFactory.getLogger(EscalationScheduler.class);

    private final AlertDecisionEngine engine;

    public EscalationScheduler(AlertDecisionEngine engine) {
        this.engine = engine;
    }

    @Scheduled(fixedDelayString = "${faceguard.alerts.escalation-check-interval:PT30S}")
    public void tick() {
        List<AlertInstance> escalated = engine.escalateDue();
        int resolved = engine.autoResolveDue();
        engine.pruneIdleState();
        if (!escalated.isEmpty() || resolved > 0) {
            log.info("[ALERT] Escalation tick: {} escalated, {} auto-resolved", escalated.size(), resolved);
        }
    }
}
