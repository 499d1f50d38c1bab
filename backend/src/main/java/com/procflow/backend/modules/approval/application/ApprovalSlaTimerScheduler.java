package com.procflow.backend.modules.approval.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ApprovalSlaTimerScheduler {

    private static final Logger log = LoggerFactory.getLogger(ApprovalSlaTimerScheduler.class);

    private final ApprovalSlaTimerService slaTimerService;

    public ApprovalSlaTimerScheduler(ApprovalSlaTimerService slaTimerService) {
        this.slaTimerService = slaTimerService;
    }

    @Scheduled(fixedDelayString = "${procflow.approval.sla.poll-interval:PT1M}")
    public void fireDueTimers() {
        int fired = slaTimerService.fireDueTimers();
        if (fired > 0) {
            log.info("Fired {} approval SLA timers", fired);
        }
    }
}
