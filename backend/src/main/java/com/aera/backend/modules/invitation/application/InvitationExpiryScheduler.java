package com.aera.backend.modules.invitation.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class InvitationExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(InvitationExpiryScheduler.class);

    private final InvitationService invitationService;

    public InvitationExpiryScheduler(InvitationService invitationService) {
        this.invitationService = invitationService;
    }

    @Scheduled(fixedDelayString = "${app.invitation.expiry-sweep-interval:PT10M}")
    public void expireOverdueInvitations() {
        int expired = invitationService.expireOverdueInvitations();
        if (expired > 0) {
            log.info("Expired {} overdue invitations", expired);
        }
    }
}
