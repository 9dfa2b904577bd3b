package com.aera.backend.modules.invitation.presentation;

import java.net.URI;
import java.util.UUID;

import com.aera.backend.global.security.JwtAuthenticationPrincipal;
import com.aera.backend.global.security.SecurityUtils;
import com.aera.backend.modules.household.presentation.dto.MembershipResponse;
import com.aera.backend.modules.invitation.application.InvitationService;
import com.aera.backend.modules.invitation.presentation.dto.CreateInvitationRequest;
import com.aera.backend.modules.invitation.presentation.dto.InvitationResponse;
import com.aera.backend.modules.invitation.presentation.dto.RedeemInvitationRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class InvitationController {

    private final InvitationService invitationService;

    public InvitationController(InvitationService invitationService) {
        this.invitationService = invitationService;
    }

    @PostMapping("/households/{householdId}/invitations")
    public ResponseEntity<InvitationResponse> createInvitation(
            @PathVariable("householdId") UUID householdId,
            @Valid @RequestBody(required = false) CreateInvitationRequest request
    ) {
        UUID userId = SecurityUtils.getCurrentUserId();
        CreateInvitationRequest body = request != null ? request : new CreateInvitationRequest(null, null, null);
        InvitationResponse response = invitationService.createInvitation(
                householdId,
                userId,
                body.inviteeRef(),
                body.inviteeName(),
                body.ttl()
        );
        return ResponseEntity.created(URI.create("/households/" + householdId + "/invitations/" + response.id()))
                .body(response);
    }

    @DeleteMapping("/households/{householdId}/invitations/{invitationId}")
    public ResponseEntity<InvitationResponse> revokeInvitation(
            @PathVariable("householdId") UUID householdId,
            @PathVariable("invitationId") UUID invitationId
    ) {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(invitationService.revokeInvitation(householdId, invitationId, userId));
    }

    @Operation(summary = "Redeem invitation code", description = "Joins the household behind a shared code.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Joined as MEMBER"),
            @ApiResponse(responseCode = "403", description = "Code is bound to another phone (`INVITEE_MISMATCH`)"),
            @ApiResponse(responseCode = "404", description = "Unknown code (`INVITATION_NOT_FOUND`)"),
            @ApiResponse(responseCode = "409", description = "`INVITATION_ALREADY_USED`, `INVITATION_REVOKED` or `ALREADY_MEMBER`"),
            @ApiResponse(responseCode = "410", description = "Code expired (`INVITATION_EXPIRED`)")
    })
    @PostMapping("/invitations/redeem")
    public ResponseEntity<MembershipResponse> redeemInvitation(@Valid @RequestBody RedeemInvitationRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(invitationService.redeemInvitation(request.code(), principal.userId(), principal.phone()));
    }
}
