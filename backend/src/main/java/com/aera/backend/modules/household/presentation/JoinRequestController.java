package com.aera.backend.modules.household.presentation;

import java.net.URI;
import java.util.List;
import java.util.UUID;

import com.aera.backend.global.security.SecurityUtils;
import com.aera.backend.modules.household.application.JoinRequestService;
import com.aera.backend.modules.household.application.JoinRequestService.JoinRequestSubmission;
import com.aera.backend.modules.household.presentation.dto.JoinByCodeRequest;
import com.aera.backend.modules.household.presentation.dto.JoinRequestResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/households")
public class JoinRequestController {

    private final JoinRequestService joinRequestService;

    public JoinRequestController(JoinRequestService joinRequestService) {
        this.joinRequestService = joinRequestService;
    }

    @Operation(summary = "Request to join by household code", description = "The owner approves or rejects the request.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Request submitted"),
            @ApiResponse(responseCode = "200", description = "A request for this household is already pending"),
            @ApiResponse(responseCode = "404", description = "Unknown code (`HOUSEHOLD_NOT_FOUND`)"),
            @ApiResponse(responseCode = "409", description = "Already a member (`ALREADY_MEMBER`)")
    })
    @PostMapping("/join-requests")
    public ResponseEntity<JoinRequestResponse> requestJoin(@Valid @RequestBody JoinByCodeRequest request) {
        JoinRequestSubmission submission =
                joinRequestService.requestJoin(request.householdCode(), SecurityUtils.getCurrentUserId());
        JoinRequestResponse body = submission.request();
        if (!submission.created()) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.created(URI.create("/households/" + body.householdId() + "/join-requests/" + body.id()))
                .body(body);
    }

    @GetMapping("/join-requests/mine")
    public ResponseEntity<List<JoinRequestResponse>> listOwnRequests() {
        return ResponseEntity.ok(joinRequestService.listOwn(SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/{householdId}/join-requests")
    public ResponseEntity<List<JoinRequestResponse>> listPending(@PathVariable("householdId") UUID householdId) {
        return ResponseEntity.ok(joinRequestService.listPending(householdId, SecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Approve join request", description = "Owner only. Adds the requester as MEMBER.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Approved"),
            @ApiResponse(responseCode = "403", description = "Caller is not the owner (`NOT_OWNER`)"),
            @ApiResponse(responseCode = "404", description = "`REQUEST_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "`ALREADY_PROCESSED` or `ALREADY_MEMBER`")
    })
    @PostMapping("/{householdId}/join-requests/{requestId}/approve")
    public ResponseEntity<JoinRequestResponse> approve(
            @PathVariable("householdId") UUID householdId,
            @PathVariable("requestId") UUID requestId
    ) {
        return ResponseEntity.ok(joinRequestService.approve(householdId, requestId, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/{householdId}/join-requests/{requestId}/reject")
    public ResponseEntity<JoinRequestResponse> reject(
            @PathVariable("householdId") UUID householdId,
            @PathVariable("requestId") UUID requestId
    ) {
        return ResponseEntity.ok(joinRequestService.reject(householdId, requestId, SecurityUtils.getCurrentUserId()));
    }
}
