package com.aera.backend.modules.household.presentation;

import java.net.URI;
import java.util.UUID;

import com.aera.backend.global.security.SecurityUtils;
import com.aera.backend.modules.household.application.HouseholdRegistryService;
import com.aera.backend.modules.household.application.MembershipTransactionService;
import com.aera.backend.modules.household.presentation.dto.CreateHouseholdRequest;
import com.aera.backend.modules.household.presentation.dto.HouseholdResponse;
import com.aera.backend.modules.household.presentation.dto.LeaveHouseholdRequest;
import com.aera.backend.modules.household.presentation.dto.LeaveHouseholdResponse;
import com.aera.backend.modules.household.presentation.dto.MembershipListResponse;
import com.aera.backend.modules.household.presentation.dto.MembershipResponse;
import com.aera.backend.modules.household.presentation.dto.TransferOwnershipRequest;
import com.aera.backend.modules.household.presentation.dto.TransferOwnershipResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/households")
public class HouseholdController {

    private final HouseholdRegistryService registryService;
    private final MembershipTransactionService membershipTransactionService;

    public HouseholdController(
            HouseholdRegistryService registryService,
            MembershipTransactionService membershipTransactionService
    ) {
        this.registryService = registryService;
        this.membershipTransactionService = membershipTransactionService;
    }

    @PostMapping
    public ResponseEntity<HouseholdResponse> createHousehold(@Valid @RequestBody CreateHouseholdRequest request) {
        UUID userId = SecurityUtils.getCurrentUserId();
        HouseholdResponse response = registryService.createHousehold(userId, request.name());
        return ResponseEntity.created(URI.create("/households/" + response.id())).body(response);
    }

    @GetMapping("/memberships")
    public ResponseEntity<MembershipListResponse> listMemberships() {
        return ResponseEntity.ok(registryService.listMemberships(SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/memberships/current")
    public ResponseEntity<MembershipResponse> currentMembership() {
        return registryService.getMembership(SecurityUtils.getCurrentUserId())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{householdId}")
    public ResponseEntity<HouseholdResponse> getHousehold(@PathVariable("householdId") UUID householdId) {
        return ResponseEntity.ok(registryService.getHousehold(householdId, SecurityUtils.getCurrentUserId()));
    }

    @PutMapping("/{householdId}/active")
    public ResponseEntity<MembershipResponse> switchActiveHousehold(@PathVariable("householdId") UUID householdId) {
        return ResponseEntity.ok(registryService.switchActiveHousehold(householdId, SecurityUtils.getCurrentUserId()));
    }

    @Operation(
            summary = "Transfer ownership",
            description = """
                    Demotes the current owner and promotes an existing member in one transaction. \
                    The caller must be the owner of the household.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ownership transferred"),
            @ApiResponse(responseCode = "403", description = "Caller is not the owner (`NOT_OWNER`)"),
            @ApiResponse(responseCode = "409", description = "`ALREADY_OWNS_HOUSEHOLD` or `LOCK_CONTENTION`"),
            @ApiResponse(responseCode = "422", description = "`SAME_IDENTITY` or `NOT_A_MEMBER`")
    })
    @PostMapping("/{householdId}/transfer-ownership")
    public ResponseEntity<TransferOwnershipResponse> transferOwnership(
            @PathVariable("householdId") UUID householdId,
            @Valid @RequestBody TransferOwnershipRequest request
    ) {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(membershipTransactionService.transferOwnership(householdId, request.newOwnerId(), userId));
    }

    @Operation(
            summary = "Leave household",
            description = """
                    Removes the caller's membership. Without a body the active household is used. \
                    A sole owner leaving deletes the household; an owner with remaining members gets \
                    409 `MUST_TRANSFER_FIRST`.
                    """
    )
    @PostMapping("/leave")
    public ResponseEntity<LeaveHouseholdResponse> leaveHousehold(
            @RequestBody(required = false) LeaveHouseholdRequest request
    ) {
        UUID userId = SecurityUtils.getCurrentUserId();
        UUID householdId = request != null ? request.householdId() : null;
        return ResponseEntity.ok(membershipTransactionService.leaveHousehold(householdId, userId));
    }
}
