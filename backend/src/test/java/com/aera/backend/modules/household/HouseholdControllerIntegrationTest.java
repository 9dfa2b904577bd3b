package com.aera.backend.modules.household;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import com.aera.backend.modules.audit.domain.HouseholdAuditLog;
import com.aera.backend.modules.audit.infrastructure.HouseholdAuditLogRepository;
import com.aera.backend.support.AbstractPostgresIntegrationTest;
import com.aera.backend.support.TestTokens;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class HouseholdControllerIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private HouseholdAuditLogRepository auditLogRepository;

    private final UUID ownerId = UUID.randomUUID();
    private final UUID inviteeId = UUID.randomUUID();

    private JsonNode postJson(String path, String bearer, Object body, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(
                        post(path)
                                .header(HttpHeaders.AUTHORIZATION, bearer)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(objectMapper.writeValueAsString(body))
                )
                .andExpect(status().is(expectedStatus))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private JsonNode createHousehold() throws Exception {
        return postJson("/households", TestTokens.bearer(ownerId), Map.of("name", "Hill House"), 201);
    }

    @Test
    void requestsWithoutTokenAreUnauthorized() throws Exception {
        mockMvc.perform(get("/households/memberships"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }

    @Test
    void expiredTokenIsReportedAsInvalidToken() throws Exception {
        String expired = "Bearer " + TestTokens.token(ownerId, null, Duration.ofMinutes(-5));

        mockMvc.perform(get("/households/memberships").header(HttpHeaders.AUTHORIZATION, expired))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\""))
                .andExpect(jsonPath("$.code").value("invalid_token"))
                .andExpect(jsonPath("$.type").value("urn:problem:aera:invalid_token"));
    }

    @Test
    void createHouseholdRejectsBlankName() throws Exception {
        JsonNode problem = postJson("/households", TestTokens.bearer(ownerId), Map.of("name", " "), 422);

        assertThat(problem.path("code").asText()).isEqualTo("validation_error");
    }

    @Test
    void phoneBoundInvitationFlow() throws Exception {
        JsonNode household = createHousehold();
        String householdId = household.path("id").asText();

        JsonNode invitation = postJson(
                "/households/" + householdId + "/invitations",
                TestTokens.bearer(ownerId),
                Map.of("inviteeRef", "+1 555 010 2000", "inviteeName", "Kim", "ttl", "PT24H"),
                201
        );
        String code = invitation.path("code").asText();
        assertThat(invitation.path("status").asText()).isEqualTo("PENDING");

        JsonNode mismatch = postJson("/invitations/redeem", TestTokens.bearer(inviteeId, "+15550109999"),
                Map.of("code", code), 403);
        assertThat(mismatch.path("code").asText()).isEqualTo("INVITEE_MISMATCH");
        assertThat(mismatch.path("type").asText()).isEqualTo("urn:problem:aera:invitee_mismatch");

        JsonNode joined = postJson("/invitations/redeem", TestTokens.bearer(inviteeId, "15550102000"),
                Map.of("code", code.toLowerCase()), 200);
        assertThat(joined.path("role").asText()).isEqualTo("MEMBER");
        assertThat(joined.path("active").asBoolean()).isTrue();

        JsonNode reused = postJson("/invitations/redeem", TestTokens.bearer(UUID.randomUUID()),
                Map.of("code", code), 409);
        assertThat(reused.path("code").asText()).isEqualTo("INVITATION_ALREADY_USED");

        mockMvc.perform(get("/households/{id}", householdId).header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(inviteeId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.members", hasSize(2)));
    }

    @Test
    void transferAndLeaveOverHttp() throws Exception {
        JsonNode household = createHousehold();
        String householdId = household.path("id").asText();
        JsonNode joinRequest = postJson("/households/join-requests", TestTokens.bearer(inviteeId),
                Map.of("householdCode", household.path("code").asText()), 201);
        postJson("/households/" + householdId + "/join-requests/" + joinRequest.path("id").asText() + "/approve",
                TestTokens.bearer(ownerId), Map.of(), 200);

        JsonNode blocked = postJson("/households/leave", TestTokens.bearer(ownerId), Map.of(), 409);
        assertThat(blocked.path("code").asText()).isEqualTo("MUST_TRANSFER_FIRST");

        JsonNode notOwner = postJson("/households/" + householdId + "/transfer-ownership",
                TestTokens.bearer(inviteeId), Map.of("newOwnerId", ownerId.toString()), 403);
        assertThat(notOwner.path("code").asText()).isEqualTo("NOT_OWNER");

        JsonNode transferred = postJson("/households/" + householdId + "/transfer-ownership",
                TestTokens.bearer(ownerId), Map.of("newOwnerId", inviteeId.toString()), 200);
        assertThat(transferred.path("success").asBoolean()).isTrue();
        assertThat(transferred.path("previousOwnerId").asText()).isEqualTo(ownerId.toString());
        assertThat(transferred.path("newOwnerId").asText()).isEqualTo(inviteeId.toString());

        JsonNode left = postJson("/households/leave", TestTokens.bearer(ownerId),
                Map.of("householdId", householdId), 200);
        assertThat(left.path("householdDeleted").asBoolean()).isFalse();

        mockMvc.perform(get("/households/memberships/current").header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ownerId)))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/households/{id}", householdId).header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ownerId)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_A_MEMBER"));
    }

    @Test
    void revokedInvitationCannotBeRedeemed() throws Exception {
        JsonNode household = createHousehold();
        String householdId = household.path("id").asText();
        JsonNode invitation = postJson("/households/" + householdId + "/invitations", TestTokens.bearer(ownerId), Map.of(), 201);

        mockMvc.perform(delete("/households/{hid}/invitations/{iid}", householdId, invitation.path("id").asText())
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ownerId))
                        .header("X-Request-Id", "req-revoke-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-revoke-1"))
                .andExpect(jsonPath("$.status").value("REVOKED"));

        JsonNode revoked = postJson("/invitations/redeem", TestTokens.bearer(inviteeId),
                Map.of("code", invitation.path("code").asText()), 409);
        assertThat(revoked.path("code").asText()).isEqualTo("INVITATION_REVOKED");

        assertThat(auditLogRepository.findByHouseholdIdOrderByCreatedAtAsc(UUID.fromString(householdId)))
                .filteredOn(entry -> "invitation_revoked".equals(entry.getAction()))
                .singleElement()
                .extracting(HouseholdAuditLog::getRequestId)
                .isEqualTo("req-revoke-1");
    }

    @Test
    void switchActiveHouseholdRequiresMembership() throws Exception {
        JsonNode household = createHousehold();

        mockMvc.perform(put("/households/{id}/active", household.path("id").asText())
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(inviteeId)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_A_MEMBER"));

        mockMvc.perform(put("/households/{id}/active", household.path("id").asText())
                        .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ownerId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    void nonPositiveTtlIsRejected() throws Exception {
        JsonNode household = createHousehold();

        JsonNode problem = postJson("/households/" + household.path("id").asText() + "/invitations",
                TestTokens.bearer(ownerId), Map.of("ttl", "PT0S"), 400);

        assertThat(problem.path("code").asText()).isEqualTo("INVALID_TTL");
    }

    @Test
    void inviteeThatIsNotAPhoneNumberIsRejected() throws Exception {
        JsonNode household = createHousehold();

        JsonNode problem = postJson("/households/" + household.path("id").asText() + "/invitations",
                TestTokens.bearer(ownerId), Map.of("inviteeRef", "kim@example.com"), 422);

        assertThat(problem.path("code").asText()).isEqualTo("validation_error");
        assertThat(problem.path("detail").asText()).contains("inviteeRef");
    }

    @Test
    void joinByHouseholdCodeWaitsForOwnerApproval() throws Exception {
        JsonNode household = createHousehold();
        String householdId = household.path("id").asText();

        JsonNode submitted = postJson("/households/join-requests", TestTokens.bearer(inviteeId),
                Map.of("householdCode", " " + household.path("code").asText().toLowerCase() + " "), 201);
        String requestId = submitted.path("id").asText();
        assertThat(submitted.path("status").asText()).isEqualTo("PENDING");
        assertThat(submitted.path("householdName").asText()).isEqualTo("Hill House");

        JsonNode repeated = postJson("/households/join-requests", TestTokens.bearer(inviteeId),
                Map.of("householdCode", household.path("code").asText()), 200);
        assertThat(repeated.path("id").asText()).isEqualTo(requestId);

        String approvePath = "/households/" + householdId + "/join-requests/" + requestId + "/approve";
        JsonNode selfApproved = postJson(approvePath, TestTokens.bearer(inviteeId), Map.of(), 403);
        assertThat(selfApproved.path("code").asText()).isEqualTo("NOT_OWNER");
        mockMvc.perform(get("/households/{id}", householdId).header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(inviteeId)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/households/{id}/join-requests", householdId).header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(ownerId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].requesterUserId").value(inviteeId.toString()));

        JsonNode approved = postJson(approvePath, TestTokens.bearer(ownerId), Map.of(), 200);
        assertThat(approved.path("status").asText()).isEqualTo("APPROVED");
        assertThat(approved.path("resolvedByUserId").asText()).isEqualTo(ownerId.toString());

        JsonNode again = postJson(approvePath, TestTokens.bearer(ownerId), Map.of(), 409);
        assertThat(again.path("code").asText()).isEqualTo("ALREADY_PROCESSED");

        mockMvc.perform(get("/households/{id}", householdId).header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(inviteeId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.members", hasSize(2)));
        mockMvc.perform(get("/households/join-requests/mine").header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(inviteeId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("APPROVED"));
    }

    @Test
    void rejectedJoinRequestAddsNoMember() throws Exception {
        JsonNode household = createHousehold();
        String householdId = household.path("id").asText();
        JsonNode submitted = postJson("/households/join-requests", TestTokens.bearer(inviteeId),
                Map.of("householdCode", household.path("code").asText()), 201);

        JsonNode rejected = postJson("/households/" + householdId + "/join-requests/" + submitted.path("id").asText() + "/reject",
                TestTokens.bearer(ownerId), Map.of(), 200);

        assertThat(rejected.path("status").asText()).isEqualTo("REJECTED");
        mockMvc.perform(get("/households/memberships/current").header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(inviteeId)))
                .andExpect(status().isNoContent());
        JsonNode unknownCode = postJson("/households/join-requests", TestTokens.bearer(inviteeId),
                Map.of("householdCode", "ZZZZZZ"), 404);
        assertThat(unknownCode.path("code").asText()).isEqualTo("HOUSEHOLD_NOT_FOUND");
    }

    @Test
    void invitationCannotBeApprovedByItsRedeemer() throws Exception {
        JsonNode household = createHousehold();
        JsonNode invitation = postJson("/households/" + household.path("id").asText() + "/invitations",
                TestTokens.bearer(ownerId), Map.of(), 201);

        postJson("/invitations/" + invitation.path("id").asText() + "/approve", TestTokens.bearer(inviteeId), Map.of(), 404);

        mockMvc.perform(get("/households/memberships/current").header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(inviteeId)))
                .andExpect(status().isNoContent());
    }
}
