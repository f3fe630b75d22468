package com.moldstudio.reservation.api.controller;

import com.moldstudio.common.exception.ConflictException;
import com.moldstudio.reservation.api.dto.IncentiveEntryResponse;
import com.moldstudio.reservation.api.dto.MasterDataRequest;
import com.moldstudio.reservation.auth.AccessTokenCodec;
import com.moldstudio.reservation.auth.AuthenticatedStaff;
import com.moldstudio.reservation.auth.TokenAuthenticationFilter;
import com.moldstudio.reservation.config.SecurityConfig;
import com.moldstudio.reservation.config.ServiceConfig;
import com.moldstudio.reservation.domain.service.IncentiveLedgerService;
import com.moldstudio.reservation.domain.service.MasterDataService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Bearer-token authentication and the manager role gate, run through the real filter chain.
 */
@WebMvcTest(controllers = {IncentiveController.class, MasterDataController.class})
@Import({SecurityConfig.class, ServiceConfig.class, TokenAuthenticationFilter.class, AccessTokenCodec.class})
@DisplayName("API security")
class ApiSecurityTest {

    private static final AuthenticatedStaff MANAGER = new AuthenticatedStaff("manager", "manager", "manager");
    private static final AuthenticatedStaff STAFF = new AuthenticatedStaff("sato", "sato", "staff");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AccessTokenCodec tokenCodec;

    @MockBean
    private IncentiveLedgerService incentiveLedger;

    @MockBean
    private MasterDataService masterDataService;

    private String bearer(AuthenticatedStaff staff) {
        return "Bearer " + tokenCodec.issue(staff);
    }

    @Test
    @DisplayName("a request without a token is rejected with 401 and the error envelope")
    void noToken_returns401() throws Exception {
        mockMvc.perform(get("/api/v1/incentives"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));

        verifyNoInteractions(incentiveLedger);
    }

    @Test
    @DisplayName("a token with a broken signature is treated as no token")
    void tamperedToken_returns401() throws Exception {
        // given
        String token = tokenCodec.issue(MANAGER);
        String tampered = token.substring(0, token.length() - 2) + (token.endsWith("AA") ? "BB" : "AA");

        // when & then
        mockMvc.perform(get("/api/v1/incentives")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + tampered))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));
    }

    @Test
    @DisplayName("a staff token on a manager-only endpoint is rejected with 403")
    void staffToken_onIncentives_returns403() throws Exception {
        mockMvc.perform(get("/api/v1/incentives")
                        .header(HttpHeaders.AUTHORIZATION, bearer(STAFF)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("FORBIDDEN"));

        verifyNoInteractions(incentiveLedger);
    }

    @Test
    @DisplayName("a manager token reaches the incentive ledger")
    void managerToken_onIncentives_returns200() throws Exception {
        // given
        given(incentiveLedger.list(any(), any())).willReturn(List.of(
                new IncentiveEntryResponse("佐藤", LocalDate.of(2025, 10, 27), 2, 2000L, null)));

        // when & then
        mockMvc.perform(get("/api/v1/incentives")
                        .header(HttpHeaders.AUTHORIZATION, bearer(MANAGER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].staffInCharge").value("佐藤"))
                .andExpect(jsonPath("$.data[0].amount").value(2000));
    }

    @Test
    @DisplayName("staff may read master data but not change it")
    void staffToken_onMasterData_readOnly() throws Exception {
        // given
        given(masterDataService.listStaff()).willReturn(List.of());

        // when & then
        mockMvc.perform(get("/api/v1/staff")
                        .header(HttpHeaders.AUTHORIZATION, bearer(STAFF)))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/staff")
                        .header(HttpHeaders.AUTHORIZATION, bearer(STAFF))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"高橋\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("FORBIDDEN"));
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    @DisplayName("a duplicate staff name is reported as 409 Conflict")
    void manager_duplicateStaffName_returns409() throws Exception {
        // given
        given(masterDataService.createStaff(any(MasterDataRequest.class)))
                .willThrow(new ConflictException("Staff member", "佐藤"));

        // when & then
        mockMvc.perform(post("/api/v1/staff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"佐藤\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("CONFLICT"));
    }
}
