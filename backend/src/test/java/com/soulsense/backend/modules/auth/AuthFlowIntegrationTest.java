package com.soulsense.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.soulsense.backend.modules.audit.domain.AuditAction;
import com.soulsense.backend.modules.audit.domain.AuditLog;
import com.soulsense.backend.modules.audit.domain.AuditLogStore;
import com.soulsense.backend.modules.auth.application.OtpDeliveryGateway;
import com.soulsense.backend.modules.auth.domain.OtpType;
import com.soulsense.backend.modules.auth.domain.UserAccount;
import com.soulsense.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

@SpringBootTest
@AutoConfigureMockMvc
class AuthFlowIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "Password1!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AuditLogStore auditLogStore;

    @MockBean
    private OtpDeliveryGateway otpDeliveryGateway;

    @Test
    void registerLoginListAndLogout() throws Exception {
        JsonNode registered = register("alice", "alice@example.com");
        UUID userId = UUID.fromString(registered.path("userId").asText());

        JsonNode login = login("alice", PASSWORD);
        assertThat(login.path("state").asText()).isEqualTo("AUTHENTICATED");
        String accessToken = login.path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/sessions").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].current").value(true));

        mockMvc.perform(delete("/sessions/current").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/sessions").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH007"));

        List<AuditLog> audit = auditLogStore.findByUserId(userId);
        assertThat(audit).extracting(AuditLog::getAction)
                .containsExactly(AuditAction.REGISTER, AuditAction.LOGIN, AuditAction.LOGOUT);
    }

    @Test
    void wrongPasswordIsUnauthorizedProblem() throws Exception {
        register("bob", "bob@example.com");

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("identifier", "bob", "password", "nope"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH001"))
                .andExpect(jsonPath("$.instance").value("/auth/login"));
    }

    @Test
    void duplicateUsernameIsConflict() throws Exception {
        register("carol", "carol@example.com");

        mockMvc.perform(post("/auth/register")
                        .with(fromAddress("192.0.2.50"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "username", "Carol",
                                "email", "carol2@example.com",
                                "password", PASSWORD))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("REG001"));
    }

    @Test
    void missingFieldsAreValidationProblem() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("VAL001"));
    }

    @Test
    void refreshRotatesAndReplayIsRejected() throws Exception {
        register("dave", "dave@example.com");
        String refreshToken = login("dave", PASSWORD).path("tokens").path("refreshToken").asText();

        MvcResult rotated = mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("refreshToken", refreshToken))))
                .andExpect(status().isOk())
                .andReturn();
        String successor = objectMapper.readTree(rotated.getResponse().getContentAsString())
                .path("refreshToken").asText();
        assertThat(successor).isNotBlank().isNotEqualTo(refreshToken);

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("refreshToken", refreshToken))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH007"));
    }

    @Test
    void twoFactorLoginThroughTheApi() throws Exception {
        register("erin", "erin@example.com");
        String accessToken = login("erin", PASSWORD).path("tokens").path("accessToken").asText();

        mockMvc.perform(post("/account/2fa/setup").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isAccepted());
        mockMvc.perform(post("/account/2fa/enable")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("code", lastCode(OtpType.SETUP_2FA)))))
                .andExpect(status().isNoContent());

        JsonNode first = login("erin", PASSWORD);
        assertThat(first.path("state").asText()).isEqualTo("PRE_AUTH");
        assertThat(first.has("tokens")).isFalse();

        MvcResult verified = mockMvc.perform(post("/auth/2fa/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "preAuthToken", first.path("preAuthToken").asText(),
                                "code", lastCode(OtpType.LOGIN_2FA)))))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode second = objectMapper.readTree(verified.getResponse().getContentAsString());
        assertThat(second.path("state").asText()).isEqualTo("AUTHENTICATED");
        assertThat(second.path("tokens").path("accessToken").asText()).isNotBlank();
    }

    @Test
    void passwordResetRequestIsRateLimitedPerAddress() throws Exception {
        register("frank", "frank@example.com");
        String body = objectMapper.writeValueAsString(Map.of("email", "frank@example.com"));

        mockMvc.perform(post("/auth/password-reset").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isAccepted());
        mockMvc.perform(post("/auth/password-reset").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
                .andExpect(jsonPath("$.code").value("AUTH004"));
    }

    @Test
    void protectedEndpointsNeedAToken() throws Exception {
        mockMvc.perform(get("/sessions"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/sessions").header(HttpHeaders.AUTHORIZATION, "Bearer garbage"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH007"));
    }

    private JsonNode register(String username, String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/register")
                        .with(fromAddress("192.0.2." + Math.abs(username.hashCode() % 200)))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "username", username,
                                "email", email,
                                "password", PASSWORD))))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private JsonNode login(String identifier, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .header(HttpHeaders.USER_AGENT, "integration-test")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "identifier", identifier,
                                "password", password))))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String lastCode(OtpType type) {
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(otpDeliveryGateway, atLeastOnce()).deliver(any(UserAccount.class), any(), eq(type), code.capture());
        return code.getValue();
    }

    private static RequestPostProcessor fromAddress(String remoteAddr) {
        return request -> {
            request.setRemoteAddr(remoteAddr);
            return request;
        };
    }
}
