package com.docspace.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.docspace.backend.support.AbstractPostgresIntegrationTest;
import com.docspace.backend.support.InMemorySessionStoreConfig;
import com.docspace.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import({InMemorySessionStoreConfig.class, TestUserFactory.class})
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    void registerLoginAndReadProfile() throws Exception {
        String email = registerEngineer();

        JsonNode login = login(email, TestUserFactory.PASSWORD);
        String accessToken = login.path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/profile/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(email))
                .andExpect(jsonPath("$.departmentName").value("Engineering"));
    }

    @Test
    void wrongPasswordIsGenericUnauthorized() throws Exception {
        String email = registerEngineer();

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("email", email, "password", "not-the-password")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void logoutRevokesAccessTokenImmediately() throws Exception {
        JsonNode login = login(registerEngineer(), TestUserFactory.PASSWORD);
        String accessToken = login.path("tokens").path("accessToken").asText();
        String refreshToken = login.path("tokens").path("refreshToken").asText();

        mockMvc.perform(post("/auth/logout")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("refreshToken", refreshToken)))
                .andExpect(status().isOk());

        mockMvc.perform(get("/profile/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_ACCESS_TOKEN"));
        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("refreshToken", refreshToken)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_REFRESH_TOKEN"));
    }

    @Test
    void refreshRotatesTokens() throws Exception {
        JsonNode login = login(registerEngineer(), TestUserFactory.PASSWORD);
        String refreshToken = login.path("tokens").path("refreshToken").asText();

        String body = mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("refreshToken", refreshToken)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        assertThat(objectMapper.readTree(body).path("refreshToken").asText()).isNotEqualTo(refreshToken);

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("refreshToken", refreshToken)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void passwordResetEndsOldSessionAndAcceptsNewPassword() throws Exception {
        String email = registerEngineer();
        JsonNode login = login(email, TestUserFactory.PASSWORD);

        String forgot = mockMvc.perform(post("/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("email", email)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String resetToken = objectMapper.readTree(forgot).path("resetToken").asText();

        mockMvc.perform(post("/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("token", resetToken, "newPassword", "Another-pass-42")))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("refreshToken", login.path("tokens").path("refreshToken").asText())))
                .andExpect(status().isUnauthorized());
        login(email, "Another-pass-42");
    }

    @Test
    void protectedRouteWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/folders/accessible"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void unknownEmailGetsSameForgotPasswordAnswer() throws Exception {
        mockMvc.perform(post("/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("email", "nobody-" + UUID.randomUUID() + "@example.com")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resetToken").doesNotExist());
    }

    private String registerEngineer() {
        return testUserFactory.register("Engineering").user().email();
    }

    private JsonNode login(String email, String password) throws Exception {
        String body = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("email", email, "password", password)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    private String json(String... keyValues) throws Exception {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return objectMapper.writeValueAsString(map);
    }
}
