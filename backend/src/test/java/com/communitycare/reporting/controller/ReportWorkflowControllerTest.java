package com.communitycare.reporting.controller;

import com.communitycare.reporting.auth.ActorResolver;
import com.communitycare.reporting.model.UserAccount;
import com.communitycare.reporting.model.UserRole;
import com.communitycare.reporting.repository.AdminLogRepository;
import com.communitycare.reporting.repository.NotificationRepository;
import com.communitycare.reporting.repository.ReportRepository;
import com.communitycare.reporting.repository.UserAccountRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ReportWorkflowControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    @Autowired private UserAccountRepository userRepository;
    @Autowired private ReportRepository reportRepository;
    @Autowired private NotificationRepository notificationRepository;
    @Autowired private AdminLogRepository adminLogRepository;

    private Long aliceId;
    private Long adminId;

    @BeforeEach
    void setup() throws Exception {
        notificationRepository.deleteAllInBatch();
        adminLogRepository.deleteAllInBatch();
        reportRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();

        aliceId = register("alice", "alice@example.com");
        adminId = register("warden", "warden@example.com");
        UserAccount warden = userRepository.findById(adminId).orElseThrow();
        warden.setRole(UserRole.ADMIN);
        userRepository.save(warden);
    }

    private Long register(String username, String email) throws Exception {
        String body = "{\"username\":\"" + username + "\",\"email\":\"" + email + "\",\"password\":\"secret1\",\"confirmPassword\":\"secret1\"}";
        MvcResult result = mockMvc.perform(post("/api/auth/register").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andReturn();
        return readId(result);
    }

    private Long readId(MvcResult result) throws Exception {
        JsonNode node = objectMapper.readTree(result.getResponse().getContentAsString());
        return node.get("id").asLong();
    }

    @Test
    void reportIsFiledResolvedAndOwnerNotified() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/reports")
                        .header(ActorResolver.ACTOR_HEADER, aliceId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problemType\":\"🛣️ Road - Potholes or road damage\",\"location\":\"Main St\"," +
                                "\"issueDescription\":\"Deep pothole\",\"reportedDate\":\"2024-05-01\",\"priority\":\"High\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("Pending"))
                .andExpect(jsonPath("$.problemType").value("Road"))
                .andReturn();
        Long reportId = readId(created);

        mockMvc.perform(get("/api/stats/global").header(ActorResolver.ACTOR_HEADER, aliceId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.pending").value(1));

        mockMvc.perform(put("/api/reports/" + reportId + "/status")
                        .header(ActorResolver.ACTOR_HEADER, adminId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Resolved\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Resolved"));

        mockMvc.perform(get("/api/notifications/unread-count").header(ActorResolver.ACTOR_HEADER, aliceId))
                .andExpect(jsonPath("$.unread").value(1));
        mockMvc.perform(get("/api/notifications").header(ActorResolver.ACTOR_HEADER, aliceId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].message").value("Your report status has been updated to Resolved"));
        mockMvc.perform(get("/api/notifications/unread-count").header(ActorResolver.ACTOR_HEADER, aliceId))
                .andExpect(jsonPath("$.unread").value(0));

        mockMvc.perform(get("/api/admin/audit").header(ActorResolver.ACTOR_HEADER, adminId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].action").value("UPDATE_STATUS"))
                .andExpect(jsonPath("$[0].adminName").value("warden"));

        mockMvc.perform(get("/api/reports").param("scope", "all").header(ActorResolver.ACTOR_HEADER, adminId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].submittedBy").value("alice"));
    }

    @Test
    void regularUserCannotChangeStatus() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/reports")
                        .header(ActorResolver.ACTOR_HEADER, aliceId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problemType\":\"Water\",\"location\":\"Elm St\",\"issueDescription\":\"Leak\",\"reportedDate\":\"2024-05-02\",\"priority\":\"Low\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        Long reportId = readId(created);

        mockMvc.perform(put("/api/reports/" + reportId + "/status")
                        .header(ActorResolver.ACTOR_HEADER, aliceId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Resolved\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("ROLE_REQUIRED"));

        assertThat(notificationRepository.count()).isZero();
        assertThat(adminLogRepository.count()).isZero();
    }

    @Test
    void duplicateRegistrationAndBadLogin() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice2\",\"email\":\"ALICE@example.com\",\"password\":\"secret1\",\"confirmPassword\":\"secret1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONFLICT"))
                .andExpect(jsonPath("$.field").value("email"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"nope\"}"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"secret1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(aliceId))
                .andExpect(jsonPath("$.role").value("user"));
    }

    @Test
    void adminManagesUsers() throws Exception {
        mockMvc.perform(put("/api/admin/users/" + adminId + "/role")
                        .header(ActorResolver.ACTOR_HEADER, adminId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"user\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("SELF_MODIFICATION"));

        mockMvc.perform(get("/api/admin/users").header(ActorResolver.ACTOR_HEADER, aliceId))
                .andExpect(status().isForbidden());

        mockMvc.perform(delete("/api/admin/users/" + aliceId).header(ActorResolver.ACTOR_HEADER, adminId))
                .andExpect(status().isNoContent());
        assertThat(userRepository.existsById(aliceId)).isFalse();

        mockMvc.perform(get("/api/admin/audit").header(ActorResolver.ACTOR_HEADER, adminId))
                .andExpect(jsonPath("$[0].action").value("DELETE"))
                .andExpect(jsonPath("$[0].targetType").value("user"));

        mockMvc.perform(delete("/api/admin/audit").header(ActorResolver.ACTOR_HEADER, adminId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(1));
    }

    @Test
    void unknownCallerIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/reports").header(ActorResolver.ACTOR_HEADER, 987654))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/stats/me"))
                .andExpect(status().isUnauthorized());
    }
}
