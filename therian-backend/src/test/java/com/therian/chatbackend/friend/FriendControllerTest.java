package com.therian.chatbackend.friend;

import com.therian.chatbackend.auth.JwtService;
import com.therian.chatbackend.util.TestCleanupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FriendControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private JwtService jwtService;
    @Autowired private TestCleanupService cleanupService;

    @BeforeEach
    void setUp() {
        cleanupService.wipe();
        cleanupService.createUser("u-alice", "Alice");
        cleanupService.createUser("u-bob", "Bob");
    }

    private String bearer(String id) {
        return "Bearer " + jwtService.issue(id);
    }

    @Test
    void testAddFriend_isMutual() throws Exception {
        mockMvc.perform(post("/api/friends/u-bob").header("Authorization", bearer("u-alice")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));
        // repeated add is harmless
        mockMvc.perform(post("/api/friends/u-bob").header("Authorization", bearer("u-alice")))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/friends").header("Authorization", bearer("u-alice")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("u-bob"));
        mockMvc.perform(get("/api/friends").header("Authorization", bearer("u-bob")))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value("Alice"));
    }

    @Test
    void testAddFriend_self() throws Exception {
        mockMvc.perform(post("/api/friends/u-alice").header("Authorization", bearer("u-alice")))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testAddFriend_unknownUser() throws Exception {
        mockMvc.perform(post("/api/friends/nobody").header("Authorization", bearer("u-alice")))
                .andExpect(status().isNotFound());
    }
}
