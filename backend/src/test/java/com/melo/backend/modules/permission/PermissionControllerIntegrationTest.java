package com.melo.backend.modules.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.melo.backend.global.protocol.LevelDocument;
import com.melo.backend.support.AbstractMeloIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class PermissionControllerIntegrationTest extends AbstractMeloIntegrationTest {

    private static final String OWNER = "@owner:melo.test";
    private static final String MEMBER = "@member:melo.test";

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        protocolClient.createRoom(ROOM)
                .join(ROOM, OWNER, 100)
                .join(ROOM, MEMBER, 0);
    }

    @Test
    void catalogIsPublic() throws Exception {
        mockMvc.perform(get("/permissions/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories.length()").value(5))
                .andExpect(jsonPath("$.templates.length()").value(3));
    }

    @Test
    void requiredLevelAndClosestTemplate() throws Exception {
        mockMvc.perform(post("/permissions/required-level")
                        .header(HttpHeaders.AUTHORIZATION, bearer(MEMBER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"capabilities\":[\"ban_members\",\"create_invites\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requiredLevel").value(50))
                .andExpect(jsonPath("$.closestTemplate").value("moderator"));
    }

    @Test
    void validationListsEveryViolation() throws Exception {
        mockMvc.perform(post("/permissions/validation")
                        .header(HttpHeaders.AUTHORIZATION, bearer(MEMBER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"capabilities\":[\"administrator\",\"send_messages\"],\"level\":50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.violations.length()").value(3));
    }

    @Test
    void unknownCapabilityIsMalformed() throws Exception {
        mockMvc.perform(post("/permissions/required-level")
                        .header(HttpHeaders.AUTHORIZATION, bearer(MEMBER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"capabilities\":[\"fly_planes\"]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void effectiveAtLevelRejectsOutOfRange() throws Exception {
        mockMvc.perform(get("/permissions/effective")
                        .header(HttpHeaders.AUTHORIZATION, bearer(MEMBER))
                        .param("level", "101"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void applyToRoomWritesLevelDocument() throws Exception {
        mockMvc.perform(put("/rooms/{roomId}/permissions", ROOM)
                        .header(HttpHeaders.AUTHORIZATION, bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"capabilities\":[\"pin_messages\",\"ban_members\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ban").value(50))
                .andExpect(jsonPath("$.events['m.room.pinned_events']").value(50))
                .andExpect(jsonPath("$.users['@owner:melo.test']").value(100));

        LevelDocument stored = protocolClient.getLevelDocument(ROOM).orElseThrow();
        assertThat(stored.events()).containsEntry("m.room.pinned_events", 50);

        mockMvc.perform(put("/rooms/{roomId}/permissions", ROOM)
                        .header(HttpHeaders.AUTHORIZATION, bearer(MEMBER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"capabilities\":[]}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void memberPermissionsReflectRoomLevels() throws Exception {
        mockMvc.perform(get("/rooms/{roomId}/members/{userId}/permissions", ROOM, MEMBER)
                        .header(HttpHeaders.AUTHORIZATION, bearer(MEMBER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.level").value(0))
                .andExpect(jsonPath("$.capabilities").isArray());
    }
}
