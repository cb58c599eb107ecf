package com.riskledger.register.controller;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RegisterApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void riskLifecycleOverHttp() throws Exception {
        String created = mockMvc.perform(post("/api/v1/risks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {
                      "organizationalUnitId": "%s",
                      "riskName": "Test rig unavailable",
                      "riskCondition": "One shared rig",
                      "riskIf": "the rig fails",
                      "riskThen": "qualification slips",
                      "likelihood": 3,
                      "consequence": 3
                    }
                    """.formatted(UUID.randomUUID())))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.riskLevel").value("moderate"))
            .andExpect(jsonPath("$.data.levelRank").value(14))
            .andReturn().getResponse().getContentAsString();
        String id = JsonPath.read(created, "$.data.id");

        mockMvc.perform(patch("/api/v1/risks/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"likelihood\": 5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VAL_7003"))
            .andExpect(jsonPath("$.validationErrors.likelihoodChangeReason").exists());

        mockMvc.perform(patch("/api/v1/risks/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"likelihood\": 5, \"likelihoodChangeReason\": \"rig vendor went bust\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.riskLevel").value("high"))
            .andExpect(jsonPath("$.data.originalLikelihood").value(3));

        mockMvc.perform(get("/api/v1/risks/{id}/history", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data", hasSize(2)))
            .andExpect(jsonPath("$.data[1].changeReasons.likelihoodChangeReason").value("rig vendor went bust"));

        mockMvc.perform(get("/api/v1/risks/{id}/audit-log", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].action").value("updated"))
            .andExpect(jsonPath("$.data[0].details.kind").value("updated"))
            .andExpect(jsonPath("$.data[0].details.changes.likelihood.from").value(3))
            .andExpect(jsonPath("$.data[0].details.changes.likelihood.to").value(5))
            .andExpect(jsonPath("$.data[0].details.likelihoodChangeReason").value("rig vendor went bust"));
    }

    @Test
    void stepPatchDistinguishesAbsentFromNull() throws Exception {
        String risk = mockMvc.perform(post("/api/v1/risks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"organizationalUnitId": "%s", "riskName": "Test rig unavailable",
                     "riskCondition": "One shared rig", "riskIf": "the rig fails", "riskThen": "qualification slips"}
                    """.formatted(UUID.randomUUID())))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        String riskId = JsonPath.read(risk, "$.data.id");

        String step = mockMvc.perform(post("/api/v1/risks/{id}/steps", riskId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"mitigationActions": "Rent a second rig", "closureCriteria": "Rig on site",
                     "expectedLikelihood": 2, "expectedConsequence": 2,
                     "actualLikelihood": 2, "actualConsequence": 1}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.actualRank").value(2))
            .andReturn().getResponse().getContentAsString();
        String stepId = JsonPath.read(step, "$.data.id");

        mockMvc.perform(patch("/api/v1/risks/{id}/steps/{stepId}", riskId, stepId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"closureCriteria\": \"Rig commissioned\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.closureCriteria").value("Rig commissioned"))
            .andExpect(jsonPath("$.data.actualLikelihood").value(2))
            .andExpect(jsonPath("$.data.actualRank").value(2));

        mockMvc.perform(patch("/api/v1/risks/{id}/steps/{stepId}", riskId, stepId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actualConsequence\": null}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.actualLikelihood").value(2))
            .andExpect(jsonPath("$.data.actualRank").doesNotExist())
            .andExpect(jsonPath("$.data.actualLevel").doesNotExist());
    }

    @Test
    void rejectsCreateWithoutRequiredNarrative() throws Exception {
        mockMvc.perform(post("/api/v1/opportunities")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"organizationalUnitId\": \"%s\", \"likelihood\": 2}".formatted(UUID.randomUUID())))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VAL_7001"))
            .andExpect(jsonPath("$.validationErrors.opportunityName").exists());
    }

    @Test
    void unknownRegisterIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/hazards/{id}/history", UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }

    @Test
    void unknownRecordIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/issues/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("REG_9002"));
    }

    @Test
    void malformedHistoryDateIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/risks/{id}/history", UUID.randomUUID()).param("at", "yesterday"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VAL_7005"));
    }

    @Test
    void listsCategoriesByScheme() throws Exception {
        mockMvc.perform(get("/api/v1/categories").param("scheme", "opportunity"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[*].code", hasItem("growth")));

        mockMvc.perform(get("/api/v1/categories").param("scheme", "weather"))
            .andExpect(status().isBadRequest());
    }
}
