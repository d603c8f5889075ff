package com.itemhub.backend.health;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.itemhub.backend.infra.AbstractIntegrationTest;

/**
 * Health 체크 (익명 허용)
 *
 * 1) Actuator probe: /actuator/health, /liveness, /readiness -> 200 + UP
 * 2) API health: /api/v1/health -> healthy, /api/v1/health/ready -> ready
 *
 * - Actuator는 application/vnd.spring-boot.actuator.v3+json 같은 vendor media type을 내려줄 수 있어서
 *   "+json suffix"까지 허용하는 media type으로 비교한다.
 */
@DisplayName("[Health] health 체크")
public class ActuatorHealthIT extends AbstractIntegrationTest {

    @Autowired MockMvc mvc;

    private static final MediaType ANY_JSON_PLUS = MediaType.parseMediaType("application/*+json");

    @Test
    @DisplayName("GET /actuator/health -> 200 + JSON + UP")
    void health_up() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(ANY_JSON_PLUS))
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("GET /actuator/health/liveness, /readiness -> 200 + UP")
    void health_probes_up() throws Exception {
        mvc.perform(get("/actuator/health/liveness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
        mvc.perform(get("/actuator/health/readiness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("GET /api/v1/health -> healthy, /api/v1/health/ready -> ready (토큰 없이)")
    void api_health() throws Exception {
        mvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
        mvc.perform(get("/api/v1/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ready"));
    }

    @Test
    @DisplayName("없는 경로 → 인증 필요 (401 AUTH_REQUIRED)")
    void unknown_path_requires_auth() throws Exception {
        mvc.perform(get("/api/v1/nope"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_REQUIRED"));
    }
}
