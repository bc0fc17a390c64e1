package com.wordhub.web.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApiResponseTest {

    @Test
    void successCarriesData() {
        ApiResponse<String> r = ApiResponse.success("room-1");

        assertThat(r.ok()).isTrue();
        assertThat(r.code()).isEqualTo(200);
        assertThat(r.data()).isEqualTo("room-1");
        assertThat(r.errorCode()).isNull();
    }

    @Test
    void failureCarriesBusinessCode() {
        ApiResponse<Object> r = ApiResponse.failure(409, "NOT_YOUR_TURN", "not your turn");

        assertThat(r.ok()).isFalse();
        assertThat(r.errorCode()).isEqualTo("NOT_YOUR_TURN");
        assertThat(ApiResponse.notFound("x").code()).isEqualTo(404);
        assertThat(ApiResponse.serverError("x").code()).isEqualTo(500);
    }

    @Test
    void nullFieldsAreOmittedFromJson() throws Exception {
        String json = new ObjectMapper().writeValueAsString(ApiResponse.success());

        assertThat(json).contains("\"code\":200").doesNotContain("errorCode").doesNotContain("data");
    }
}
