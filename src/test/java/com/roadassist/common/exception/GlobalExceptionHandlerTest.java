package com.roadassist.common.exception;

import com.roadassist.request.entity.ServiceRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Business exceptions map to their status with code and kind")
    void businessException() {
        ResponseEntity<ProblemDetail> response = handler.handleBusinessException(
                new BusinessException(ErrorCode.MECHANIC_NOT_AVAILABLE, "Mechanic #7 is IN_SERVICE"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        ProblemDetail body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.getDetail()).isEqualTo("Mechanic #7 is IN_SERVICE");
        assertThat(body.getType().toString()).isEqualTo("https://roadassist.io/errors/mechanic_not_available");
        assertThat(body.getProperties())
                .containsEntry("code", "MECHANIC_NOT_AVAILABLE")
                .containsEntry("kind", "STATE_CONFLICT");
    }

    @Test
    @DisplayName("Optimistic lock failures are a 409 concurrent modification")
    void optimisticLock() {
        ResponseEntity<ProblemDetail> response = handler.handleOptimisticLock(
                new ObjectOptimisticLockingFailureException(ServiceRequest.class, 1L));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getProperties()).containsEntry("code", "CONCURRENT_MODIFICATION");
    }

    @Test
    @DisplayName("Unexpected errors hide their message")
    void unexpected() {
        ResponseEntity<ProblemDetail> response = handler.handleException(new IllegalStateException("db password wrong"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getDetail()).isEqualTo("Internal server error");
    }
}
