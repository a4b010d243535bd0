package com.z254.butterfly.concierge.api;

import com.z254.butterfly.concierge.api.v1.SessionController;
import com.z254.butterfly.concierge.session.SessionManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Web layer tests for {@link RequestLoggingFilter}.
 */
@WebFluxTest(controllers = SessionController.class)
@Import(GlobalExceptionHandler.class)
class RequestLoggingFilterTest {

    private static final String MILLIS_PATTERN = "\\d+\\.\\d";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private SessionManager sessionManager;

    @Test
    @DisplayName("should add the processing time header to a successful response")
    void headerOnSuccess() {
        when(sessionManager.createSession()).thenReturn("s-1");

        webTestClient.post()
                .uri("/api/v1/sessions")
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().valueMatches(RequestLoggingFilter.PROCESS_TIME_HEADER, MILLIS_PATTERN);
    }

    @Test
    @DisplayName("should add the processing time header to an error response")
    void headerOnError() {
        when(sessionManager.exists("missing")).thenReturn(false);

        webTestClient.delete()
                .uri("/api/v1/sessions/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectHeader().valueMatches(RequestLoggingFilter.PROCESS_TIME_HEADER, MILLIS_PATTERN);
    }

    @Test
    @DisplayName("should format elapsed time in milliseconds with one decimal")
    void formatsMillis() {
        String formatted = RequestLoggingFilter.formatMillis(System.nanoTime() - 2_500_000L);

        assertThat(formatted).matches(MILLIS_PATTERN);
        assertThat(Double.parseDouble(formatted)).isGreaterThanOrEqualTo(2.5);
    }
}
