package com.example.schedule.controllers.impl;

import com.example.schedule.service.auth.ProviderSession;
import com.example.schedule.service.exception.ScheduleStorageException;
import com.example.schedule.service.exception.SessionAuthException;
import com.example.schedule.support.ScheduleTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SessionVerifierImplTest {

    private static final String URL = "http://auth.test/auth/verify-session";

    private MockRestServiceServer server;
    private SessionVerifierImpl verifier;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        verifier = new SessionVerifierImpl(restTemplate, ScheduleTestData.config());
    }

    @Test
    void shouldAcceptProviderSession() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Session-Token", "abc"))
                .andRespond(withSuccess("{\"valid\":true,\"userId\":\"provider-1\",\"role\":\"provider\"}",
                        MediaType.APPLICATION_JSON));

        ProviderSession session = verifier.verify("abc");

        assertThat(session.providerId()).isEqualTo("provider-1");
        assertThat(session.isExpired(Instant.now())).isFalse();
        server.verify();
    }

    @Test
    void shouldRejectCustomerRole() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"valid\":true,\"userId\":\"c-1\",\"role\":\"customer\"}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> verifier.verify("abc")).isInstanceOf(SessionAuthException.class);
    }

    @Test
    void shouldRejectMissingTokenWithoutCalling() {
        assertThatThrownBy(() -> verifier.verify(null)).isInstanceOf(SessionAuthException.class);
        server.verify();
    }

    @Test
    void shouldMapUnauthorizedToAuthError() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> verifier.verify("abc")).isInstanceOf(SessionAuthException.class);
    }

    @Test
    void shouldMapServerFailureToStorageError() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> verifier.verify("abc")).isInstanceOf(ScheduleStorageException.class);
    }
}
