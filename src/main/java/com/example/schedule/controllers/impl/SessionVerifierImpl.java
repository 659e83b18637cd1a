package com.example.schedule.controllers.impl;

import com.example.schedule.config.ScheduleConfig;
import com.example.schedule.controllers.SessionVerifier;
import com.example.schedule.service.auth.ProviderSession;
import com.example.schedule.service.exception.ScheduleStorageException;
import com.example.schedule.service.exception.SessionAuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionVerifierImpl implements SessionVerifier {

    static final String SESSION_HEADER = "X-Session-Token";
    private static final String PROVIDER_ROLE = "provider";

    private final RestTemplate restTemplate;
    private final ScheduleConfig config;

    @Override
    public ProviderSession verify(String sessionToken) {
        if (sessionToken == null || sessionToken.isBlank()) {
            throw new SessionAuthException("Please login to manage your schedule");
        }

        VerifyResponse body;
        try {
            String url = config.getAuthApiUrl() + "/auth/verify-session";

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.set(SESSION_HEADER, sessionToken);
            HttpEntity<VerifyRequest> entity = new HttpEntity<>(new VerifyRequest(sessionToken), headers);

            ResponseEntity<VerifyResponse> response =
                    restTemplate.exchange(url, HttpMethod.POST, entity, VerifyResponse.class);
            body = response.getBody();
        } catch (HttpStatusCodeException e) {
            log.warn("Session verification rejected: {} : {}", e.getStatusCode(), e.getResponseBodyAsString());
            if (HttpStatus.UNAUTHORIZED.equals(e.getStatusCode()) || HttpStatus.FORBIDDEN.equals(e.getStatusCode())) {
                throw new SessionAuthException("Session expired. Please login again.");
            }
            throw new ScheduleStorageException("Session verification failed with status " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            log.error("Session verification failed: {}", e.getMessage());
            throw new ScheduleStorageException("Session verification failed", e);
        }

        if (body == null || !body.valid() || body.userId() == null) {
            throw new SessionAuthException("Session expired. Please login again.");
        }
        if (!PROVIDER_ROLE.equalsIgnoreCase(body.role())) {
            throw new SessionAuthException("Only providers can manage a schedule");
        }
        return new ProviderSession(body.userId(), body.expiresAt());
    }

    private record VerifyRequest(String sessionToken) {}

    private record VerifyResponse(boolean valid, String userId, String role, Instant expiresAt) {}
}
