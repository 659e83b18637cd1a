package com.example.schedule.controllers;

import com.example.schedule.service.auth.ProviderSession;

public interface SessionVerifier {

    /** Resolves a session token to a provider session; fails with an auth error otherwise. */
    ProviderSession verify(String sessionToken);
}
