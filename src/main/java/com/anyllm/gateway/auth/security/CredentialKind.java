package com.anyllm.gateway.auth.security;

public enum CredentialKind {
    MASTER,
    API_KEY,
    ACCESS_TOKEN
}
