package com.therian.chatbackend.auth;

public interface CredentialVerifier {

    /**
     * Exchanges an identity-provider token for the verified subject.
     *
     * @throws AuthException with {@link AuthError#INVALID} when the provider rejects the token
     */
    ExternalIdentity verify(String externalToken);
}
