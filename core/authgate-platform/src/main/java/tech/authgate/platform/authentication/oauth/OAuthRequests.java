package tech.authgate.platform.authentication.oauth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inputs and outputs of the OAuth authorization service.
 */
public final class OAuthRequests {

    private OAuthRequests() {
    }

    /**
     * Parameters of GET /oauth/authorize.
     */
    public record AuthorizeRequest(
        String responseType,
        String clientId,
        String redirectUri,
        String scope,
        String state,
        String codeChallenge,
        String codeChallengeMethod
    ) {}

    /**
     * Parameters of POST /oauth/token, with client credentials already merged from
     * the Authorization header where one was sent.
     */
    public record TokenRequest(
        String grantType,
        String code,
        String redirectUri,
        String clientId,
        String clientSecret,
        String codeVerifier,
        String refreshToken
    ) {}

    /**
     * Token endpoint response.
     */
    public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("scope") String scope
    ) {}

    /**
     * Introspection response. Inactive tokens carry nothing but {@code active:false}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record IntrospectionResponse(
        @JsonProperty("active") boolean active,
        @JsonProperty("scope") String scope,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("exp") Long exp
    ) {
        public static IntrospectionResponse inactive() {
            return new IntrospectionResponse(false, null, null, null, null);
        }
    }
}
