package tech.authgate.platform.audit;

/**
 * Decision points that produce an audit event.
 */
public enum AuditAction {

    // OAuth
    OAUTH_AUTHORIZE,
    OAUTH_CODE_EXCHANGE,
    OAUTH_REFRESH,
    OAUTH_REVOKE,
    OAUTH_INTROSPECT,

    // Browser login leg
    BROWSER_LOGIN,

    // Legacy sessions
    LEGACY_LOGIN,
    LEGACY_VALIDATE,
    LEGACY_REFRESH,
    LEGACY_LOGOUT,

    // Vendors
    VENDOR_AUTHORIZE,

    // Administration
    ADMIN_CLIENT_REGISTER,
    ADMIN_CLIENT_UPDATE,
    ADMIN_CLIENT_DISABLE,
    ADMIN_USER_REGISTER,
    ADMIN_VENDOR_CREATE,
    ADMIN_VENDOR_KEY_ISSUE,
    ADMIN_VENDOR_KEY_REVOKE
}
