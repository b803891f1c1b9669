package com.gentoro.contextmcp.identity;

import com.gentoro.contextmcp.audit.AuditService;
import com.gentoro.contextmcp.audit.ChangeKind;
import com.gentoro.contextmcp.exception.AlreadyExistsException;
import com.gentoro.contextmcp.exception.NotFoundException;
import com.gentoro.contextmcp.exception.StateException;
import com.gentoro.contextmcp.exception.StoreException;
import com.gentoro.contextmcp.exception.ValidationException;
import com.gentoro.contextmcp.store.Row;
import com.gentoro.contextmcp.store.StoreGateway;
import com.gentoro.contextmcp.utility.HashUtility;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Resolves credentials to users and manages the credential lifecycle.
 *
 * <p>Two credential forms are accepted: an API key, matched by its SHA-256 digest, and a signed
 * JWT whose subject is the user id. Only digests and BCrypt hashes are ever stored.
 */
public class IdentityService {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(IdentityService.class);

  static final String USER_COLUMNS =
      "id, username, email, role, is_active, last_login, created_at";

  private final StoreGateway store;
  private final AuditService audit;
  private final Clock clock;
  private final SecuritySettings settings;
  private final PasswordEncoder passwordEncoder;
  private final SecretKey jwtKey;
  private final SecureRandom random = new SecureRandom();

  public IdentityService(
      StoreGateway store, AuditService audit, Clock clock, SecuritySettings settings) {
    this.store = store;
    this.audit = audit;
    this.clock = clock;
    this.settings = settings;
    this.passwordEncoder = new BCryptPasswordEncoder(settings.bcryptStrength());
    this.jwtKey =
        settings.jwtEnabled()
            ? Keys.hmacShaKeyFor(settings.jwtSecret().getBytes(StandardCharsets.UTF_8))
            : null;
  }

  /**
   * Resolve a credential to an active user. Unknown, malformed or expired credentials yield empty
   * and emit a security event; store failures propagate.
   */
  public Optional<User> authenticate(String credential) {
    if (credential == null || credential.isBlank()) {
      return Optional.empty();
    }
    String token = credential.trim();
    if (token.regionMatches(true, 0, "Bearer ", 0, 7)) {
      token = token.substring(7).trim();
    }

    Optional<User> user = looksLikeJwt(token) ? fromJwt(token) : fromApiKey(token);
    user.ifPresent(
        u -> store.update("UPDATE users SET last_login = ? WHERE id = ?", now(), u.id()));
    return user;
  }

  /** Sign a JWT for the user, valid for the configured time to live. */
  public String issueToken(User user) {
    if (jwtKey == null) {
      throw new StateException("JWT credentials are disabled; set security.jwt.secret");
    }
    Instant issuedAt = now();
    return Jwts.builder()
        .subject(user.id().toString())
        .claim("role", user.role().wireName())
        .issuedAt(Date.from(issuedAt))
        .expiration(Date.from(issuedAt.plus(settings.jwtTtl())))
        .signWith(jwtKey)
        .compact();
  }

  /** Register a user. The password is optional for API-key only accounts. */
  public User createUser(String username, String email, String password, Role role, UUID actor) {
    if (username == null || username.isBlank()) {
      throw new ValidationException("username is required");
    }
    if (email == null || !email.contains("@")) throw new ValidationException("email is invalid");
    Role effectiveRole = role == null ? Role.USER : role;
    UUID id = UUID.randomUUID();
    Instant now = now();
    String passwordHash = password == null ? null : passwordEncoder.encode(password);
    try {
      return store.withTransaction(
          actor,
          h -> {
            h.update(
                "INSERT INTO users (id, username, email, password_hash, role, is_active,"
                    + " failed_login_attempts, created_at, updated_at)"
                    + " VALUES (?, ?, ?, ?, ?, TRUE, 0, ?, ?)",
                id,
                username.trim(),
                email.trim(),
                passwordHash,
                effectiveRole,
                now,
                now);
            User created = toUser(h.queryOne(selectUser("id = ?"), id).orElseThrow());
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("username", created.username());
            values.put("email", created.email());
            values.put("role", created.role().wireName());
            audit.recordDataChange(
                h, "user", ChangeKind.CREATE, id.toString(), actor, null, values);
            return created;
          });
    } catch (StoreException e) {
      if (e.isUniqueViolation()) {
        throw new AlreadyExistsException(
            "A user with this username or email already exists", Map.of("username", username));
      }
      throw e;
    }
  }

  /** Issue a fresh API key, replacing any previous one. The raw key is returned exactly once. */
  public String generateApiKey(UUID userId) {
    byte[] bytes = new byte[32];
    random.nextBytes(bytes);
    String apiKey = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    int updated =
        store.update(
            "UPDATE users SET api_key_hash = ?, updated_at = ? WHERE id = ? AND is_active = TRUE",
            HashUtility.sha256Hex(apiKey),
            now(),
            userId);
    if (updated == 0) throw new NotFoundException("User not found: " + userId);
    audit.logSecurityEvent("api_key_rotated", userId, Map.of("user_id", userId.toString()));
    return apiKey;
  }

  public void revokeApiKey(UUID userId) {
    int updated =
        store.update(
            "UPDATE users SET api_key_hash = NULL, updated_at = ? WHERE id = ?"
                + " AND is_active = TRUE",
            now(),
            userId);
    if (updated == 0) throw new NotFoundException("User not found: " + userId);
    audit.logSecurityEvent("api_key_revoked", userId, Map.of("user_id", userId.toString()));
  }

  /** Soft-deactivate; the user row is kept for the audit trail. */
  public void deactivateUser(UUID userId, UUID actor) {
    store.withTransaction(
        actor,
        h -> {
          int updated =
              h.update(
                  "UPDATE users SET is_active = FALSE, updated_at = ? WHERE id = ?"
                      + " AND is_active = TRUE",
                  now(),
                  userId);
          if (updated == 0) throw new NotFoundException("User not found: " + userId);
          audit.recordDataChange(
              h,
              "user",
              ChangeKind.DELETE,
              userId.toString(),
              actor,
              Map.of("is_active", true),
              Map.of("is_active", false));
          return updated;
        });
  }

  /**
   * Check a password and drive the lockout state machine. A locked account fails without looking
   * at the hash; reaching the attempt limit locks the account; a success resets the counter. An
   * expired lock restarts the count from zero.
   */
  public boolean validatePassword(UUID userId, String password) {
    Optional<Row> found =
        store.execute(
                "SELECT id, password_hash, failed_login_attempts, locked_until FROM users"
                    + " WHERE id = ? AND is_active = TRUE",
                userId)
            .stream()
            .findFirst();
    if (found.isEmpty()) return false;
    Row row = found.get();
    Instant now = now();
    Instant lockedUntil = row.getInstant("locked_until");
    int attempts = row.getInt("failed_login_attempts");

    if (lockedUntil != null && now.isBefore(lockedUntil)) {
      audit.logSecurityEvent(
          "account_locked_attempt",
          userId,
          Map.of("user_id", userId.toString(), "locked_until", lockedUntil.toString()));
      return false;
    }
    if (lockedUntil != null) {
      attempts = 0;
    }

    String hash = row.getString("password_hash");
    boolean matches = password != null && hash != null && passwordEncoder.matches(password, hash);
    if (matches) {
      store.update(
          "UPDATE users SET failed_login_attempts = 0, locked_until = NULL, last_login = ?"
              + " WHERE id = ?",
          now,
          userId);
      return true;
    }

    attempts++;
    if (attempts >= settings.maxFailedAttempts()) {
      Instant until = now.plus(settings.lockoutDuration());
      store.update(
          "UPDATE users SET failed_login_attempts = ?, locked_until = ? WHERE id = ?",
          attempts,
          until,
          userId);
      audit.logSecurityEvent(
          "account_locked",
          userId,
          Map.of(
              "user_id", userId.toString(),
              "attempts", attempts,
              "locked_until", until.toString()));
    } else {
      store.update(
          "UPDATE users SET failed_login_attempts = ?, locked_until = NULL WHERE id = ?",
          attempts,
          userId);
    }
    return false;
  }

  /**
   * Return the active account that unauthenticated requests run as when authentication is
   * disabled, creating it as an admin on first use.
   */
  public User ensureServiceUser(String username) {
    Optional<User> existing = findByUsername(username);
    if (existing.isPresent()) {
      if (!existing.get().active()) {
        throw new StateException("Service user '" + username + "' is deactivated");
      }
      return existing.get();
    }
    log.info("Creating service user '{}'", username);
    return createUser(username, username + "@localhost", null, Role.ADMIN, null);
  }

  public Optional<User> findActiveUser(UUID userId) {
    if (userId == null) return Optional.empty();
    return store.execute(selectUser("id = ? AND is_active = TRUE"), userId).stream()
        .findFirst()
        .map(IdentityService::toUser);
  }

  public Optional<User> findByUsername(String username) {
    return store.execute(selectUser("username = ?"), username).stream()
        .findFirst()
        .map(IdentityService::toUser);
  }

  private Optional<User> fromApiKey(String apiKey) {
    List<Row> rows =
        store.execute(
            selectUser("api_key_hash = ? AND is_active = TRUE"), HashUtility.sha256Hex(apiKey));
    if (rows.isEmpty()) {
      audit.logSecurityEvent("invalid_api_key", null, Map.of("key_prefix", prefix(apiKey)));
      return Optional.empty();
    }
    return Optional.of(toUser(rows.get(0)));
  }

  private Optional<User> fromJwt(String token) {
    if (jwtKey == null) {
      audit.logSecurityEvent("invalid_jwt_token", null, Map.of("reason", "jwt disabled"));
      return Optional.empty();
    }
    UUID subject;
    try {
      String sub =
          Jwts.parser()
              .verifyWith(jwtKey)
              .clock(() -> Date.from(now()))
              .build()
              .parseSignedClaims(token)
              .getPayload()
              .getSubject();
      if (sub == null) throw new JwtException("token has no subject");
      subject = UUID.fromString(sub);
    } catch (JwtException | IllegalArgumentException e) {
      log.debug("Rejected JWT credential: {}", e.getMessage());
      audit.logSecurityEvent(
          "invalid_jwt_token", null, Map.of("reason", e.getClass().getSimpleName()));
      return Optional.empty();
    }
    Optional<User> user = findActiveUser(subject);
    if (user.isEmpty()) {
      audit.logSecurityEvent(
          "invalid_jwt_token", null, Map.of("reason", "unknown or inactive subject"));
    }
    return user;
  }

  private static boolean looksLikeJwt(String token) {
    return token.chars().filter(c -> c == '.').count() == 2;
  }

  private static String prefix(String apiKey) {
    return apiKey.length() <= 8 ? "***" : apiKey.substring(0, 8) + "...";
  }

  static String selectUser(String predicate) {
    return "SELECT " + USER_COLUMNS + " FROM users WHERE " + predicate;
  }

  static User toUser(Row r) {
    return new User(
        r.getUuid("id"),
        r.getString("username"),
        r.getString("email"),
        Role.fromString(r.getString("role")),
        r.getBoolean("is_active"),
        r.getInstant("last_login"),
        r.getInstant("created_at"));
  }

  private Instant now() {
    return clock.instant();
  }
}
