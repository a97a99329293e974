package io.dataflow.nats;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * How the connector authenticates to the NATS server.
 *
 * <p>Exactly one mechanism is used per connection:
 *
 * <pre>{@code
 * Auth.none();
 * Auth.token("s3cr3t");
 * Auth.userPassword("svc", "pw");
 * Auth.credentialsFile("/etc/nats/svc.creds");
 * }</pre>
 */
public final class Auth {

  /** The authentication mechanism. */
  public enum Kind {
    NONE,
    TOKEN,
    USER_PASSWORD,
    CREDENTIALS_FILE
  }

  private static final Auth NONE = new Auth(Kind.NONE, null, null, null, null);

  private final Kind kind;
  private final String token;
  private final String user;
  private final String password;
  private final String credentialsFile;

  private Auth(Kind kind, String token, String user, String password, String credentialsFile) {
    this.kind = kind;
    this.token = token;
    this.user = user;
    this.password = password;
    this.credentialsFile = credentialsFile;
  }

  @Nonnull
  public static Auth none() {
    return NONE;
  }

  @Nonnull
  public static Auth token(@Nonnull String token) {
    return new Auth(
        Kind.TOKEN, Objects.requireNonNull(token, "token cannot be null"), null, null, null);
  }

  @Nonnull
  public static Auth userPassword(@Nonnull String user, @Nonnull String password) {
    return new Auth(
        Kind.USER_PASSWORD,
        null,
        Objects.requireNonNull(user, "user cannot be null"),
        Objects.requireNonNull(password, "password cannot be null"),
        null);
  }

  /**
   * Authenticates with a NATS credentials file holding a user JWT and NKey seed.
   *
   * @param path path to the {@code .creds} file
   * @return the auth settings
   */
  @Nonnull
  public static Auth credentialsFile(@Nonnull String path) {
    return new Auth(
        Kind.CREDENTIALS_FILE, null, null, null, Objects.requireNonNull(path, "path cannot be null"));
  }

  public Kind kind() {
    return kind;
  }

  public Optional<String> token() {
    return Optional.ofNullable(token);
  }

  public Optional<String> user() {
    return Optional.ofNullable(user);
  }

  public Optional<String> password() {
    return Optional.ofNullable(password);
  }

  public Optional<String> credentialsFile() {
    return Optional.ofNullable(credentialsFile);
  }

  @Override
  public String toString() {
    // Secrets stay out of logs.
    return "Auth{" + kind + "}";
  }
}
