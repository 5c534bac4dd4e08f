package com.example.secretsmanager.core.crypto;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.secretsmanager.core.exception.EncryptionException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Authenticated encryption of secret values with AES-256-GCM.
 *
 * <p>Ciphertext is rendered as {@code enc:v1:<keyId>:<base64(iv || ciphertext || tag)>}. The key
 * id is bound as additional authenticated data, so moving a ciphertext under another key id fails
 * authentication. The current key encrypts; keys retired by {@link #rotateKey()} remain available
 * for decryption.
 *
 * <p>Key material is read from {@code secrets.encryption.key} / {@code SECRETS_ENCRYPTION_KEY} as
 * the Base64 encoding of 32 bytes.
 */
public class EncryptionService {

  private static final System.Logger LOGGER = System.getLogger(EncryptionService.class.getName());

  static final String PREFIX = "enc:v1:";
  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int KEY_LENGTH = 32;
  private static final int IV_LENGTH = 12;
  private static final int TAG_LENGTH_BITS = 128;

  private final SecureRandom secureRandom = new SecureRandom();
  private final Map<String, SecretKeySpec> keyRing = new ConcurrentHashMap<>();
  private final List<KeyRotationListener> listeners = new CopyOnWriteArrayList<>();
  private volatile String currentKeyId;

  /**
   * Creates a service whose current key is {@code key}.
   *
   * @param key 32 raw key bytes
   * @throws IllegalStateException if the key is not 32 bytes long
   */
  public EncryptionService(final byte[] key) {
    this.currentKeyId = install(key);
  }

  /**
   * Creates a service from a Base64 encoded key.
   *
   * @throws IllegalStateException if the key is missing, not Base64 or not 32 bytes long
   */
  public static EncryptionService fromBase64(final String base64Key) {
    return new EncryptionService(decodeKey(base64Key));
  }

  /**
   * Creates a service from {@code secrets.encryption.key} / {@code SECRETS_ENCRYPTION_KEY}.
   *
   * @throws IllegalStateException if no valid key is configured
   */
  public static EncryptionService fromSystemProperties() {
    final var key =
        Optional.ofNullable(System.getProperty("secrets.encryption.key"))
            .or(() -> Optional.ofNullable(System.getenv("SECRETS_ENCRYPTION_KEY")))
            .filter(val -> !val.isBlank())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Encryption is enabled but secrets.encryption.key / SECRETS_ENCRYPTION_KEY"
                            + " is not set"));
    return fromBase64(key);
  }

  /** Generates a random Base64 encoded 256-bit key. */
  public static String generateKey() {
    final var bytes = new byte[KEY_LENGTH];
    new SecureRandom().nextBytes(bytes);
    return Base64.getEncoder().encodeToString(bytes);
  }

  public void addListener(final KeyRotationListener listener) {
    listeners.add(listener);
  }

  public void removeListener(final KeyRotationListener listener) {
    listeners.remove(listener);
  }

  /** Id of the key used for new ciphertext. */
  public String currentKeyId() {
    return currentKeyId;
  }

  /**
   * Adds a retired key so ciphertext produced under it stays readable.
   *
   * @return id of the added key
   */
  public String addDecryptionKey(final String base64Key) {
    return install(decodeKey(base64Key));
  }

  /** Whether the value carries the ciphertext prefix. */
  public boolean isEncrypted(final String value) {
    return value != null && value.startsWith(PREFIX);
  }

  /**
   * Encrypts under the current key.
   *
   * @throws EncryptionException if the cipher fails
   */
  public String encrypt(final String plaintext) {
    if (plaintext == null) throw new EncryptionException("Cannot encrypt a null value");
    final var keyId = currentKeyId;
    final var iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      final var cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(
          Cipher.ENCRYPT_MODE, keyRing.get(keyId), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
      cipher.updateAAD(keyId.getBytes(StandardCharsets.UTF_8));
      final var sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      final var payload = ByteBuffer.allocate(iv.length + sealed.length).put(iv).put(sealed);
      return PREFIX + keyId + ":" + Base64.getEncoder().encodeToString(payload.array());
    } catch (final GeneralSecurityException e) {
      throw new EncryptionException("Encryption failed", e);
    }
  }

  /**
   * Decrypts and authenticates a value produced by {@link #encrypt}.
   *
   * @throws EncryptionException on malformed input, unknown key or failed authentication
   */
  public String decrypt(final String ciphertext) {
    if (!isEncrypted(ciphertext))
      throw new EncryptionException("Value is not in the expected ciphertext format");
    final var rest = ciphertext.substring(PREFIX.length());
    final var separator = rest.indexOf(':');
    if (separator <= 0) throw new EncryptionException("Ciphertext is missing its key id");
    final var keyId = rest.substring(0, separator);
    final var key = keyRing.get(keyId);
    if (key == null) throw new EncryptionException("Unknown encryption key: " + keyId);

    final var encoded = rest.substring(separator + 1);
    final byte[] payload;
    try {
      payload = Base64.getDecoder().decode(encoded);
    } catch (final IllegalArgumentException e) {
      throw new EncryptionException("Ciphertext is not valid Base64", e);
    }
    // The decoder ignores the unused low bits of the last character; only the canonical
    // encoding is accepted so that every changed bit is detected.
    if (!Base64.getEncoder().encodeToString(payload).equals(encoded))
      throw new EncryptionException("Ciphertext is not canonical Base64");
    if (payload.length < IV_LENGTH + TAG_LENGTH_BITS / 8)
      throw new EncryptionException("Ciphertext is truncated");

    try {
      final var cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(
          Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, payload, 0, IV_LENGTH));
      cipher.updateAAD(keyId.getBytes(StandardCharsets.UTF_8));
      final var plain = cipher.doFinal(payload, IV_LENGTH, payload.length - IV_LENGTH);
      return new String(plain, StandardCharsets.UTF_8);
    } catch (final AEADBadTagException e) {
      throw new EncryptionException("Ciphertext failed authentication", e);
    } catch (final GeneralSecurityException e) {
      throw new EncryptionException("Decryption failed", e);
    }
  }

  /** Installs a freshly generated key as current. */
  public String rotateKey() {
    return rotateKey(generateKey());
  }

  /**
   * Installs {@code base64Key} as the current key and notifies listeners. The previous key stays
   * in the ring for decryption.
   *
   * @return id of the new current key
   */
  public String rotateKey(final String base64Key) {
    final var keyId = install(decodeKey(base64Key));
    final var previous = currentKeyId;
    currentKeyId = keyId;
    LOGGER.log(INFO, "Encryption key rotated from {0} to {1}", previous, keyId);
    for (final var listener : listeners) {
      try {
        listener.onKeyRotated(keyId);
      } catch (final RuntimeException e) {
        LOGGER.log(ERROR, "Key rotation listener failed", e);
      }
    }
    return keyId;
  }

  private String install(final byte[] key) {
    if (key == null || key.length != KEY_LENGTH)
      throw new IllegalStateException(
          "Encryption key must be a 256-bit (32-byte) key. Got "
              + (key == null ? 0 : key.length)
              + " bytes.");
    final var keyId = fingerprint(key);
    keyRing.put(keyId, new SecretKeySpec(key, "AES"));
    return keyId;
  }

  private static byte[] decodeKey(final String base64Key) {
    if (base64Key == null || base64Key.isBlank())
      throw new IllegalStateException("Encryption key is not set");
    try {
      return Base64.getDecoder().decode(base64Key.trim());
    } catch (final IllegalArgumentException e) {
      throw new IllegalStateException("Encryption key must be Base64 encoded", e);
    }
  }

  private static String fingerprint(final byte[] key) {
    try {
      final var digest = MessageDigest.getInstance("SHA-256").digest(key);
      return "k" + HexFormat.of().formatHex(digest, 0, 4);
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
