package io.b2mash.s3manager.storageconfig;

import io.b2mash.s3manager.config.StorageProperties;
import jakarta.annotation.PostConstruct;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * AES-GCM encryption for credentials stored at rest. The encoded form is Base64 of the 12-byte IV
 * followed by the ciphertext and tag.
 */
@Component
public class SecretCipher {

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128; // bits
  private static final int IV_LENGTH = 12; // bytes (96 bits)

  private final SecretKeySpec encryptionKey;
  private final SecureRandom secureRandom = new SecureRandom();

  public SecretCipher(StorageProperties properties) {
    String encodedKey = properties.encryptionKey();
    if (encodedKey == null || encodedKey.isBlank()) {
      this.encryptionKey = null; // Will fail at @PostConstruct
    } else {
      byte[] keyBytes = Base64.getDecoder().decode(encodedKey.trim());
      this.encryptionKey = new SecretKeySpec(keyBytes, "AES");
    }
  }

  @PostConstruct
  void validateKey() {
    if (encryptionKey == null) {
      throw new IllegalStateException(
          "storage.encryption-key is not set. "
              + "Cannot start without an encryption key for stored credentials.");
    }
    if (encryptionKey.getEncoded().length != 32) {
      throw new IllegalStateException(
          "storage.encryption-key must be a Base64-encoded 256-bit (32-byte) key. Got "
              + encryptionKey.getEncoded().length
              + " bytes.");
    }
  }

  public String encrypt(String plaintext) {
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    byte[] ciphertext = apply(Cipher.ENCRYPT_MODE, iv, plaintext.getBytes(StandardCharsets.UTF_8));
    byte[] payload =
        ByteBuffer.allocate(iv.length + ciphertext.length).put(iv).put(ciphertext).array();
    return Base64.getEncoder().encodeToString(payload);
  }

  public String decrypt(String encoded) {
    byte[] payload = Base64.getDecoder().decode(encoded);
    if (payload.length <= IV_LENGTH) {
      throw new IllegalStateException("Stored secret is truncated");
    }
    var buffer = ByteBuffer.wrap(payload);
    byte[] iv = new byte[IV_LENGTH];
    buffer.get(iv);
    byte[] ciphertext = new byte[buffer.remaining()];
    buffer.get(ciphertext);
    return new String(apply(Cipher.DECRYPT_MODE, iv, ciphertext), StandardCharsets.UTF_8);
  }

  private byte[] apply(int mode, byte[] iv, byte[] input) {
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(mode, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return cipher.doFinal(input);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(
          mode == Cipher.ENCRYPT_MODE ? "Encryption failed" : "Decryption failed", e);
    }
  }
}
