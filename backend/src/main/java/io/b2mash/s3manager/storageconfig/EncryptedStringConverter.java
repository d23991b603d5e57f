package io.b2mash.s3manager.storageconfig;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.stereotype.Component;

/** Encrypts a string column on write and decrypts it on read. Hibernate resolves it via Spring. */
@Component
@Converter
public class EncryptedStringConverter implements AttributeConverter<String, String> {

  private final SecretCipher secretCipher;

  public EncryptedStringConverter(SecretCipher secretCipher) {
    this.secretCipher = secretCipher;
  }

  @Override
  public String convertToDatabaseColumn(String attribute) {
    return attribute == null ? null : secretCipher.encrypt(attribute);
  }

  @Override
  public String convertToEntityAttribute(String dbData) {
    return dbData == null ? null : secretCipher.decrypt(dbData);
  }
}
