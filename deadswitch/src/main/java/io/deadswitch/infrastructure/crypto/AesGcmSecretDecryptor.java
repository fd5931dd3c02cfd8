package io.deadswitch.infrastructure.crypto;

import io.deadswitch.application.port.output.SecretDecryptor;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * AES/GCM decryption of stored server shares.
 *
 * Ciphertext, IV and auth tag are stored base64-encoded in separate columns;
 * the tag is appended to the ciphertext before decryption.
 */
public final class AesGcmSecretDecryptor implements SecretDecryptor {
    private static final int GCM_TAG_BITS = 128;

    private final SecretKeySpec key;

    /**
     * @param base64Key 16, 24 or 32 byte AES key, base64
     */
    public AesGcmSecretDecryptor(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalArgumentException("Encryption key is required");
        }
        byte[] raw = Base64.getDecoder().decode(base64Key.trim());
        if (raw.length != 16 && raw.length != 24 && raw.length != 32) {
            throw new IllegalArgumentException("Encryption key must be 16, 24 or 32 bytes, got " + raw.length);
        }
        this.key = new SecretKeySpec(raw, "AES");
    }

    @Override
    public String decrypt(String serverShare, String iv, String authTag) {
        try {
            byte[] cipherText = Base64.getDecoder().decode(serverShare);
            byte[] tag = Base64.getDecoder().decode(authTag);
            byte[] combined = new byte[cipherText.length + tag.length];
            System.arraycopy(cipherText, 0, combined, 0, cipherText.length);
            System.arraycopy(tag, 0, combined, cipherText.length, tag.length);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, Base64.getDecoder().decode(iv)));
            return new String(cipher.doFinal(combined), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to decrypt server share", e);
        }
    }
}
