package io.deadswitch.application.port.output;

/**
 * Decrypts a stored server share.
 */
public interface SecretDecryptor {

    /**
     * @throws IllegalStateException if the share cannot be decrypted
     */
    String decrypt(String serverShare, String iv, String authTag);
}
