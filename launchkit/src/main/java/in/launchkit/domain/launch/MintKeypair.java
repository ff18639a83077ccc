package in.launchkit.domain.launch;

import in.launchkit.util.Base58;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.EdECPrivateKey;
import java.util.Arrays;

/**
 * Single-use Ed25519 keypair for a new token mint, base58 encoded.
 *
 * The secret key follows the Solana layout: 32-byte seed followed by the 32-byte public key.
 */
public record MintKeypair(String publicKey, String secretKey) {

    public static final int PUBLIC_KEY_BYTES = 32;
    public static final int SECRET_KEY_BYTES = 64;

    public static MintKeypair generate() {
        try {
            KeyPair pair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
            byte[] seed = ((EdECPrivateKey) pair.getPrivate()).getBytes()
                .orElseThrow(() -> new IllegalStateException("Ed25519 private key has no raw encoding"));

            // X.509 SubjectPublicKeyInfo: fixed 12-byte prefix, raw key in the last 32 bytes
            byte[] encoded = pair.getPublic().getEncoded();
            byte[] publicKey = Arrays.copyOfRange(encoded, encoded.length - PUBLIC_KEY_BYTES, encoded.length);

            byte[] secret = new byte[SECRET_KEY_BYTES];
            System.arraycopy(seed, 0, secret, 0, PUBLIC_KEY_BYTES);
            System.arraycopy(publicKey, 0, secret, PUBLIC_KEY_BYTES, PUBLIC_KEY_BYTES);

            return new MintKeypair(Base58.encode(publicKey), Base58.encode(secret));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 unavailable", e);
        }
    }

    @Override
    public String toString() {
        return "MintKeypair[publicKey=" + publicKey + ", secretKey=****]";
    }
}
