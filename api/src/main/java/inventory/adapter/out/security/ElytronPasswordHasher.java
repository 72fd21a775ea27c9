package inventory.adapter.out.security;

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.wildfly.security.password.PasswordFactory;
import org.wildfly.security.password.WildFlyElytronPasswordProvider;
import org.wildfly.security.password.interfaces.BCryptPassword;
import org.wildfly.security.password.spec.EncryptablePasswordSpec;
import org.wildfly.security.password.spec.IteratedSaltedPasswordAlgorithmSpec;
import org.wildfly.security.password.util.ModularCrypt;

import inventory.core.port.out.PasswordHasher;

/**
 * BCrypt password hashing backed by WildFly Elytron, stored in Modular Crypt Format.
 */
@ApplicationScoped
public class ElytronPasswordHasher implements PasswordHasher {

    private static final Logger LOG = Logger.getLogger(ElytronPasswordHasher.class);

    static final int ITERATION_COUNT = 10;

    private static final WildFlyElytronPasswordProvider PROVIDER = WildFlyElytronPasswordProvider.getInstance();

    private final SecureRandom random = new SecureRandom();

    @Override
    public String hash(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be empty");
        }
        try {
            final var factory = PasswordFactory.getInstance(BCryptPassword.ALGORITHM_BCRYPT, PROVIDER);
            final var salt = new byte[BCryptPassword.BCRYPT_SALT_SIZE];
            random.nextBytes(salt);
            final var spec = new EncryptablePasswordSpec(
                    plainPassword.toCharArray(), new IteratedSaltedPasswordAlgorithmSpec(ITERATION_COUNT, salt));
            final var password = (BCryptPassword) factory.generatePassword(spec);
            return ModularCrypt.encodeAsString(password);
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalStateException("Failed to hash password", e);
        }
    }

    @Override
    public boolean verify(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }
        try {
            final var factory = PasswordFactory.getInstance(BCryptPassword.ALGORITHM_BCRYPT, PROVIDER);
            final var stored = factory.translate(ModularCrypt.decode(passwordHash));
            return factory.verify(stored, plainPassword.toCharArray());
        } catch (NoSuchAlgorithmException | InvalidKeySpecException | InvalidKeyException e) {
            LOG.debugv("Password hash could not be verified: {0}", e.getMessage());
            return false;
        }
    }
}
