package inventory.core.port.out;

/**
 * One-way password hashing. Implementations are CPU bound and blocking.
 */
public interface PasswordHasher {

    String hash(String plainPassword);

    boolean verify(String plainPassword, String passwordHash);
}
