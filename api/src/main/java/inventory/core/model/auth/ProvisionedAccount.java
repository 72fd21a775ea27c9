package inventory.core.model.auth;

/**
 * A newly created account together with its one-time plaintext credentials.
 *
 * @param account        the stored account
 * @param password       generated password, never stored in plaintext
 * @param base64Encoded  base64 of {@code username:password}, ready for a Basic header
 */
public record ProvisionedAccount(Account account, String password, String base64Encoded) {

    @Override
    public String toString() {
        return "ProvisionedAccount[account=" + account.id() + ", password=***]";
    }
}
