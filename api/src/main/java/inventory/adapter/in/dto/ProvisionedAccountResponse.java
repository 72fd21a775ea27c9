package inventory.adapter.in.dto;

import java.time.Instant;
import java.util.List;

import inventory.core.model.auth.ProvisionedAccount;

/**
 * Response for account provisioning. The password and Basic string are only ever returned here.
 *
 * @param id                 account identifier
 * @param userName           login name
 * @param email              contact address
 * @param name               display name
 * @param password           generated plaintext password
 * @param apiKey             API key for the {@code ApiKey} header
 * @param base64Encoded      ready-made value for {@code Authorization: Basic}
 * @param allowedIpAddresses address restriction, null when unrestricted
 * @param roles              assigned role names
 * @param createdDate        creation instant
 * @param expiryDate         expiry instant
 */
public record ProvisionedAccountResponse(
        String id,
        String userName,
        String email,
        String name,
        String password,
        String apiKey,
        String base64Encoded,
        String allowedIpAddresses,
        List<String> roles,
        Instant createdDate,
        Instant expiryDate) {

    public static ProvisionedAccountResponse from(ProvisionedAccount provisioned) {
        final var account = provisioned.account();
        return new ProvisionedAccountResponse(
                account.id(),
                account.username(),
                account.email(),
                account.name(),
                provisioned.password(),
                account.apiKey(),
                provisioned.base64Encoded(),
                account.allowedIpAddresses(),
                account.roles(),
                account.createdAt(),
                account.expiresAt());
    }
}
