package inventory.core.port.in;

import io.smallrye.mutiny.Uni;

import inventory.core.model.auth.Account;
import inventory.core.model.auth.Credential;

/**
 * Resolves presented credentials to an account.
 */
public interface AccountResolver {

    /**
     * Resolve a credential for a request from {@code remoteIp}.
     *
     * <p>Fails with {@link inventory.core.model.auth.AccountLookupException} when the
     * credential matches no live account or the account does not allow the address.
     */
    Uni<Account> resolve(Credential credential, String remoteIp);
}
