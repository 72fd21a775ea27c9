package inventory.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import inventory.core.model.auth.Account;
import inventory.core.model.auth.ProvisionedAccount;
import inventory.core.model.auth.RoleType;

/**
 * Port for creating and inspecting accounts.
 */
public interface AccountManagement {

    /**
     * Create an account with generated credentials.
     *
     * @param roleType      role assigned to the account
     * @param remoteIp      address of the requesting client
     * @param restrictIp    limit the account to {@code remoteIp}
     * @param restrictRange limit the account to the /24 range of {@code remoteIp}
     * @return Uni with the account and its one-time plaintext credentials
     */
    Uni<ProvisionedAccount> provision(RoleType roleType, String remoteIp, boolean restrictIp, boolean restrictRange);

    Uni<Optional<Account>> get(String id);

    /**
     * Role names of the account that exist in the role store, in account order.
     */
    Uni<List<String>> effectiveRoles(Account account);
}
