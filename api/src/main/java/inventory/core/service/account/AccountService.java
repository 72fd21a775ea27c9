package inventory.core.service.account;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import inventory.core.model.auth.Account;
import inventory.core.model.auth.AccountLookupException;
import inventory.core.model.auth.Credential;
import inventory.core.model.auth.IpRestriction;
import inventory.core.model.auth.ProvisionedAccount;
import inventory.core.model.auth.RoleType;
import inventory.core.port.in.AccountManagement;
import inventory.core.port.in.AccountResolver;
import inventory.core.port.in.RoleManagement;
import inventory.core.port.out.AccountRepository;
import inventory.core.port.out.PasswordHasher;
import inventory.core.port.out.RoleRepository;

/**
 * Resolves credentials to accounts and provisions new accounts.
 *
 * <p>Password hashing and verification run on the worker pool.
 */
@ApplicationScoped
public class AccountService implements AccountResolver, AccountManagement {

    private static final Logger LOG = Logger.getLogger(AccountService.class);

    static final String NOT_FOUND_MESSAGE = "Invalid credentials or account not found";
    static final String LOOPBACK = "127.0.0.1";

    private final AccountRepository accounts;
    private final RoleRepository roles;
    private final RoleManagement roleManagement;
    private final PasswordHasher passwordHasher;
    private final CredentialGenerator generator;
    private final Clock clock;

    @Inject
    public AccountService(
            AccountRepository accounts,
            RoleRepository roles,
            RoleManagement roleManagement,
            PasswordHasher passwordHasher,
            CredentialGenerator generator) {
        this(accounts, roles, roleManagement, passwordHasher, generator, Clock.systemUTC());
    }

    public AccountService(
            AccountRepository accounts,
            RoleRepository roles,
            RoleManagement roleManagement,
            PasswordHasher passwordHasher,
            CredentialGenerator generator,
            Clock clock) {
        this.accounts = accounts;
        this.roles = roles;
        this.roleManagement = roleManagement;
        this.passwordHasher = passwordHasher;
        this.generator = generator;
        this.clock = clock;
    }

    @Override
    public Uni<Account> resolve(Credential credential, String remoteIp) {
        final Uni<Optional<Account>> lookup;
        if (credential instanceof Credential.ApiKey apiKey) {
            lookup = accounts.findByApiKey(apiKey.key());
        } else if (credential instanceof Credential.Basic basic) {
            lookup = accounts.findByUsername(basic.username())
                    .flatMap(found -> verifyPassword(found, basic.password()));
        } else {
            lookup = Uni.createFrom().item(Optional.empty());
        }

        return lookup.map(found -> {
            final var account = found.filter(a -> !a.isExpired(clock.instant()))
                    .orElseThrow(() -> new AccountLookupException(NOT_FOUND_MESSAGE));
            if (!account.permitsAddress(remoteIp)) {
                LOG.infov("Rejected account {0} from address {1}", account.id(), remoteIp);
                throw new AccountLookupException("Unauthorized request for IP Address " + remoteIp);
            }
            return account;
        });
    }

    private Uni<Optional<Account>> verifyPassword(Optional<Account> account, String password) {
        if (account.isEmpty() || account.get().passwordHash() == null) {
            return Uni.createFrom().item(Optional.empty());
        }
        return Uni.createFrom()
                .item(() -> passwordHasher.verify(password, account.get().passwordHash()))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .map(matches -> matches ? account : Optional.empty());
    }

    @Override
    public Uni<ProvisionedAccount> provision(
            RoleType roleType, String remoteIp, boolean restrictIp, boolean restrictRange) {
        final var type = roleType == null ? RoleType.USER : roleType;
        final String allowed;
        try {
            allowed = allowedAddresses(remoteIp, restrictIp, restrictRange);
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(e);
        }

        final var seed = UUID.randomUUID();
        final var displayName = generator.randomName();
        final var username = generator.usernameFor(displayName, seed);
        final var password = generator.password();
        final var now = clock.instant();

        return roleManagement
                .ensureRole(type)
                .flatMap(role -> Uni.createFrom()
                        .item(() -> passwordHasher.hash(password))
                        .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                        .map(hash -> Account.builder(seed.toString(), username)
                                .name(displayName)
                                .email(username + "@example.com")
                                .passwordHash(hash)
                                .apiKey(generator.apiKey(seed))
                                .allowedIpAddresses(allowed)
                                .createdAt(now)
                                .expiresAt(now.plus(Account.DEFAULT_LIFETIME))
                                .role(role.name())
                                .build()))
                .flatMap(account -> accounts.save(account).replaceWith(account))
                .map(account -> {
                    LOG.infov("Provisioned account {0} with role {1}", account.username(), type.roleName());
                    return new ProvisionedAccount(
                            account, password, CredentialGenerator.basicCredentials(username, password));
                });
    }

    static String allowedAddresses(String remoteIp, boolean restrictIp, boolean restrictRange) {
        if (!(restrictIp || restrictRange) || remoteIp == null || remoteIp.isBlank()) {
            return null;
        }
        final var normalized = IpRestriction.normalize(remoteIp);
        if (LOOPBACK.equals(normalized) || "::1".equals(normalized)) {
            return null;
        }
        return restrictRange ? IpRestriction.subnetRange(normalized) : IpRestriction.single(normalized);
    }

    @Override
    public Uni<Optional<Account>> get(String id) {
        return accounts.findById(id);
    }

    @Override
    public Uni<List<String>> effectiveRoles(Account account) {
        return roles.findAll().map(existing -> account.roles().stream()
                .filter(name -> existing.stream().anyMatch(role -> role.name().equalsIgnoreCase(name)))
                .toList());
    }
}
