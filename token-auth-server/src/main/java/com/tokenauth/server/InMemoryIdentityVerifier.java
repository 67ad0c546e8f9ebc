package com.tokenauth.server;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.tokenauth.Principal;
import lombok.AllArgsConstructor;

@AllArgsConstructor
public class InMemoryIdentityVerifier implements IdentityVerifier {

    public record Account(String subjectId, String secret, Set<String> scopes) {}

    // compared against when the identifier is unknown so both paths do the same work
    private static final String NO_ACCOUNT_SECRET = "no-account-placeholder-secret";

    private final Map<String, Account> accounts;
    private final SecretMatcher matcher;

    public InMemoryIdentityVerifier(Map<String, Account> accounts) {
        this(accounts, SecretMatcher.constantTime());
    }

    @Override
    public Optional<Principal> verifyCredentials(String identifier, String secret) {
        if (identifier == null || secret == null) return Optional.empty();

        Account account = accounts.get(identifier.trim());
        String stored = (account == null || account.secret() == null) ? NO_ACCOUNT_SECRET : account.secret();
        boolean matches = matcher.matches(secret, stored);

        if (account == null || account.secret() == null || !matches) return Optional.empty();
        return Optional.of(new Principal(account.subjectId(), account.scopes()));
    }
}
