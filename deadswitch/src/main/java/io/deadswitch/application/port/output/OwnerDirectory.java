package io.deadswitch.application.port.output;

import io.deadswitch.domain.model.Owner;

import java.util.Optional;

/**
 * Looks up the account holder of a secret. Accounts are managed elsewhere.
 */
public interface OwnerDirectory {

    Optional<Owner> findOwner(String userId);
}
