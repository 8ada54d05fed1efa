package chronokms.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.admin.AdminAccount;

/**
 * Storage for admin accounts.
 */
public interface AdminRepository {

    /**
     * Store the first account. The check and the insert are atomic.
     *
     * @return true if saved, false if any account already exists
     */
    Uni<Boolean> saveFirst(AdminAccount account);

    /**
     * Replace an existing account.
     */
    Uni<Void> update(AdminAccount account);

    Uni<Optional<AdminAccount>> findById(String id);

    Uni<Optional<AdminAccount>> findByUsername(String username);

    Uni<Long> count();
}
