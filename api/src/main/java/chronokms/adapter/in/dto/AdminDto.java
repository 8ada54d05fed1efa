package chronokms.adapter.in.dto;

import java.time.Instant;

import chronokms.core.model.admin.AdminAccount;

/**
 * Admin account as returned by the API. The password hash is never included.
 */
public record AdminDto(String id, String username, String email, boolean setupRequired, Instant createdAt) {

    public static AdminDto fromModel(AdminAccount admin) {
        return new AdminDto(admin.id(), admin.username(), admin.email(), admin.setupRequired(), admin.createdAt());
    }
}
