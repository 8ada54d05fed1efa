package chronokms.adapter.in.dto;

/**
 * DTO for creating the first admin account.
 *
 * @param username login name (required)
 * @param password password (required)
 * @param email    optional contact address
 */
public record SetupRequest(String username, String password, String email) {}
