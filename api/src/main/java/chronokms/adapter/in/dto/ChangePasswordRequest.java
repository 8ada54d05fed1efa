package chronokms.adapter.in.dto;

public record ChangePasswordRequest(String currentPassword, String newPassword) {}
