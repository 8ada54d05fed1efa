package chronokms.adapter.in.dto;

public record LoginRequest(String username, String password) {}
