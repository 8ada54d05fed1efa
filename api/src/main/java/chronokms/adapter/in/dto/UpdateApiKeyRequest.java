package chronokms.adapter.in.dto;

public record UpdateApiKeyRequest(String name, Boolean enabled) {}
