package com.logvault.application.dto;

public record StatsDto(
        Long totalRecords,
        Double dbSizeMb,
        String dbPath,
        String lastImport,
        String error) {

    public static StatsDto failure(String message) {
        return new StatsDto(null, null, null, null, message);
    }

    public boolean isFailure() {
        return error != null;
    }
}
