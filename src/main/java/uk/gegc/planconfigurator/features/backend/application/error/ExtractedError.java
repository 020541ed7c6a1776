package uk.gegc.planconfigurator.features.backend.application.error;

public record ExtractedError(String message, String detail) {
}
