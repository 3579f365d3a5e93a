package it.netdicom.api;

public record EchoResponse(
    String calledAeTitle,
    String associationStatus,
    String status,
    String statusCategory,
    String detail
) {
}
