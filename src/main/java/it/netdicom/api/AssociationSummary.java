package it.netdicom.api;

import java.util.List;

public record AssociationSummary(
    long id,
    String name,
    String role,
    String localAeTitle,
    String peerAeTitle,
    String peerAddress,
    String status,
    String state,
    List<String> acceptedSopClasses
) {
}
