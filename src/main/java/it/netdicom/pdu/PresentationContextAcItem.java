package it.netdicom.pdu;

import java.util.Optional;

/**
 * Presentation context result. The transfer syntax is only significant when the result is acceptance.
 */
public record PresentationContextAcItem(int contextId, int result, Optional<String> transferSyntax) {
}
